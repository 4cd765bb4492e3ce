package com.event.reconciliation.sync;

/**
 * How a matched row's fields are applied to the existing record.
 */
public enum MergePolicy {
    /**
     * Non-blank incoming values replace stored ones.
     */
    OVERWRITE_NON_BLANK,

    /**
     * Only blank stored fields are filled; manual edits are preserved.
     */
    FILL_BLANKS_ONLY
}
