package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.IncomingRow;

import java.util.List;

/**
 * Source of raw intake rows, read in full once per sync pass.
 */
public interface IntakeFeed {

    /**
     * Reads all rows currently in the feed.
     *
     * @throws IntakeFeedException if the feed cannot be read
     */
    List<IncomingRow> readRows();

    /**
     * Short name of the feed for logs and audit entries.
     */
    String getName();
}
