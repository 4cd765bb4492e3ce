package com.event.reconciliation.core.model;

/**
 * The matching tier that produced a {@link MatchResult}.
 * Declaration order is precedence order.
 */
public enum MatchTier {
    /**
     * Tier 1: the feed row is already linked to the record by external row id.
     * Wins unconditionally; no other field is consulted.
     */
    ID("Tier 1 external row id"),

    /**
     * Tier 2: same email, same event date, submissions within the tolerance window.
     */
    EXACT("Tier 2 email + event date + submission time"),

    /**
     * Tier 3, priority 3: same email, same event date, similar organization.
     */
    FUZZY_EMAIL("Tier 3 email + event date + organization similarity"),

    /**
     * Tier 3, priority 4a: same phone, same event date, similar organization.
     */
    FUZZY_PHONE("Tier 3 phone + event date + organization similarity"),

    /**
     * Tier 3, priority 4b: same full name, same event date, similar organization.
     */
    FUZZY_NAME("Tier 3 full name + event date + organization similarity"),

    /**
     * No tier matched; the row is a new request.
     */
    NONE("no match");

    private final String label;

    MatchTier(String label) {
        this.label = label;
    }

    /**
     * Human-readable label written into audit notes.
     */
    public String label() {
        return label;
    }

    /**
     * Returns true for the approximate, similarity-gated tiers.
     */
    public boolean isFuzzy() {
        return this == FUZZY_EMAIL || this == FUZZY_PHONE || this == FUZZY_NAME;
    }
}
