package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.IncomingRow;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Assigns a deterministic external id to rows the feed left without one, so that a re-sync of
 * the same row links to the record created from it.
 *
 * <p>The id is {@code auto-} followed by the first 20 hex digits of the SHA-256 of
 * {@code email|submittedAt|organization|contact|eventDate} (blank parts replaced by
 * {@code no-email}, {@code no-date}, {@code no-org}, {@code no-name}, {@code no-event-date}).
 * The event date is part of the key, so two events requested in one submission never share an id.</p>
 */
public class ExternalIdGenerator {

    static final String PREFIX = "auto-";
    private static final int HASH_LENGTH = 20;

    /**
     * Returns the row unchanged if it has an external id, otherwise a copy with a generated one.
     */
    public IncomingRow ensureExternalId(IncomingRow row) {
        if (row.externalId() != null && !row.externalId().isBlank()) {
            return row;
        }
        return row.withExternalId(generate(row));
    }

    public String generate(IncomingRow row) {
        String key = String.join("|",
                orPlaceholder(row.email(), "no-email"),
                orPlaceholder(row.submittedAt(), "no-date"),
                orPlaceholder(row.organizationName(), "no-org"),
                orPlaceholder(row.contactName(), "no-name"),
                orPlaceholder(row.desiredEventDate(), "no-event-date"));
        return PREFIX + sha256Hex(key).substring(0, HASH_LENGTH);
    }

    private static String orPlaceholder(String value, String placeholder) {
        return value == null || value.isBlank() ? placeholder : value.trim();
    }

    private static String sha256Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
