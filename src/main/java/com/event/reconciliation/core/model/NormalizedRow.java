package com.event.reconciliation.core.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical comparison shape of an {@link IncomingRow}.
 * Absent values are {@link Optional#empty()}, never a default: an unparseable event date
 * must not be able to equal another record's date.
 *
 * @param externalRowId    trimmed feed row id, empty if absent
 * @param externalId       trimmed external id, empty if absent
 * @param organizationName trimmed organization name, case preserved ("" if absent)
 * @param firstName        first token of the contact name ("" if absent)
 * @param lastName         remaining tokens of the contact name ("" if absent)
 * @param email            lowercased, trimmed email
 * @param phone            digits-only phone
 * @param desiredEventDate calendar date of the requested event
 * @param submittedAt      submission instant
 * @param source           the raw row this was derived from
 */
public record NormalizedRow(
        Optional<String> externalRowId,
        Optional<String> externalId,
        String organizationName,
        String firstName,
        String lastName,
        Optional<String> email,
        Optional<String> phone,
        Optional<LocalDate> desiredEventDate,
        Optional<Instant> submittedAt,
        IncomingRow source
) {
    public NormalizedRow {
        Objects.requireNonNull(externalRowId, "externalRowId is required");
        Objects.requireNonNull(externalId, "externalId is required");
        Objects.requireNonNull(email, "email is required");
        Objects.requireNonNull(phone, "phone is required");
        Objects.requireNonNull(desiredEventDate, "desiredEventDate is required");
        Objects.requireNonNull(submittedAt, "submittedAt is required");
        organizationName = organizationName != null ? organizationName : "";
        firstName = firstName != null ? firstName : "";
        lastName = lastName != null ? lastName : "";
    }

    /**
     * Returns true if both name components are present.
     */
    public boolean hasFullName() {
        return !firstName.isBlank() && !lastName.isBlank();
    }
}
