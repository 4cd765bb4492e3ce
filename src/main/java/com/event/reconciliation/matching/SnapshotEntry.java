package com.event.reconciliation.matching;

import com.event.reconciliation.core.model.ExistingEventRequest;
import com.event.reconciliation.rules.RowNormalizer;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * An existing record together with its canonical comparison fields, computed once per snapshot.
 */
public record SnapshotEntry(
        ExistingEventRequest request,
        Optional<String> externalRowId,
        Optional<String> externalId,
        Optional<String> email,
        Optional<String> phone,
        String firstName,
        String lastName,
        Optional<LocalDate> desiredEventDate,
        Optional<Instant> submittedAt
) {

    public static SnapshotEntry of(ExistingEventRequest request) {
        Objects.requireNonNull(request, "request is required");
        return new SnapshotEntry(
                request,
                trimmed(request.getExternalRowId()),
                trimmed(request.getExternalId()),
                RowNormalizer.normalizeEmail(request.getEmail()),
                RowNormalizer.normalizePhone(request.getPhone()),
                RowNormalizer.normalizeNamePart(request.getFirstName()),
                RowNormalizer.normalizeNamePart(request.getLastName()),
                Optional.ofNullable(request.getDesiredEventDate()),
                Optional.ofNullable(request.getSubmittedAt())
        );
    }

    public String id() {
        return request.getId();
    }

    private static Optional<String> trimmed(String value) {
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
    }
}
