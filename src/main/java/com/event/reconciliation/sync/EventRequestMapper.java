package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.ExistingEventRequest;
import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.core.model.MatchResult;
import com.event.reconciliation.core.model.NormalizedRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Turns normalized rows into persisted records: a new record for an unmatched row, an updated
 * copy of the matched record otherwise.
 *
 * <p>A sync never changes the status or the submission time of an existing record. Row
 * linkage ({@code externalRowId}, {@code externalId}) is attached only when the record has none;
 * a record already linked to another row keeps its link.</p>
 */
public class EventRequestMapper {
    private static final Logger log = LoggerFactory.getLogger(EventRequestMapper.class);

    private final Clock clock;
    private final StatusResolver statusResolver;

    public EventRequestMapper(Clock clock, StatusResolver statusResolver) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.statusResolver = Objects.requireNonNull(statusResolver, "statusResolver is required");
    }

    public ExistingEventRequest toNewRequest(NormalizedRow row, String actorId) {
        Instant now = clock.instant();
        IncomingRow source = row.source();
        return ExistingEventRequest.builder()
                .externalRowId(row.externalRowId().orElse(null))
                .externalId(row.externalId().orElse(null))
                .email(row.email().orElse(null))
                .phone(trimToNull(source != null ? source.phone() : null))
                .firstName(trimToNull(row.firstName()))
                .lastName(trimToNull(row.lastName()))
                .organizationName(trimToNull(row.organizationName()))
                .department(trimToNull(source != null ? source.department() : null))
                .desiredEventDate(row.desiredEventDate().orElse(null))
                .submittedAt(row.submittedAt().orElse(now))
                .status(statusResolver.resolve(row))
                .message(trimToNull(source != null ? source.message() : null))
                .previouslyHosted(trimToNull(source != null ? source.previouslyHosted() : null))
                .duplicateNotes(trimToNull(source != null ? source.notes() : null))
                .createdBy(actorId)
                .lastSyncedAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Applies a matched row to its record according to the merge policy and appends the
     * match's audit note to {@code duplicateNotes}.
     */
    public ExistingEventRequest merge(ExistingEventRequest existing, NormalizedRow row,
                                      MatchResult match, MergePolicy policy) {
        Instant now = clock.instant();
        IncomingRow source = row.source();
        ExistingEventRequest.Builder builder = existing.toBuilder()
                .email(pick(policy, existing.getEmail(), row.email().orElse(null)))
                .phone(pick(policy, existing.getPhone(), source != null ? source.phone() : null))
                .firstName(pick(policy, existing.getFirstName(), row.firstName()))
                .lastName(pick(policy, existing.getLastName(), row.lastName()))
                .organizationName(pick(policy, existing.getOrganizationName(), row.organizationName()))
                .department(pick(policy, existing.getDepartment(), source != null ? source.department() : null))
                .message(pick(policy, existing.getMessage(), source != null ? source.message() : null))
                .previouslyHosted(pick(policy, existing.getPreviouslyHosted(),
                        source != null ? source.previouslyHosted() : null))
                .duplicateNotes(appendNote(existing.getDuplicateNotes(), match.auditNote()))
                .lastSyncedAt(now)
                .updatedAt(now);

        if (row.desiredEventDate().isPresent()
                && (policy == MergePolicy.OVERWRITE_NON_BLANK || existing.getDesiredEventDate() == null)) {
            builder.desiredEventDate(row.desiredEventDate().get());
        }

        builder.externalRowId(link("externalRowId", existing.getId(), existing.getExternalRowId(),
                row.externalRowId().orElse(null)));
        builder.externalId(link("externalId", existing.getId(), existing.getExternalId(),
                row.externalId().orElse(null)));
        return builder.build();
    }

    private static String link(String field, String requestId, String stored, String incoming) {
        if (isBlank(stored)) {
            return incoming;
        }
        if (incoming != null && !stored.equals(incoming)) {
            log.warn("sync.link.conflict field={} requestId={} stored={} incoming={}",
                    field, requestId, stored, incoming);
        }
        return stored;
    }

    private static String pick(MergePolicy policy, String stored, String incoming) {
        if (isBlank(incoming)) {
            return stored;
        }
        if (policy == MergePolicy.FILL_BLANKS_ONLY && !isBlank(stored)) {
            return stored;
        }
        return incoming.trim();
    }

    static String appendNote(String notes, String note) {
        if (isBlank(notes)) {
            return note;
        }
        if (notes.contains(note)) {
            return notes;
        }
        return notes + "\n" + note;
    }

    private static String trimToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
