package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.NormalizedRow;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Objects;

/**
 * Chooses the initial status of a request created by the sync. Existing records keep their status.
 *
 * <ol>
 *   <li>a non-blank feed status other than {@code new} is used as-is (trimmed)</li>
 *   <li>an event date before today becomes {@code completed}</li>
 *   <li>anything else is {@code new}</li>
 * </ol>
 */
public class StatusResolver {

    public static final String STATUS_NEW = "new";
    public static final String STATUS_COMPLETED = "completed";

    private final Clock clock;
    private final ZoneId zone;

    public StatusResolver(Clock clock, ZoneId zone) {
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    public String resolve(NormalizedRow row) {
        String feedStatus = row.source() != null ? row.source().status() : null;
        if (feedStatus != null && !feedStatus.isBlank()
                && !STATUS_NEW.equals(feedStatus.trim().toLowerCase(Locale.ROOT))) {
            return feedStatus.trim();
        }
        LocalDate today = LocalDate.now(clock.withZone(zone));
        if (row.desiredEventDate().isPresent() && row.desiredEventDate().get().isBefore(today)) {
            return STATUS_COMPLETED;
        }
        return STATUS_NEW;
    }
}
