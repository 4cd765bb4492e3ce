package com.event.reconciliation.sync;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.rules.RowNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class StatusResolverTest {

    private final StatusResolver resolver = new StatusResolver(
            Clock.fixed(Instant.parse("2025-10-01T12:00:00Z"), ZoneOffset.UTC), ZoneOffset.UTC);
    private final RowNormalizer normalizer = new RowNormalizer();

    @ParameterizedTest
    @CsvSource({
            "'', 11/15/2025, new",
            "new, 11/15/2025, new",
            "NEW, 9/15/2025, completed",
            "'', 9/30/2025, completed",
            "'', 10/1/2025, new",
            "scheduled, 9/15/2025, scheduled",
            "' contact completed ', 11/15/2025, contact completed",
            "'', '', new",
            "'', TBD, new"
    })
    @DisplayName("Should derive the status of a new request")
    void resolves(String feedStatus, String eventDate, String expected) {
        IncomingRow row = IncomingRow.builder().status(feedStatus).desiredEventDate(eventDate).build();

        assertEquals(expected, resolver.resolve(normalizer.normalize(row)));
    }
}
