package com.event.reconciliation.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class IntakeDateParserTest {

    private final IntakeDateParser parser = new IntakeDateParser();

    @Nested
    @DisplayName("Event dates")
    class DateTests {

        @ParameterizedTest
        @CsvSource({
                "10/15/2025, 2025-10-15",
                "1/5/2025, 2025-01-05",
                "01/05/2025, 2025-01-05",
                "2025-11-15, 2025-11-15",
                "2025/11/15, 2025-11-15",
                "'November 15, 2025', 2025-11-15",
                "'Nov 15, 2025', 2025-11-15",
                "12/20/25, 2025-12-20",
                "2025-11-15T00:00:00.000Z, 2025-11-15"
        })
        @DisplayName("Should parse supported date formats")
        void parsesFormats(String input, String expected) {
            assertEquals(LocalDate.parse(expected), parser.parseDate(input).orElseThrow());
        }

        @Test
        @DisplayName("Should convert spreadsheet serial numbers from the 1899-12-30 epoch")
        void parsesSerial() {
            assertEquals(LocalDate.of(2025, 10, 15), parser.parseDate("45945").orElseThrow());
            assertEquals(LocalDate.of(1900, 1, 1), parser.parseDate("2").orElseThrow());
        }

        @Test
        @DisplayName("Should reduce a date-time to its date in the configured zone")
        void reducesDateTimeInZone() {
            IntakeDateParser chicago = new IntakeDateParser(ZoneId.of("America/Chicago"));
            assertEquals(LocalDate.of(2025, 11, 14), chicago.parseDate("2025-11-15T02:00:00Z").orElseThrow());
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "TBD", "sometime in november", "13/45/2025", "2/30/2025", "0", "-5"})
        @DisplayName("Should return empty for blank or unparseable input")
        void unparseableIsEmpty(String input) {
            assertTrue(parser.parseDate(input).isEmpty());
        }
    }

    @Nested
    @DisplayName("Submission timestamps")
    class DateTimeTests {

        @ParameterizedTest
        @CsvSource({
                "9/26/2025 10:00:00, 2025-09-26T10:00:00Z",
                "9/26/2025 10:05, 2025-09-26T10:05:00Z",
                "'9/26/2025, 2:30:00 PM', 2025-09-26T14:30:00Z",
                "9/26/2025 2:30 pm, 2025-09-26T14:30:00Z",
                "2025-09-26 10:06:00, 2025-09-26T10:06:00Z",
                "2025-09-26T10:00:00, 2025-09-26T10:00:00Z",
                "2025-09-26T10:00:00Z, 2025-09-26T10:00:00Z",
                "2025-09-26T06:00:00-04:00, 2025-09-26T10:00:00Z",
                "9/26/2025, 2025-09-26T00:00:00Z"
        })
        @DisplayName("Should parse supported date-time formats as UTC by default")
        void parsesFormats(String input, String expected) {
            assertEquals(Instant.parse(expected), parser.parseDateTime(input).orElseThrow());
        }

        @Test
        @DisplayName("Should keep the time of day carried by a fractional serial")
        void parsesFractionalSerial() {
            // 0.5 of a day is noon
            assertEquals(Instant.parse("2025-10-15T12:00:00Z"), parser.parseDateTime("45945.5").orElseThrow());
        }

        @Test
        @DisplayName("Should interpret zone-less values in the configured zone")
        void usesConfiguredZone() {
            IntakeDateParser newYork = new IntakeDateParser(ZoneId.of("America/New_York"));
            assertEquals(Instant.parse("2025-09-26T14:00:00Z"),
                    newYork.parseDateTime("9/26/2025 10:00:00").orElseThrow());
        }

        @Test
        @DisplayName("Should return empty rather than defaulting to now")
        void unparseableIsEmpty() {
            assertTrue(parser.parseDateTime("not a timestamp").isEmpty());
            assertTrue(parser.parseDateTime(null).isEmpty());
        }
    }
}
