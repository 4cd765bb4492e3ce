package com.event.reconciliation.rules;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.core.model.NormalizedRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RowNormalizerTest {

    private final RowNormalizer normalizer = new RowNormalizer();

    @Test
    @DisplayName("Should normalize a complete row")
    void normalizesCompleteRow() {
        IncomingRow row = IncomingRow.builder()
                .externalRowId(" 12 ")
                .organizationName("  Springfield Elementary ")
                .contactName("Jane   Smith")
                .email("  Jane.Smith@School.COM ")
                .phone("(555) 123-4567")
                .desiredEventDate("11/15/2025")
                .submittedAt("9/26/2025 10:00:00")
                .build();

        NormalizedRow normalized = normalizer.normalize(row);

        assertEquals(Optional.of("12"), normalized.externalRowId());
        assertTrue(normalized.externalId().isEmpty());
        assertEquals("Springfield Elementary", normalized.organizationName());
        assertEquals("Jane", normalized.firstName());
        assertEquals("Smith", normalized.lastName());
        assertEquals(Optional.of("jane.smith@school.com"), normalized.email());
        assertEquals(Optional.of("5551234567"), normalized.phone());
        assertEquals(Optional.of(LocalDate.of(2025, 11, 15)), normalized.desiredEventDate());
        assertEquals(Optional.of(Instant.parse("2025-09-26T10:00:00Z")), normalized.submittedAt());
        assertSame(row, normalized.source());
    }

    @Test
    @DisplayName("Should never throw for an empty row")
    void emptyRow() {
        NormalizedRow normalized = normalizer.normalize(IncomingRow.builder().build());

        assertTrue(normalized.externalRowId().isEmpty());
        assertTrue(normalized.email().isEmpty());
        assertTrue(normalized.phone().isEmpty());
        assertTrue(normalized.desiredEventDate().isEmpty());
        assertTrue(normalized.submittedAt().isEmpty());
        assertEquals("", normalized.organizationName());
        assertFalse(normalized.hasFullName());
    }

    @Test
    @DisplayName("Should leave malformed dates absent instead of failing")
    void malformedDates() {
        NormalizedRow normalized = normalizer.normalize(IncomingRow.builder()
                .desiredEventDate("next spring")
                .submittedAt("yesterday")
                .build());

        assertTrue(normalized.desiredEventDate().isEmpty());
        assertTrue(normalized.submittedAt().isEmpty());
    }

    @Nested
    @DisplayName("Field helpers")
    class HelperTests {

        @Test
        @DisplayName("Should treat blank email as absent")
        void blankEmail() {
            assertTrue(RowNormalizer.normalizeEmail("   ").isEmpty());
            assertTrue(RowNormalizer.normalizeEmail(null).isEmpty());
        }

        @ParameterizedTest
        @CsvSource({
                "'(555) 123-4567', 5551234567",
                "555-123-4567, 5551234567",
                "555.123.4567, 5551234567",
                "'+1 555 123 4567', 15551234567"
        })
        @DisplayName("Should keep only phone digits")
        void phoneDigits(String input, String expected) {
            assertEquals(Optional.of(expected), RowNormalizer.normalizePhone(input));
        }

        @Test
        @DisplayName("Should treat a phone without digits as absent")
        void phoneWithoutDigits() {
            assertTrue(RowNormalizer.normalizePhone("n/a").isEmpty());
        }

        @ParameterizedTest
        @CsvSource({
                "'Jane Smith', Jane, Smith",
                "'Mary Ann  van der Berg', Mary, 'Ann van der Berg'",
                "'Cher', Cher, ''",
                "'  ', '', ''"
        })
        @DisplayName("Should split the first token from the rest of the name")
        void splitsNames(String input, String first, String last) {
            String[] parts = RowNormalizer.splitContactName(input);
            assertEquals(first, parts[0]);
            assertEquals(last, parts[1]);
        }

        @Test
        @DisplayName("Should lowercase and collapse name parts for comparison")
        void namePart() {
            assertEquals("van der berg", RowNormalizer.normalizeNamePart("  Van   der Berg "));
            assertEquals("", RowNormalizer.normalizeNamePart(null));
        }
    }
}
