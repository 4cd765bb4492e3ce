package com.event.reconciliation.feed;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.sync.IntakeFeedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvIntakeFeedTest {

    @Test
    @DisplayName("Should map columns by header name and number rows from the sheet")
    void mapsColumns() {
        String csv = """
                Submitted On,Name,Your Email,Group/Organization Name,Phone Number,Desired Event Date,Status
                9/26/2025 10:00:00,Jane Smith,jane.smith@school.com,Springfield Elementary,(555) 123-4567,11/15/2025,new
                9/26/2025 10:01:00,Sam Coach,coach@school.edu,Lincoln High School Band,,12/20/2025,
                """;

        List<IncomingRow> rows = CsvIntakeFeed.fromString("sheet", csv).readRows();

        assertEquals(2, rows.size());
        IncomingRow first = rows.get(0);
        assertEquals("2", first.externalRowId());
        assertEquals("9/26/2025 10:00:00", first.submittedAt());
        assertEquals("Jane Smith", first.contactName());
        assertEquals("jane.smith@school.com", first.email());
        assertEquals("Springfield Elementary", first.organizationName());
        assertEquals("(555) 123-4567", first.phone());
        assertEquals("11/15/2025", first.desiredEventDate());
        assertEquals("new", first.status());
        assertNull(first.externalId());
        assertEquals("3", rows.get(1).externalRowId());
        assertEquals("", rows.get(1).phone());
    }

    @Test
    @DisplayName("Should match headers case-insensitively regardless of column order")
    void headerAliases() {
        String csv = """
                EVENT DATE,Organization,E-mail,First Name,Last Name,External ID
                45945,Cherokee Middle School,sarah@school.com,Sarah,Johnson,abc-1
                """;

        IncomingRow row = CsvIntakeFeed.fromString("sheet", csv).readRows().get(0);

        assertEquals("45945", row.desiredEventDate());
        assertEquals("Cherokee Middle School", row.organizationName());
        assertEquals("sarah@school.com", row.email());
        assertEquals("Sarah Johnson", row.contactName());
        assertEquals("abc-1", row.externalId());
    }

    @Test
    @DisplayName("Should recognize the first header behind a byte-order mark")
    void byteOrderMark() {
        String csv = "\uFEFFSubmitted On,Name,Your Email\n9/26/2025 10:00:00,Jane Smith,jane.smith@school.com\n";

        IncomingRow row = CsvIntakeFeed.fromString("sheet", csv).readRows().get(0);

        assertEquals("9/26/2025 10:00:00", row.submittedAt());
        assertEquals("Jane Smith", row.contactName());
    }

    @Test
    @DisplayName("Should skip blank rows but keep counting sheet rows")
    void blankRows() {
        String csv = "Name,Email\nA One,a@x.com\n,\n\nB Two,b@x.com\n";

        List<IncomingRow> rows = CsvIntakeFeed.fromString("sheet", csv).readRows();

        assertEquals(2, rows.size());
        assertEquals("2", rows.get(0).externalRowId());
        assertEquals("5", rows.get(1).externalRowId());
    }

    @Test
    @DisplayName("Should return no rows for empty input")
    void emptyInput() {
        assertTrue(CsvIntakeFeed.fromString("sheet", "").readRows().isEmpty());
        assertTrue(CsvIntakeFeed.fromString("sheet", "Name,Email\n").readRows().isEmpty());
    }

    @Test
    @DisplayName("Should read from a file on every call")
    void readsFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("intake.csv");
        Files.writeString(file, "Name,Email\nA One,a@x.com\n", StandardCharsets.UTF_8);
        CsvIntakeFeed feed = CsvIntakeFeed.fromPath(file);

        assertEquals(1, feed.readRows().size());
        Files.writeString(file, "Name,Email\nA One,a@x.com\nB Two,b@x.com\n", StandardCharsets.UTF_8);
        assertEquals(2, feed.readRows().size());
        assertEquals("csv:intake.csv", feed.getName());
    }

    @Test
    @DisplayName("Should wrap read failures")
    void readFailure(@TempDir Path dir) {
        CsvIntakeFeed feed = CsvIntakeFeed.fromPath(dir.resolve("missing.csv"));

        assertThrows(IntakeFeedException.class, feed::readRows);
    }

    @Nested
    @DisplayName("RFC 4180 parsing")
    class ParserTests {

        private List<List<String>> parse(String content) throws IOException {
            return CsvIntakeFeed.parse(new BufferedReader(new StringReader(content)));
        }

        @Test
        @DisplayName("Should handle quoted commas, doubled quotes and line breaks")
        void quotedFields() throws IOException {
            List<List<String>> records = parse("a,\"b, c\",\"say \"\"hi\"\"\",\"line1\nline2\"\r\nx,y,z,w");

            assertEquals(2, records.size());
            assertEquals(List.of("a", "b, c", "say \"hi\"", "line1\nline2"), records.get(0));
            assertEquals(List.of("x", "y", "z", "w"), records.get(1));
        }

        @Test
        @DisplayName("Should keep empty trailing fields")
        void trailingEmpty() throws IOException {
            assertEquals(List.of(List.of("a", "", "")), parse("a,,\n"));
        }

        @Test
        @DisplayName("Should reject an unterminated quote")
        void unterminatedQuote() {
            assertThrows(IOException.class, () -> parse("a,\"open"));
        }

        @Test
        @DisplayName("A quoted multi-line field counts as one sheet row")
        void multiLineRowNumbering() {
            String csv = "Name,Message\nA One,\"first\nsecond\"\nB Two,hello\n";

            List<IncomingRow> rows = CsvIntakeFeed.fromString("sheet", csv).readRows();

            assertEquals("first\nsecond", rows.get(0).message());
            assertEquals("3", rows.get(1).externalRowId());
        }
    }
}
