package com.event.reconciliation.feed;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.sync.IntakeFeed;
import com.event.reconciliation.sync.IntakeFeedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Intake feed backed by a spreadsheet CSV export.
 *
 * <p>Expected format:</p>
 * <pre>
 * Submitted On,Name,Your Email,Group/Organization Name,Phone Number,Desired Event Date
 * 9/26/2025 10:00:00,Jane Smith,jane.smith@school.com,Springfield Elementary,(555) 123-4567,11/15/2025
 * </pre>
 *
 * <p>The first record is the header; columns are located by name (see {@link IntakeColumn}),
 * so their order does not matter and unknown columns are ignored. Fields follow RFC 4180
 * quoting, including embedded commas, doubled quotes and line breaks. Each row's
 * {@code externalRowId} is its sheet row number: the header is row 1, the first data row is row 2.
 * Blank rows are skipped but still counted.</p>
 *
 * <p>The source is re-opened on every {@link #readRows()}.</p>
 */
public class CsvIntakeFeed implements IntakeFeed {
    private static final Logger log = LoggerFactory.getLogger(CsvIntakeFeed.class);

    private final String name;
    private final ReaderSource source;

    public CsvIntakeFeed(String name, ReaderSource source) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.source = Objects.requireNonNull(source, "source is required");
    }

    public static CsvIntakeFeed fromPath(Path path) {
        return new CsvIntakeFeed("csv:" + path.getFileName(),
                () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static CsvIntakeFeed fromString(String name, String content) {
        return new CsvIntakeFeed(name, () -> new StringReader(content));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<IncomingRow> readRows() {
        List<List<String>> records;
        try (Reader reader = source.open()) {
            records = parse(reader instanceof BufferedReader b ? b : new BufferedReader(reader));
        } catch (IOException e) {
            throw new IntakeFeedException("Failed to read CSV feed " + name + ": " + e.getMessage(), e);
        }
        if (records.isEmpty()) {
            log.info("feed.empty feed={}", name);
            return List.of();
        }

        Map<IntakeColumn, Integer> columns = mapColumns(records.get(0));
        List<IncomingRow> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            List<String> record = records.get(i);
            if (isBlank(record)) {
                continue;
            }
            rows.add(toRow(String.valueOf(i + 1), record, columns));
        }
        log.debug("feed.read feed={} rows={} columns={}", name, rows.size(), columns.keySet());
        return rows;
    }

    private Map<IntakeColumn, Integer> mapColumns(List<String> header) {
        Map<String, Integer> headerIndex = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String normalized = IntakeColumn.normalizeHeader(header.get(i));
            if (!normalized.isEmpty()) {
                headerIndex.putIfAbsent(normalized, i);
            }
        }
        Map<IntakeColumn, Integer> columns = new EnumMap<>(IntakeColumn.class);
        for (IntakeColumn column : IntakeColumn.values()) {
            column.indexIn(headerIndex).ifPresent(index -> columns.put(column, index));
        }
        if (!columns.containsKey(IntakeColumn.EMAIL) && !columns.containsKey(IntakeColumn.ORGANIZATION)) {
            log.warn("feed.header.unrecognized feed={} header={}", name, header);
        }
        return columns;
    }

    private static IncomingRow toRow(String rowNumber, List<String> record, Map<IntakeColumn, Integer> columns) {
        String contactName = field(record, columns, IntakeColumn.CONTACT_NAME);
        if (contactName == null || contactName.isBlank()) {
            String first = field(record, columns, IntakeColumn.FIRST_NAME);
            String last = field(record, columns, IntakeColumn.LAST_NAME);
            contactName = String.join(" ", first != null ? first.trim() : "", last != null ? last.trim() : "").trim();
        }
        return IncomingRow.builder()
                .externalRowId(rowNumber)
                .externalId(field(record, columns, IntakeColumn.EXTERNAL_ID))
                .organizationName(field(record, columns, IntakeColumn.ORGANIZATION))
                .contactName(contactName)
                .email(field(record, columns, IntakeColumn.EMAIL))
                .phone(field(record, columns, IntakeColumn.PHONE))
                .department(field(record, columns, IntakeColumn.DEPARTMENT))
                .desiredEventDate(field(record, columns, IntakeColumn.DESIRED_EVENT_DATE))
                .submittedAt(field(record, columns, IntakeColumn.SUBMITTED_AT))
                .status(field(record, columns, IntakeColumn.STATUS))
                .message(field(record, columns, IntakeColumn.MESSAGE))
                .previouslyHosted(field(record, columns, IntakeColumn.PREVIOUSLY_HOSTED))
                .notes(field(record, columns, IntakeColumn.NOTES))
                .build();
    }

    private static String field(List<String> record, Map<IntakeColumn, Integer> columns, IntakeColumn column) {
        Integer index = columns.get(column);
        if (index == null || index >= record.size()) {
            return null;
        }
        return record.get(index);
    }

    private static boolean isBlank(List<String> record) {
        for (String value : record) {
            if (!value.isBlank()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits RFC 4180 content into records of fields.
     */
    static List<List<String>> parse(BufferedReader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> record = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean pending = false;

        int c;
        while ((c = reader.read()) != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == '"') {
                    reader.mark(1);
                    int next = reader.read();
                    if (next == '"') {
                        field.append('"');
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            reader.reset();
                        }
                    }
                } else {
                    field.append(ch);
                }
                continue;
            }
            switch (ch) {
                case '"' -> {
                    inQuotes = true;
                    pending = true;
                }
                case ',' -> {
                    record.add(field.toString());
                    field.setLength(0);
                    pending = true;
                }
                case '\r' -> {
                    reader.mark(1);
                    if (reader.read() != '\n') {
                        reader.reset();
                    }
                    endRecord(records, record, field);
                    record = new ArrayList<>();
                    pending = false;
                }
                case '\n' -> {
                    endRecord(records, record, field);
                    record = new ArrayList<>();
                    pending = false;
                }
                default -> {
                    field.append(ch);
                    pending = true;
                }
            }
        }
        if (inQuotes) {
            throw new IOException("Unterminated quoted field at end of input");
        }
        if (pending) {
            endRecord(records, record, field);
        }
        return records;
    }

    private static void endRecord(List<List<String>> records, List<String> record, StringBuilder field) {
        record.add(field.toString());
        field.setLength(0);
        records.add(record);
    }
}
