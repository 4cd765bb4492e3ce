package com.event.reconciliation.feed;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.sync.IntakeFeed;
import com.event.reconciliation.sync.IntakeFeedException;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Intake feed reading a JSON array of row objects.
 *
 * <pre>
 * [
 *   {"rowIndex": 2, "email": "jane.smith@school.com", "organizationName": "Springfield Elementary",
 *    "desiredEventDate": "11/15/2025", "submittedOn": "9/26/2025 10:00:00"}
 * ]
 * </pre>
 *
 * <p>Unknown properties are ignored and numeric values are read as text, so spreadsheet serial
 * dates pass through unchanged. A row without {@code externalRowId}/{@code rowIndex} is left
 * without a row id: array positions would share a namespace with declared row indexes, so such a
 * row is linked through its generated external id instead.</p>
 */
public class JsonIntakeFeed implements IntakeFeed {
    private static final Logger log = LoggerFactory.getLogger(JsonIntakeFeed.class);

    private final String name;
    private final ReaderSource source;
    private final ObjectMapper objectMapper;

    public JsonIntakeFeed(String name, ReaderSource source) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.source = Objects.requireNonNull(source, "source is required");
        this.objectMapper = new ObjectMapper();
    }

    public static JsonIntakeFeed fromPath(Path path) {
        return new JsonIntakeFeed("json:" + path.getFileName(),
                () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static JsonIntakeFeed fromString(String name, String content) {
        return new JsonIntakeFeed(name, () -> new StringReader(content));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public List<IncomingRow> readRows() {
        List<JsonRow> parsed;
        try (Reader reader = source.open()) {
            parsed = objectMapper.readValue(reader, new TypeReference<List<JsonRow>>() {});
        } catch (IOException e) {
            throw new IntakeFeedException("Failed to read JSON feed " + name + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            return List.of();
        }

        List<IncomingRow> rows = new ArrayList<>(parsed.size());
        for (JsonRow row : parsed) {
            if (row != null) {
                rows.add(row.toIncomingRow());
            }
        }
        log.debug("feed.read feed={} rows={}", name, rows.size());
        return rows;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record JsonRow(
            @JsonAlias({"rowIndex", "rowNumber"}) String externalRowId,
            @JsonAlias({"external_id", "uniqueId"}) String externalId,
            @JsonAlias({"organization", "groupOrganization"}) String organizationName,
            @JsonAlias({"name", "fullName"}) String contactName,
            String firstName,
            String lastName,
            @JsonAlias({"emailAddress"}) String email,
            @JsonAlias({"phoneNumber"}) String phone,
            String department,
            @JsonAlias({"eventDate"}) String desiredEventDate,
            @JsonAlias({"submittedOn", "timestamp"}) String submittedAt,
            String status,
            String message,
            String previouslyHosted,
            String notes
    ) {
        IncomingRow toIncomingRow() {
            String contact = contactName;
            if (contact == null || contact.isBlank()) {
                contact = String.join(" ", firstName != null ? firstName.trim() : "",
                        lastName != null ? lastName.trim() : "").trim();
            }
            return IncomingRow.builder()
                    .externalRowId(externalRowId != null && !externalRowId.isBlank() ? externalRowId : null)
                    .externalId(externalId)
                    .organizationName(organizationName)
                    .contactName(contact)
                    .email(email)
                    .phone(phone)
                    .department(department)
                    .desiredEventDate(desiredEventDate)
                    .submittedAt(submittedAt)
                    .status(status)
                    .message(message)
                    .previouslyHosted(previouslyHosted)
                    .notes(notes)
                    .build();
        }
    }
}
