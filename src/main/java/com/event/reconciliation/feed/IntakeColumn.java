package com.event.reconciliation.feed;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Intake feed columns and the header spellings recognized for each, compared case-insensitively
 * after trimming.
 */
enum IntakeColumn {
    EXTERNAL_ID("external_id", "external id", "id", "unique_id", "unique id", "record_id", "record id"),
    SUBMITTED_AT("submitted on", "timestamp", "submission date", "date submitted", "created"),
    CONTACT_NAME("name", "full name", "contact name", "your name"),
    FIRST_NAME("first name", "fname", "first"),
    LAST_NAME("last name", "lname", "last"),
    EMAIL("your email", "email", "email address", "e-mail", "contact email"),
    ORGANIZATION("group/organization name", "grouporganization name", "grouporganization", "organization",
            "organization name", "group", "company", "org name"),
    DEPARTMENT("department/team if applicable", "departmentteam", "department/team", "department", "team",
            "dept", "division"),
    PHONE("phone number", "phone", "contact phone", "telephone", "mobile", "cell phone"),
    DESIRED_EVENT_DATE("desired event date", "event date", "date requested", "preferred date", "requested date"),
    PREVIOUSLY_HOSTED("has your organization done an event with us before?", "previously hosted",
            "previous event", "hosted before", "past event"),
    MESSAGE("message", "additional details", "details", "description", "comments", "additional information"),
    STATUS("status", "current status", "state", "event status"),
    NOTES("notes", "duplicate check", "internal notes");

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final List<String> aliases;

    IntakeColumn(String... aliases) {
        this.aliases = List.of(aliases);
    }

    List<String> aliases() {
        return aliases;
    }

    /**
     * Finds this column's position in a header map keyed by normalized header text.
     */
    Optional<Integer> indexIn(Map<String, Integer> headerIndex) {
        for (String alias : aliases) {
            Integer index = headerIndex.get(alias);
            if (index != null) {
                return Optional.of(index);
            }
        }
        return Optional.empty();
    }

    /**
     * Lowercases and trims a header cell, dropping the byte-order mark spreadsheet exports put
     * in front of the first one.
     */
    static String normalizeHeader(String header) {
        if (header == null) {
            return "";
        }
        String cleaned = header.startsWith(BYTE_ORDER_MARK) ? header.substring(1) : header;
        return cleaned.trim().toLowerCase(Locale.ROOT);
    }
}
