package com.event.reconciliation.rules;

import com.event.reconciliation.core.model.IncomingRow;
import com.event.reconciliation.core.model.NormalizedRow;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Pure transformation of a raw {@link IncomingRow} into its canonical {@link NormalizedRow}.
 *
 * <ul>
 *   <li>email: trimmed and lowercased, blank is absent</li>
 *   <li>phone: digits only, no digits is absent</li>
 *   <li>dates: parsed by {@link IntakeDateParser}, unparseable is absent</li>
 *   <li>organization: trimmed, case preserved</li>
 *   <li>contact name: first token is the first name, the rest is the last name</li>
 * </ul>
 *
 * <p>The static helpers are shared with the matcher so that stored records are compared in
 * exactly the same canonical form as incoming rows.</p>
 */
public class RowNormalizer {

    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final IntakeDateParser dateParser;

    public RowNormalizer() {
        this(new IntakeDateParser());
    }

    public RowNormalizer(IntakeDateParser dateParser) {
        this.dateParser = Objects.requireNonNull(dateParser, "dateParser is required");
    }

    /**
     * Normalizes one raw row. Never throws for malformed field values.
     */
    public NormalizedRow normalize(IncomingRow row) {
        Objects.requireNonNull(row, "row is required");
        String[] name = splitContactName(row.contactName());
        return new NormalizedRow(
                normalizeIdentifier(row.externalRowId()),
                normalizeIdentifier(row.externalId()),
                normalizeOrganization(row.organizationName()),
                name[0],
                name[1],
                normalizeEmail(row.email()),
                normalizePhone(row.phone()),
                dateParser.parseDate(row.desiredEventDate()),
                dateParser.parseDateTime(row.submittedAt()),
                row
        );
    }

    public static Optional<String> normalizeEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        String cleaned = email.trim().toLowerCase(Locale.ROOT);
        return cleaned.isEmpty() ? Optional.empty() : Optional.of(cleaned);
    }

    public static Optional<String> normalizePhone(String phone) {
        if (phone == null) {
            return Optional.empty();
        }
        String digits = NON_DIGIT.matcher(phone).replaceAll("");
        return digits.isEmpty() ? Optional.empty() : Optional.of(digits);
    }

    public static String normalizeOrganization(String organizationName) {
        return organizationName == null ? "" : organizationName.trim();
    }

    /**
     * Canonical form for case-insensitive name comparison; "" when absent.
     */
    public static String normalizeNamePart(String namePart) {
        if (namePart == null) {
            return "";
        }
        return WHITESPACE.matcher(namePart.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /**
     * Splits a contact name into {@code [firstName, lastName]}; missing parts are "".
     */
    public static String[] splitContactName(String contactName) {
        if (contactName == null || contactName.isBlank()) {
            return new String[]{"", ""};
        }
        String[] tokens = WHITESPACE.split(contactName.trim(), 2);
        String lastName = tokens.length > 1 ? WHITESPACE.matcher(tokens[1]).replaceAll(" ") : "";
        return new String[]{tokens[0], lastName};
    }

    private static Optional<String> normalizeIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(identifier.trim());
    }
}
