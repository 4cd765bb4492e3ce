package com.event.reconciliation.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Permissive parser for the date and date-time strings found in the intake feed.
 *
 * <p>Accepts US-style locale strings ({@code 10/15/2025}, {@code 9/26/2025 10:00:00},
 * {@code 9/26/2025, 2:30:00 PM}), ISO dates and date-times, ISO instants, and spreadsheet
 * serial numbers ({@code 45946}, {@code 45926.4166}) counted from 1899-12-30.
 * Zone-less values are interpreted in the configured zone.</p>
 *
 * <p>Unparseable input yields {@link Optional#empty()}; nothing is ever defaulted.</p>
 */
public class IntakeDateParser {
    private static final Logger log = LoggerFactory.getLogger(IntakeDateParser.class);

    private static final Pattern SERIAL_NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final LocalDateTime SERIAL_EPOCH = LocalDateTime.of(1899, 12, 30, 0, 0);
    private static final long MAX_SERIAL_DAYS = 2_958_465L; // 9999-12-31
    private static final BigDecimal SECONDS_PER_DAY = BigDecimal.valueOf(86_400L);

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            pattern("M/d/uuuu"),
            pattern("M/d/uu"),
            pattern("uuuu-M-d"),
            pattern("uuuu/M/d"),
            pattern("MMMM d, uuuu"),
            pattern("MMM d, uuuu")
    );

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            pattern("M/d/uuuu H:mm:ss"),
            pattern("M/d/uuuu H:mm"),
            pattern("M/d/uuuu h:mm:ss a"),
            pattern("M/d/uuuu h:mm a"),
            pattern("M/d/uuuu, h:mm:ss a"),
            pattern("M/d/uuuu, H:mm:ss"),
            pattern("uuuu-MM-dd HH:mm:ss"),
            pattern("uuuu-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );

    private final ZoneId zone;

    public IntakeDateParser() {
        this(ZoneOffset.UTC);
    }

    public IntakeDateParser(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone is required");
    }

    /**
     * Parses a calendar date. Date-time input is reduced to its date in the configured zone.
     */
    public Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String cleaned = value.trim();

        if (SERIAL_NUMBER.matcher(cleaned).matches()) {
            return fromSerial(cleaned).map(LocalDateTime::toLocalDate);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> parsed = tryParse(() -> LocalDate.parse(cleaned, format));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        Optional<LocalDate> fromDateTime = parseDateTimeOnly(cleaned)
                .map(instant -> instant.atZone(zone).toLocalDate());
        if (fromDateTime.isEmpty()) {
            log.debug("date.unparseable kind=date value='{}'", value);
        }
        return fromDateTime;
    }

    /**
     * Parses a point in time. Date-only input resolves to the start of that day in the configured zone.
     */
    public Optional<Instant> parseDateTime(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String cleaned = value.trim();

        if (SERIAL_NUMBER.matcher(cleaned).matches()) {
            return fromSerial(cleaned).map(dateTime -> dateTime.atZone(zone).toInstant());
        }
        Optional<Instant> parsed = parseDateTimeOnly(cleaned);
        if (parsed.isPresent()) {
            return parsed;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            Optional<LocalDate> date = tryParse(() -> LocalDate.parse(cleaned, format));
            if (date.isPresent()) {
                return Optional.of(date.get().atStartOfDay(zone).toInstant());
            }
        }
        log.debug("date.unparseable kind=datetime value='{}'", value);
        return Optional.empty();
    }

    private Optional<Instant> parseDateTimeOnly(String cleaned) {
        Optional<Instant> instant = tryParse(() -> OffsetDateTime.parse(cleaned).toInstant());
        if (instant.isPresent()) {
            return instant;
        }
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            Optional<Instant> parsed = tryParse(() -> LocalDateTime.parse(cleaned, format).atZone(zone).toInstant());
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    /**
     * Converts a spreadsheet serial number (whole days since 1899-12-30, fraction = time of day).
     */
    private Optional<LocalDateTime> fromSerial(String cleaned) {
        BigDecimal serial = new BigDecimal(cleaned);
        if (serial.signum() <= 0 || serial.compareTo(BigDecimal.valueOf(MAX_SERIAL_DAYS)) > 0) {
            log.debug("date.serial.out_of_range value='{}'", cleaned);
            return Optional.empty();
        }
        long seconds = serial.multiply(SECONDS_PER_DAY).setScale(0, RoundingMode.HALF_UP).longValueExact();
        return Optional.of(SERIAL_EPOCH.plusSeconds(seconds));
    }

    private static <T> Optional<T> tryParse(ParseAttempt<T> attempt) {
        try {
            return Optional.of(attempt.parse());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static DateTimeFormatter pattern(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    @FunctionalInterface
    private interface ParseAttempt<T> {
        T parse();
    }
}
