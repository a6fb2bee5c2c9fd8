package com.al.hl7siu.util;

import lombok.extern.slf4j.Slf4j;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for parsing HL7 v2 TS/DTM values and rendering them as
 * ISO-8601.
 *
 * <p>
 * HL7 v2 timestamp format: YYYY[MM[DD[HH[MM[SS]]]]][.S+][+/-ZZZZ]
 * Precision may stop after any group. Examples:
 * <ul>
 * <li>2025 - year only, resolves to 2025-01-01T00:00:00Z</li>
 * <li>20250502130000 - no offset, interpreted as UTC</li>
 * <li>20250502130000+0600 - offset applied, renders as 2025-05-02T07:00:00Z</li>
 * <li>20250502130000.1234-0500 - fraction kept to microsecond precision</li>
 * </ul>
 *
 * <p>
 * Values that do not follow the grammar, or that name an impossible date,
 * time or offset, yield {@link Optional#empty()} rather than an exception:
 * callers treat them as an absent field.
 */
@Slf4j
public final class DateTimeUtil {

    private DateTimeUtil() {
        throw new UnsupportedOperationException("Utility class - do not instantiate");
    }

    private static final Pattern HL7_TIMESTAMP = Pattern.compile(
            "^(?<year>\\d{4})"
                    + "(?<month>\\d{2})?"
                    + "(?<day>\\d{2})?"
                    + "(?<hour>\\d{2})?"
                    + "(?<minute>\\d{2})?"
                    + "(?<second>\\d{2})?"
                    + "(?<fraction>\\.\\d+)?"
                    + "(?<offset>[+-]\\d{4})?$");

    private static final int MICRO_DIGITS = 6;

    private static final DateTimeFormatter ISO_UTC_SECONDS = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'");

    private static final DateTimeFormatter ISO_UTC_MICROS = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'");

    /**
     * Parse an HL7 timestamp to an offset-aware date-time.
     *
     * <p>
     * Missing month and day default to 01, missing time parts to 00. Without an
     * explicit offset the value is assumed to be UTC.
     *
     * @param hl7DateTime HL7 timestamp (e.g., "20250502130000+0600")
     * @return the parsed instant with its original offset, or empty
     */
    public static Optional<OffsetDateTime> parseHl7DateTime(String hl7DateTime) {
        Matcher m = match(hl7DateTime);
        if (m == null) {
            return Optional.empty();
        }

        try {
            int nanos = 0;
            String fraction = m.group("fraction");
            if (fraction != null) {
                String digits = (fraction.substring(1) + "000000").substring(0, MICRO_DIGITS);
                nanos = Integer.parseInt(digits) * 1000;
            }

            ZoneOffset offset = ZoneOffset.UTC;
            String tz = m.group("offset");
            if (tz != null) {
                int hours = Integer.parseInt(tz.substring(1, 3));
                int minutes = Integer.parseInt(tz.substring(3, 5));
                offset = tz.charAt(0) == '+'
                        ? ZoneOffset.ofHoursMinutes(hours, minutes)
                        : ZoneOffset.ofHoursMinutes(-hours, -minutes);
            }

            return Optional.of(OffsetDateTime.of(
                    Integer.parseInt(m.group("year")),
                    intOrDefault(m.group("month"), 1),
                    intOrDefault(m.group("day"), 1),
                    intOrDefault(m.group("hour"), 0),
                    intOrDefault(m.group("minute"), 0),
                    intOrDefault(m.group("second"), 0),
                    nanos,
                    offset));
        } catch (DateTimeException e) {
            log.debug("Ignoring out-of-range HL7 timestamp '{}': {}", hl7DateTime, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Parse the date part of an HL7 timestamp (e.g., a date of birth). Time and
     * offset, if present, are ignored.
     *
     * @param hl7Date HL7 date or timestamp (e.g., "19850210")
     * @return the calendar date, or empty
     */
    public static Optional<LocalDate> parseHl7Date(String hl7Date) {
        Matcher m = match(hl7Date);
        if (m == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.of(
                    Integer.parseInt(m.group("year")),
                    intOrDefault(m.group("month"), 1),
                    intOrDefault(m.group("day"), 1)));
        } catch (DateTimeException e) {
            log.debug("Ignoring out-of-range HL7 date '{}': {}", hl7Date, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Render in UTC with a literal {@code Z}, e.g. "2025-05-02T07:00:00Z".
     * Fractional seconds are printed with six digits, and only when non-zero.
     */
    public static String toIsoUtc(OffsetDateTime dateTime) {
        OffsetDateTime utc = dateTime.withOffsetSameInstant(ZoneOffset.UTC);
        return utc.getNano() == 0 ? utc.format(ISO_UTC_SECONDS) : utc.format(ISO_UTC_MICROS);
    }

    /**
     * Render as "yyyy-MM-dd".
     */
    public static String toIsoDate(LocalDate date) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    /**
     * Parse and render in one step; empty string when the value is unusable.
     */
    public static String hl7DateTimeToIsoUtc(String hl7DateTime) {
        return parseHl7DateTime(hl7DateTime).map(DateTimeUtil::toIsoUtc).orElse("");
    }

    /**
     * Parse and render a date in one step; empty string when the value is
     * unusable.
     */
    public static String hl7DateToIso(String hl7Date) {
        return parseHl7Date(hl7Date).map(DateTimeUtil::toIsoDate).orElse("");
    }

    private static Matcher match(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        Matcher m = HL7_TIMESTAMP.matcher(value);
        return m.matches() ? m : null;
    }

    private static int intOrDefault(String group, int defaultValue) {
        return group == null ? defaultValue : Integer.parseInt(group);
    }
}
