package com.fusestorage.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Date text formats understood when reading date columns. Everything is UTC.
 */
public final class StorageDates {
    /**
     * Format used when binding dates.
     */
    public static final DateTimeFormatter STORAGE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME
    );
    private static final DateTimeFormatter DATE_ONLY = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private StorageDates() {
    }

    /**
     * Format an instant the way the engine adapter binds it.
     *
     * @param instant instant
     * @return UTC text with millisecond precision
     */
    public static String format(Instant instant) {
        return STORAGE_FORMAT.format(instant);
    }

    /**
     * Parse date text: ISO-8601 with offset, then the storage patterns, then epoch seconds.
     *
     * @param text date text
     * @return parsed instant, or {@code null} when no format matches
     */
    public static Instant parse(String text) {
        if (text == null) {
            return null;
        }
        String v = text.trim();
        if (v.isEmpty()) {
            return null;
        }

        Instant iso = parseIso(v);
        if (iso != null) {
            return iso;
        }

        for (DateTimeFormatter formatter : DATE_TIME_FORMATS) {
            try {
                return LocalDateTime.parse(v, formatter).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // next format
            }
        }
        try {
            return LocalDate.parse(v, DATE_ONLY).atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to epoch seconds
        }

        return parseEpochSeconds(v);
    }

    /**
     * Interpret a number as seconds since the epoch; fractional seconds are kept to the millisecond.
     *
     * @param seconds epoch seconds
     * @return instant, or {@code null} when the value lies outside the {@link Instant} range
     */
    public static Instant fromEpochSeconds(Number seconds) {
        try {
            if (seconds instanceof Double || seconds instanceof Float || seconds instanceof java.math.BigDecimal) {
                return Instant.ofEpochMilli(Math.round(seconds.doubleValue() * 1000d));
            }
            return Instant.ofEpochSecond(seconds.longValue());
        } catch (DateTimeException | ArithmeticException e) {
            return null;
        }
    }

    private static Instant parseIso(String v) {
        try {
            return Instant.parse(v);
        } catch (DateTimeParseException ignored) {
            // try with an explicit offset
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            return null;
        }
    }

    private static Instant parseEpochSeconds(String v) {
        try {
            double seconds = Double.parseDouble(v);
            return Double.isFinite(seconds) ? fromEpochSeconds(seconds) : null;
        } catch (NumberFormatException | DateTimeException e) {
            return null;
        }
    }
}
