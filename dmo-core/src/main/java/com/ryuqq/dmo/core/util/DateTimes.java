package com.ryuqq.dmo.core.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp handling shared by every backend.
 *
 * <p>All timestamps are UTC {@link Instant}s truncated to microseconds, which is the
 * finest precision PostgreSQL {@code TIMESTAMPTZ} keeps. Text-based engines store the
 * fixed-width form produced by {@link #format(Instant)} so that lexical order equals
 * chronological order.</p>
 *
 * @author DMO Team
 * @since 1.0.0
 */
public final class DateTimes {

    private static final DateTimeFormatter TEXT_FORMAT =
        DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);

    private DateTimes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Current instant of the given clock, truncated to microseconds.
     *
     * @param clock source clock
     * @return truncated instant
     */
    public static Instant now(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    /**
     * Next {@code updatedAt} for a mutated record: never earlier than the previous value.
     *
     * @param previous the record's current updatedAt
     * @param now the candidate timestamp
     * @return the later of the two
     */
    public static Instant advance(Instant previous, Instant now) {
        return now.isBefore(previous) ? previous : now;
    }

    /**
     * Fixed-width ISO-8601 text, e.g. {@code 2026-02-01T06:30:00.000000Z}.
     *
     * @param instant the instant
     * @return formatted text
     */
    public static String format(Instant instant) {
        return TEXT_FORMAT.format(instant.truncatedTo(ChronoUnit.MICROS));
    }

    /**
     * Parses text written by {@link #format(Instant)} (any ISO-8601 instant is accepted).
     *
     * @param text stored text
     * @return the instant
     * @throws IllegalArgumentException if the text is not an ISO-8601 instant
     */
    public static Instant parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        try {
            return Instant.parse(text).truncatedTo(ChronoUnit.MICROS);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid timestamp: " + text, e);
        }
    }
}
