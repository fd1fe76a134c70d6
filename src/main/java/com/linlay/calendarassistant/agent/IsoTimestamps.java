package com.linlay.calendarassistant.agent;

import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Lenient ISO-8601 parsing for timestamps produced by the model. Values without an offset are
 * read as UTC; a bare date is the start of that day in UTC.
 * <p>
 * {@link #calendarDate} answers a different question: which calendar day the text names. It
 * keeps the written date unless the value carries a non-UTC offset.
 */
public final class IsoTimestamps {

    private IsoTimestamps() {
    }

    public static Optional<Instant> parse(String value) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(ZonedDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    /**
     * The calendar day named by {@code value}. Bare dates, local date-times and UTC values keep
     * the date as written; values with any other offset are moved into {@code zone} first.
     */
    public static Optional<LocalDate> calendarDate(String value, ZoneId zone) {
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        String text = value.trim();
        try {
            return Optional.of(LocalDate.parse(text));
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            OffsetDateTime dateTime = OffsetDateTime.parse(text);
            return Optional.of(ZoneOffset.UTC.equals(dateTime.getOffset())
                    ? dateTime.toLocalDate()
                    : dateTime.atZoneSameInstant(zone).toLocalDate());
        } catch (DateTimeParseException ignored) {
            // try the next shape
        }
        try {
            ZonedDateTime dateTime = ZonedDateTime.parse(text);
            return Optional.of(ZoneOffset.UTC.equals(dateTime.getOffset())
                    ? dateTime.toLocalDate()
                    : dateTime.withZoneSameInstant(zone).toLocalDate());
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
