package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * A calendar date with no time-of-day, formatted as {@code YYYY-MM-DD}.
 *
 * {@link #ZERO} stands for "no date"; it sorts before every real date.
 */
public final class CalendarDate implements Comparable<CalendarDate> {

    public static final CalendarDate ZERO = new CalendarDate(null);

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private final LocalDate value;

    private CalendarDate(LocalDate value) {
        this.value = value;
    }

    public static CalendarDate of(int year, int month, int day) {
        return new CalendarDate(LocalDate.of(year, month, day));
    }

    public static CalendarDate of(LocalDate date) {
        return date == null ? ZERO : new CalendarDate(date);
    }

    /**
     * Parses a {@code YYYY-MM-DD} string.
     *
     * @throws ValidationException with {@link ErrorCode#INVALID_DATE_FORMAT} for any other shape
     */
    public static CalendarDate parse(String text) {
        if (text == null || text.length() != 10) {
            throw invalidFormat();
        }
        try {
            return new CalendarDate(LocalDate.parse(text, FORMAT));
        } catch (DateTimeParseException e) {
            throw invalidFormat();
        }
    }

    public boolean isZero() {
        return value == null;
    }

    public boolean isBefore(CalendarDate other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(CalendarDate other) {
        return compareTo(other) > 0;
    }

    public LocalDate toLocalDate() {
        return value;
    }

    @Override
    public int compareTo(CalendarDate other) {
        if (value == null || other.value == null) {
            return Boolean.compare(value != null, other.value != null);
        }
        return value.compareTo(other.value);
    }

    @JsonValue
    @Override
    public String toString() {
        return value == null ? "" : value.format(FORMAT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CalendarDate other && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    private static ValidationException invalidFormat() {
        return ValidationException.ofField(ErrorCode.INVALID_DATE_FORMAT, "date",
                "invalid date format, expected YYYY-MM-DD");
    }
}
