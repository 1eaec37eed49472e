package com.marketdata.jobs.domain;

import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Inclusive range of trading dates.
 * Rendered as {@code yyyy-MM-dd} for a single day and {@code start..end} otherwise.
 */
@Value
public class DateRange {

    private static final String SEPARATOR = "..";

    LocalDate start;
    LocalDate end;

    public DateRange(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Date range needs both a start and an end date");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Start date " + start + " is after end date " + end);
        }
        this.start = start;
        this.end = end;
    }

    public static DateRange ofDay(LocalDate day) {
        return new DateRange(day, day);
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    public String label() {
        return isSingleDay() ? start.toString() : start + SEPARATOR + end;
    }

    /**
     * Parse a label produced by {@link #label()}.
     *
     * @throws IllegalArgumentException if the label is not a date or date range
     */
    public static DateRange parse(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Empty date label");
        }
        try {
            int separator = label.indexOf(SEPARATOR);
            if (separator < 0) {
                return ofDay(LocalDate.parse(label.trim()));
            }
            return new DateRange(
                    LocalDate.parse(label.substring(0, separator).trim()),
                    LocalDate.parse(label.substring(separator + SEPARATOR.length()).trim()));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid date label: " + label, e);
        }
    }

    @Override
    public String toString() {
        return label();
    }
}
