package com.example.healthcoach.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Absolute, inclusive date window a query refers to.
 *
 * @param start     first day (inclusive)
 * @param end       last day (inclusive)
 * @param phrase    the phrase that produced the scope, e.g. "yesterday"
 * @param defaulted true when no phrase resolved and the intent default was applied
 */
public record DateScope(LocalDate start, LocalDate end, String phrase, boolean defaulted) {

    public DateScope {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            LocalDate tmp = start;
            start = end;
            end = tmp;
        }
    }

    public static DateScope single(LocalDate date, String phrase) {
        return new DateScope(date, date, phrase, false);
    }

    public static DateScope range(LocalDate start, LocalDate end, String phrase) {
        return new DateScope(start, end, phrase, false);
    }

    public DateScope asDefault() {
        return new DateScope(start, end, phrase, true);
    }

    public boolean isSingleDay() {
        return start.equals(end);
    }

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    public long days() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    @Override
    public String toString() {
        return isSingleDay() ? start.toString() : start + ".." + end;
    }
}
