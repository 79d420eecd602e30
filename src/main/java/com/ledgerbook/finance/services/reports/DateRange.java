package com.ledgerbook.finance.services.reports;

import java.time.LocalDate;
import java.util.Objects;

import com.ledgerbook.finance.exceptions.InvalidDateRangeException;

/**
 * Inclusive reporting period. A range whose end precedes its start cannot be built.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidDateRangeException("end_date", "End date must not be before start date");
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public static DateRange calendarYear(int year) {
        return new DateRange(LocalDate.of(year, 1, 1), LocalDate.of(year, 12, 31));
    }
}
