package com.salesinsight.domain.model;

import com.salesinsight.domain.exception.InvalidQueryException;
import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Inclusive date range of an analytics query.
 */
@Value
public class DateRange {

    private static final DateTimeFormatter LABEL_FORMAT = DateTimeFormatter.ofPattern("dd.MM.yyyy");

    LocalDate start;
    LocalDate end;

    public static DateRange of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new InvalidQueryException("Both start and end dates are required");
        }
        if (start.isAfter(end)) {
            throw new InvalidQueryException("Start date " + start + " is after end date " + end);
        }
        return new DateRange(start, end);
    }

    /**
     * The given range, or the last {@code defaultDays} days ending today when
     * both bounds are missing. A single missing bound is filled the same way.
     */
    public static DateRange orDefault(LocalDate start, LocalDate end, int defaultDays) {
        LocalDate resolvedEnd = end != null ? end : LocalDate.now();
        LocalDate resolvedStart = start != null ? start : resolvedEnd.minusDays(defaultDays - 1L);
        return of(resolvedStart, resolvedEnd);
    }

    public boolean overlaps(DateRange other) {
        return !start.isAfter(other.end) && !other.start.isAfter(end);
    }

    public String label() {
        return start.format(LABEL_FORMAT) + " - " + end.format(LABEL_FORMAT);
    }
}
