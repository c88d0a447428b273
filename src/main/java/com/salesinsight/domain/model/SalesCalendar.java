package com.salesinsight.domain.model;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calendar fields stored on every sales fact and the period keys used by
 * trend buckets and demand series.
 *
 * Weeks are ISO weeks, so the week key uses the week-based year
 * (2024-12-30 is 2025-W01).
 */
public final class SalesCalendar {

    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM");

    private SalesCalendar() {
    }

    public static int year(LocalDate date) {
        return Objects.requireNonNull(date, "date").getYear();
    }

    public static int month(LocalDate date) {
        return Objects.requireNonNull(date, "date").getMonthValue();
    }

    public static int isoWeek(LocalDate date) {
        return Objects.requireNonNull(date, "date").get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    public static int isoWeekYear(LocalDate date) {
        return Objects.requireNonNull(date, "date").get(IsoFields.WEEK_BASED_YEAR);
    }

    /**
     * 0 = Monday .. 6 = Sunday.
     */
    public static int dayOfWeek(LocalDate date) {
        return Objects.requireNonNull(date, "date").getDayOfWeek().getValue() - 1;
    }

    public static String periodKey(LocalDate date, TrendGranularity granularity) {
        switch (granularity) {
            case DAY:
                return date.format(DAY_KEY);
            case WEEK:
                return weekKey(isoWeekYear(date), isoWeek(date));
            case MONTH:
                return date.format(MONTH_KEY);
            default:
                throw new IllegalArgumentException("Unknown granularity: " + granularity);
        }
    }

    public static String weekKey(int weekYear, int week) {
        return String.format("%04d-W%02d", weekYear, week);
    }

    public static String monthKey(int year, int month) {
        return YearMonth.of(year, month).format(MONTH_KEY);
    }

    /**
     * Every period key between the two dates, inclusive, in ascending order.
     */
    public static List<String> periodKeys(LocalDate start, LocalDate end, TrendGranularity granularity) {
        List<String> keys = new ArrayList<>();
        LocalDate cursor = periodStart(start, granularity);
        while (!cursor.isAfter(end)) {
            keys.add(periodKey(cursor, granularity));
            cursor = next(cursor, granularity);
        }
        return keys;
    }

    /**
     * The complete periods inside [start, end]: from the first period start on
     * or after {@code start} to the last period end on or before {@code end}.
     *
     * @return null when not a single complete period fits
     */
    public static DateRange wholePeriods(LocalDate start, LocalDate end, TrendGranularity granularity) {
        LocalDate first = periodStart(start, granularity);
        if (first.isBefore(start)) {
            first = next(first, granularity);
        }
        LocalDate lastStart = periodStart(end, granularity);
        LocalDate last = next(lastStart, granularity).minusDays(1);
        if (last.isAfter(end)) {
            last = lastStart.minusDays(1);
        }
        return first.isAfter(last) ? null : DateRange.of(first, last);
    }

    private static LocalDate periodStart(LocalDate date, TrendGranularity granularity) {
        switch (granularity) {
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return date.withDayOfMonth(1);
            default:
                return date;
        }
    }

    private static LocalDate next(LocalDate date, TrendGranularity granularity) {
        switch (granularity) {
            case WEEK:
                return date.plusWeeks(1);
            case MONTH:
                return date.plusMonths(1);
            default:
                return date.plusDays(1);
        }
    }
}
