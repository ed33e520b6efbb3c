package com.healthtech.olap.data.star;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.TextStyle;
import java.time.temporal.IsoFields;
import java.util.Locale;

/**
 * Calendar attributes of one date, keyed by the date itself encoded as yyyymmdd. Every attribute is derived from {@code fullDate}, so
 * a row is consistent with its key by construction.
 */
public record DateDimension(
    int dateKey,
    LocalDate fullDate,
    int year,
    int quarter,
    int month,
    String monthName,
    int weekOfYear,
    int dayOfMonth,
    String dayName,
    boolean weekend
) {

    public static DateDimension of(LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return new DateDimension(
            keyOf(date),
            date,
            date.getYear(),
            date.get(IsoFields.QUARTER_OF_YEAR),
            date.getMonthValue(),
            date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH),
            date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR),
            date.getDayOfMonth(),
            dayOfWeek.getDisplayName(TextStyle.FULL, Locale.ENGLISH),
            dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY
        );
    }

    public static int keyOf(LocalDate date) {
        return date.getYear() * 10000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    public static LocalDate dateOf(int dateKey) {
        return LocalDate.of(dateKey / 10000, (dateKey / 100) % 100, dateKey % 100);
    }
}
