package com.marketdata.jobs.service;

import java.time.LocalDate;
import java.time.MonthDay;
import java.util.Arrays;

/**
 * Fixed-date exchange holidays. Floating holidays are not modelled.
 */
public enum MarketHoliday {
    NEW_YEARS_DAY(MonthDay.of(1, 1)),
    INDEPENDENCE_DAY(MonthDay.of(7, 4)),
    CHRISTMAS_DAY(MonthDay.of(12, 25));

    private final MonthDay monthDay;

    MarketHoliday(MonthDay monthDay) {
        this.monthDay = monthDay;
    }

    public static boolean isHoliday(LocalDate date) {
        MonthDay candidate = MonthDay.from(date);
        return Arrays.stream(values()).anyMatch(h -> h.monthDay.equals(candidate));
    }
}
