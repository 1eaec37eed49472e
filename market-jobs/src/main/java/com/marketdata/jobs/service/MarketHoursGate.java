package com.marketdata.jobs.service;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.MarketStatus;
import com.marketdata.jobs.domain.MarketStatus.ClosedReason;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Answers market-session questions in the market time zone:
 * whether the market is open, when it next opens, and which trading date
 * an end-of-day scan started at a given instant belongs to.
 * Closed on weekends and {@link MarketHoliday} dates.
 */
@Component
public class MarketHoursGate {

    private final ZoneId zone;
    private final LocalTime openTime;
    private final LocalTime closeTime;
    private final int tradingDayCutoffHour;

    public MarketHoursGate(JobsProperties properties) {
        JobsProperties.MarketHours hours = properties.getMarketHours();
        this.zone = properties.zoneId();
        this.openTime = LocalTime.of(hours.getOpenHour(), hours.getOpenMinute());
        this.closeTime = LocalTime.of(hours.getCloseHour(), hours.getCloseMinute());
        this.tradingDayCutoffHour = hours.getTradingDayCutoffHour();
        if (!openTime.isBefore(closeTime)) {
            throw new IllegalArgumentException("Market open " + openTime + " must be before close " + closeTime);
        }
    }

    public boolean isOpen(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        return !time.isBefore(openTime) && time.isBefore(closeTime);
    }

    /**
     * Next session open strictly after {@code now}. While the market is open
     * this is the following trading day's open.
     */
    public ZonedDateTime nextOpen(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate date = local.toLocalDate();
        if (isTradingDay(date) && local.toLocalTime().isBefore(openTime)) {
            return date.atTime(openTime).atZone(zone);
        }
        date = date.plusDays(1);
        while (!isTradingDay(date)) {
            date = date.plusDays(1);
        }
        return date.atTime(openTime).atZone(zone);
    }

    public MarketStatus status(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate date = local.toLocalDate();
        MarketStatus.MarketStatusBuilder status = MarketStatus.builder().currentTime(local);

        if (isWeekend(date) || MarketHoliday.isHoliday(date)) {
            return status.open(false)
                    .reason(isWeekend(date) ? ClosedReason.WEEKEND : ClosedReason.HOLIDAY)
                    .nextOpen(nextOpen(now))
                    .build();
        }
        if (isOpen(now)) {
            return status.open(true).closesAt(date.atTime(closeTime).atZone(zone)).build();
        }
        ClosedReason reason = local.toLocalTime().isBefore(openTime) ? ClosedReason.BEFORE_HOURS : ClosedReason.AFTER_HOURS;
        return status.open(false).reason(reason).nextOpen(nextOpen(now)).build();
    }

    /**
     * Trading date whose closing data is expected to be available at {@code now}.
     * After the cutoff hour on a trading day it is today. Otherwise it is the
     * most recent trading day before today (Friday for weekends and Mondays).
     */
    public LocalDate resolveTradingDate(Instant now) {
        ZonedDateTime local = now.atZone(zone);
        LocalDate today = local.toLocalDate();
        if (isTradingDay(today) && local.getHour() >= tradingDayCutoffHour) {
            return today;
        }
        LocalDate date = today.minusDays(1);
        while (!isTradingDay(date)) {
            date = date.minusDays(1);
        }
        return date;
    }

    public boolean isTradingDay(LocalDate date) {
        return !isWeekend(date) && !MarketHoliday.isHoliday(date);
    }

    public ZoneId getZone() {
        return zone;
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
