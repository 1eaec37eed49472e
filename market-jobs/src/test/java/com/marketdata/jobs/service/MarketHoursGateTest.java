package com.marketdata.jobs.service;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.MarketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketHoursGate session and trading-date rules.
 */
class MarketHoursGateTest {

    private static final ZoneId CHICAGO = ZoneId.of("America/Chicago");

    private MarketHoursGate gate;

    @BeforeEach
    void setUp() {
        JobsProperties properties = new JobsProperties();
        properties.setTimezone("America/Chicago");
        gate = new MarketHoursGate(properties);
    }

    @Test
    void testIsOpen_WeekdayDuringSession_ReturnsTrue() {
        assertTrue(gate.isOpen(at(2024, 3, 15, 10, 0)));
        assertTrue(gate.isOpen(at(2024, 3, 15, 8, 30)));
    }

    @Test
    void testIsOpen_AtCloseOrBeforeOpen_ReturnsFalse() {
        assertFalse(gate.isOpen(at(2024, 3, 15, 15, 0)));
        assertFalse(gate.isOpen(at(2024, 3, 15, 8, 29)));
    }

    @Test
    void testIsOpen_WeekendAndHoliday_ReturnsFalse() {
        assertFalse(gate.isOpen(at(2024, 3, 16, 10, 0)));
        assertFalse(gate.isOpen(at(2024, 7, 4, 10, 0)));
    }

    @Test
    void testNextOpen_FridayEvening_IsMondayOpen() {
        // Act
        ZonedDateTime next = gate.nextOpen(at(2024, 3, 15, 17, 0));

        // Assert
        assertEquals(ZonedDateTime.of(2024, 3, 18, 8, 30, 0, 0, CHICAGO), next);
    }

    @Test
    void testNextOpen_SkipsHoliday() {
        // Act
        ZonedDateTime next = gate.nextOpen(at(2024, 7, 3, 16, 0));

        // Assert
        assertEquals(LocalDate.of(2024, 7, 5), next.toLocalDate());
    }

    @Test
    void testStatus_ReportsClosedReason() {
        assertEquals(MarketStatus.ClosedReason.WEEKEND, gate.status(at(2024, 3, 16, 12, 0)).getReason());
        assertEquals(MarketStatus.ClosedReason.HOLIDAY, gate.status(at(2024, 12, 25, 12, 0)).getReason());
        assertEquals(MarketStatus.ClosedReason.BEFORE_HOURS, gate.status(at(2024, 3, 15, 7, 0)).getReason());
        assertEquals(MarketStatus.ClosedReason.AFTER_HOURS, gate.status(at(2024, 3, 15, 18, 0)).getReason());

        MarketStatus open = gate.status(at(2024, 3, 15, 9, 0));
        assertTrue(open.isOpen());
        assertEquals(ZonedDateTime.of(2024, 3, 15, 15, 0, 0, 0, CHICAGO), open.getClosesAt());
    }

    @Test
    void testResolveTradingDate_AfterCutoff_IsToday() {
        assertEquals(LocalDate.of(2024, 3, 15), gate.resolveTradingDate(at(2024, 3, 15, 17, 0)));
    }

    @Test
    void testResolveTradingDate_BeforeCutoff_IsPreviousTradingDay() {
        assertEquals(LocalDate.of(2024, 3, 14), gate.resolveTradingDate(at(2024, 3, 15, 10, 0)));
        assertEquals(LocalDate.of(2024, 3, 15), gate.resolveTradingDate(at(2024, 3, 18, 9, 0)));
    }

    @Test
    void testResolveTradingDate_Weekend_IsFriday() {
        assertEquals(LocalDate.of(2024, 3, 15), gate.resolveTradingDate(at(2024, 3, 16, 18, 0)));
        assertEquals(LocalDate.of(2024, 3, 15), gate.resolveTradingDate(at(2024, 3, 17, 12, 0)));
    }

    @Test
    void testResolveTradingDate_DayAfterHoliday_SkipsHoliday() {
        assertEquals(LocalDate.of(2024, 7, 3), gate.resolveTradingDate(at(2024, 7, 5, 9, 0)));
    }

    private static Instant at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, CHICAGO).toInstant();
    }
}
