package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.IntervalUnit;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.domain.ScheduleType;
import com.marketdata.jobs.exception.InvalidScheduleException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScheduleSpec validation and trigger arithmetic.
 */
class ScheduleSpecTest {

    private static final ZoneId CHICAGO = ZoneId.of("America/Chicago");

    @Test
    void testFrom_Interval_ConvertsUnit() {
        // Act
        ScheduleSpec spec = ScheduleSpec.from(interval(15, IntervalUnit.MINUTES));

        // Assert
        assertEquals(ScheduleType.INTERVAL, spec.getType());
        assertEquals(Duration.ofMinutes(15), spec.getInterval());
        assertEquals("every PT15M", spec.describe());
    }

    @Test
    void testFrom_IntervalWithoutValue_Rejected() {
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(interval(null, IntervalUnit.MINUTES)));
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(interval(0, IntervalUnit.MINUTES)));
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(interval(5, null)));
    }

    @Test
    void testFrom_Cron_NormalizesDayOfWeek() {
        // Act
        ScheduleSpec spec = ScheduleSpec.from(cron(" mon-fri ", 16, 5));

        // Assert
        assertEquals("0 5 16 * * MON-FRI", spec.cronExpression());
    }

    @Test
    void testFrom_CronWithoutDay_RunsDaily() {
        assertEquals("0 0 2 * * *", ScheduleSpec.from(cron(null, 2, 0)).cronExpression());
    }

    @Test
    void testFrom_InvalidCronFields_Rejected() {
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(cron("mon", 24, 0)));
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(cron("mon", 10, 60)));
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(cron("funday", 10, 0)));
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(cron("mon;tue", 10, 0)));
    }

    @Test
    void testFrom_MissingType_Rejected() {
        JobConfiguration config = JobConfiguration.builder().jobName("broken").build();

        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(config));
    }

    @Test
    void testFrom_InvertedMarketWindow_Rejected() {
        // Arrange
        JobConfiguration config = interval(5, IntervalUnit.MINUTES);
        config.setOnlyMarketHours(true);
        config.setMarketStartHour(15);
        config.setMarketEndHour(9);

        // Act & Assert
        assertThrows(InvalidScheduleException.class, () -> ScheduleSpec.from(config));
    }

    @Test
    void testEquals_SameTriggerDefinition() {
        JobConfiguration first = cron("MON-FRI", 16, 5);
        JobConfiguration second = cron("mon-fri", 16, 5);
        second.setDescription("different description");

        assertEquals(ScheduleSpec.from(first), ScheduleSpec.from(second));
        assertNotEquals(ScheduleSpec.from(first), ScheduleSpec.from(cron("mon-fri", 16, 6)));
    }

    @Test
    void testNextFireAfter_WeekdayCronSkipsWeekend() {
        // Arrange
        ScheduleSpec spec = ScheduleSpec.from(cron("mon-fri", 16, 5));
        ZonedDateTime fridayAfterFire = ZonedDateTime.of(2024, 3, 15, 16, 5, 0, 0, CHICAGO);

        // Act
        ZonedDateTime next = spec.nextFireAfter(fridayAfterFire);

        // Assert
        assertEquals(ZonedDateTime.of(2024, 3, 18, 16, 5, 0, 0, CHICAGO), next);
    }

    private static JobConfiguration interval(Integer value, IntervalUnit unit) {
        return JobConfiguration.builder()
                .jobName("market_data_refresh")
                .scheduleType(ScheduleType.INTERVAL)
                .intervalValue(value)
                .intervalUnit(unit)
                .build();
    }

    private static JobConfiguration cron(String dayOfWeek, Integer hour, Integer minute) {
        return JobConfiguration.builder()
                .jobName("eod_scan")
                .scheduleType(ScheduleType.CRON)
                .cronDayOfWeek(dayOfWeek)
                .cronHour(hour)
                .cronMinute(minute)
                .build();
    }
}
