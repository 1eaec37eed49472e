package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.IntervalUnit;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.domain.ScheduleType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Creates the default job configurations on first boot.
 * Runs before the scheduler starts, which waits for the application ready event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobConfigurationSeeder implements ApplicationRunner {

    private static final String WEEKDAYS = "mon,tue,wed,thu,fri";

    private final JobConfigurationService configurationService;

    @Override
    public void run(ApplicationArguments args) {
        int inserted = configurationService.seedMissing(defaults());
        log.info("Job configuration seeding done, {} new rows", inserted);
    }

    static List<JobConfiguration> defaults() {
        return List.of(
                cron("universe_refresh", "Refresh the reference symbol universe", "sun", 8, 0, true),
                cron("eod_scan", "End-of-day price scan for the whole universe", WEEKDAYS, 17, 30, true),
                JobConfiguration.builder()
                        .jobName("market_data_refresh")
                        .description("Refresh cached quotes during market hours")
                        .enabled(true)
                        .scheduleType(ScheduleType.INTERVAL)
                        .intervalValue(30)
                        .intervalUnit(IntervalUnit.MINUTES)
                        .onlyMarketHours(true)
                        .marketStartHour(9)
                        .marketEndHour(16)
                        .build(),
                cron("tech_analysis", "Compute technical indicators", WEEKDAYS, 18, 0, true),
                cron("ttl_cleanup", "Prune run history and old scans", "*", 3, 0, true),
                // chained from eod_scan, not armed by default
                cron("technical_compute", "Technical indicators after the EOD scan", WEEKDAYS, 18, 30, false),
                cron("daily_movers_calculation", "Daily movers after technical compute", WEEKDAYS, 19, 0, false),
                cron("weekly_bars_etl", "Weekly bar aggregation on Fridays", "fri", 19, 30, false));
    }

    private static JobConfiguration cron(String name, String description, String days, int hour, int minute,
            boolean enabled) {
        return JobConfiguration.builder()
                .jobName(name)
                .description(description)
                .enabled(enabled)
                .scheduleType(ScheduleType.CRON)
                .cronDayOfWeek(days)
                .cronHour(hour)
                .cronMinute(minute)
                .onlyMarketHours(false)
                .build();
    }
}
