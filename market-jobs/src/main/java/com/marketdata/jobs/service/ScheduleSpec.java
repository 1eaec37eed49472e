package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.IntervalUnit;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.domain.ScheduleType;
import com.marketdata.jobs.exception.InvalidScheduleException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validated, normalized trigger definition of one job configuration.
 * Two specs are equal when they arm the same trigger, which is what
 * scheduler reloads compare.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ScheduleSpec {

    private static final List<String> DAY_NAMES = Arrays.asList("mon", "tue", "wed", "thu", "fri", "sat", "sun");
    private static final Pattern DAY_OF_WEEK = Pattern.compile("[a-z]{3}(-[a-z]{3})?(,[a-z]{3}(-[a-z]{3})?)*");

    ScheduleType type;
    Duration interval;
    String dayOfWeek;
    Integer hour;
    Integer minute;
    boolean onlyMarketHours;
    Integer marketStartHour;
    Integer marketEndHour;

    /**
     * Build a spec from a stored configuration.
     *
     * @throws InvalidScheduleException if the configuration cannot be scheduled
     */
    public static ScheduleSpec from(JobConfiguration config) {
        if (config.getScheduleType() == null) {
            throw new InvalidScheduleException("Job " + config.getJobName() + " has no schedule type");
        }

        boolean onlyMarketHours = Boolean.TRUE.equals(config.getOnlyMarketHours());
        Integer startHour = config.getMarketStartHour();
        Integer endHour = config.getMarketEndHour();
        if (onlyMarketHours && (startHour != null || endHour != null)) {
            if (startHour == null || endHour == null || startHour < 0 || endHour > 24 || startHour >= endHour) {
                throw new InvalidScheduleException("Job " + config.getJobName()
                        + " has an invalid market hour window " + startHour + "-" + endHour);
            }
        }

        if (config.getScheduleType() == ScheduleType.INTERVAL) {
            Integer value = config.getIntervalValue();
            IntervalUnit unit = config.getIntervalUnit();
            if (value == null || value <= 0 || unit == null) {
                throw new InvalidScheduleException("Job " + config.getJobName()
                        + " needs a positive interval value and a unit");
            }
            return new ScheduleSpec(ScheduleType.INTERVAL, unit.toDuration(value), null, null, null,
                    onlyMarketHours, startHour, endHour);
        }

        Integer hour = config.getCronHour();
        Integer minute = config.getCronMinute();
        if (hour == null || hour < 0 || hour > 23) {
            throw new InvalidScheduleException("Job " + config.getJobName() + " has an invalid cron hour: " + hour);
        }
        if (minute == null || minute < 0 || minute > 59) {
            throw new InvalidScheduleException("Job " + config.getJobName() + " has an invalid cron minute: " + minute);
        }
        String dayOfWeek = normalizeDayOfWeek(config.getJobName(), config.getCronDayOfWeek());
        ScheduleSpec spec = new ScheduleSpec(ScheduleType.CRON, null, dayOfWeek, hour, minute,
                onlyMarketHours, startHour, endHour);
        if (!CronExpression.isValidExpression(spec.cronExpression())) {
            throw new InvalidScheduleException("Job " + config.getJobName()
                    + " produced an invalid cron expression: " + spec.cronExpression());
        }
        return spec;
    }

    /**
     * Six-field Spring cron expression for CRON specs.
     */
    public String cronExpression() {
        if (type != ScheduleType.CRON) {
            throw new IllegalStateException("Not a cron schedule");
        }
        return "0 " + minute + " " + hour + " * * " + dayOfWeek;
    }

    /**
     * First fire strictly after {@code from}, in {@code from}'s zone.
     */
    public ZonedDateTime nextFireAfter(ZonedDateTime from) {
        if (type == ScheduleType.INTERVAL) {
            return from.plus(interval);
        }
        return CronExpression.parse(cronExpression()).next(from);
    }

    public String describe() {
        String base = type == ScheduleType.INTERVAL
                ? "every " + interval
                : "cron '" + cronExpression() + "'";
        return onlyMarketHours ? base + " during market hours" : base;
    }

    private static String normalizeDayOfWeek(String jobName, String raw) {
        if (raw == null || raw.isBlank() || raw.trim().equals("*")) {
            return "*";
        }
        String value = raw.replace(" ", "").toLowerCase(Locale.ROOT);
        if (!DAY_OF_WEEK.matcher(value).matches()) {
            throw new InvalidScheduleException("Job " + jobName + " has an invalid day of week: " + raw);
        }
        for (String token : value.split("[,-]")) {
            if (!DAY_NAMES.contains(token)) {
                throw new InvalidScheduleException("Job " + jobName + " has an unknown day name: " + token);
            }
        }
        return value.toUpperCase(Locale.ROOT);
    }
}
