package com.marketdata.jobs.service;

import com.marketdata.jobs.config.ChainProperties;
import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.infrastructure.JobLauncher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cascades a successfully completed job into the next job of its pipeline.
 * Edges are static configuration with optional day and hour gates.
 * The parent run's status is final before the chain starts, so a failing
 * downstream job never affects it.
 */
@Service
@Slf4j
public class ChainManager {

    private final ChainProperties chainProperties;
    private final ZoneId zone;
    private final Clock clock;
    private final JobLauncher jobLauncher;

    public ChainManager(ChainProperties chainProperties, JobsProperties jobsProperties, Clock clock,
            @Lazy JobLauncher jobLauncher) {
        this.chainProperties = chainProperties;
        this.zone = jobsProperties.zoneId();
        this.clock = clock;
        this.jobLauncher = jobLauncher;
    }

    /**
     * Run the job chained after {@code jobName}, if any, on the calling thread.
     * A missing edge, a closed gate or a failing downstream job all end the chain quietly.
     */
    public void triggerNext(String jobName) {
        Optional<String> next = resolveNext(jobName, ZonedDateTime.now(clock.withZone(zone)));
        if (next.isEmpty()) {
            return;
        }

        log.info("Chaining {} -> {}", jobName, next.get());
        try {
            jobLauncher.runChained(next.get());
        } catch (RuntimeException e) {
            log.error("Chained job {} after {} failed: {}", next.get(), jobName, e.getMessage(), e);
        }
    }

    /**
     * Next job for {@code jobName} at the given local time, or empty if the
     * chain ends here or the edge's gate is closed.
     */
    public Optional<String> resolveNext(String jobName, ZonedDateTime now) {
        ChainProperties.Edge edge = chainProperties.getEdges().get(jobName);
        if (edge == null || edge.getNext() == null || edge.getNext().isBlank()) {
            log.debug("No chain configured after {}", jobName);
            return Optional.empty();
        }

        ZonedDateTime local = now.withZoneSameInstant(zone);
        String blockedBy = gateFailure(edge, local);
        if (blockedBy != null) {
            log.info("Chain {} -> {} not triggered: {}", jobName, edge.getNext(), blockedBy);
            return Optional.empty();
        }
        return Optional.of(edge.getNext());
    }

    private static String gateFailure(ChainProperties.Edge edge, ZonedDateTime local) {
        DayOfWeek day = local.getDayOfWeek();
        if (edge.isWeekdayOnly() && (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY)) {
            return "weekday only, today is " + day;
        }
        if (edge.getDaysOfWeek() != null && !edge.getDaysOfWeek().isEmpty()
                && !edge.getDaysOfWeek().contains(day)) {
            return "runs only on " + edge.getDaysOfWeek() + ", today is " + day;
        }
        if (edge.getMaxHour() != null && local.toLocalTime().isAfter(LocalTime.of(edge.getMaxHour(), 0))) {
            return "past " + edge.getMaxHour() + ":00";
        }
        return null;
    }
}
