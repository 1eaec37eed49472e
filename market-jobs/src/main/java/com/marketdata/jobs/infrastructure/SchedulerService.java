package com.marketdata.jobs.infrastructure;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.domain.ScheduleType;
import com.marketdata.jobs.exception.InvalidScheduleException;
import com.marketdata.jobs.jobs.JobRegistry;
import com.marketdata.jobs.service.JobConfigurationService;
import com.marketdata.jobs.service.MarketHoursGate;
import com.marketdata.jobs.service.ScheduleSpec;
import com.marketdata.jobs.service.StuckRunCleaner;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Clock-driven dispatcher for configured jobs.
 * <p>
 * Holds the set of armed triggers and the schedule each was armed from.
 * {@link #start()} recovers runs left RUNNING by a previous process and arms every
 * enabled job; {@link #reload()} re-reads configurations and re-arms only the jobs
 * whose schedule changed; {@link #stop()} cancels all triggers.
 * Fires run on a single coordinating thread and only hand the job to {@link JobLauncher}.
 */
@Service
@Slf4j
public class SchedulerService {

    static final String RESTART_MESSAGE = "Interrupted by restart";

    private final JobConfigurationService configurationService;
    private final JobRegistry jobRegistry;
    private final JobLauncher jobLauncher;
    private final MarketHoursGate marketHoursGate;
    private final StuckRunCleaner stuckRunCleaner;
    private final TaskScheduler taskScheduler;
    private final JobsProperties properties;
    private final Clock clock;
    private final ZoneId zone;

    private final Map<String, ArmedJob> armedJobs = new ConcurrentHashMap<>();
    private volatile boolean started;

    public SchedulerService(JobConfigurationService configurationService,
            JobRegistry jobRegistry,
            JobLauncher jobLauncher,
            MarketHoursGate marketHoursGate,
            StuckRunCleaner stuckRunCleaner,
            @Qualifier("jobTaskScheduler") TaskScheduler taskScheduler,
            JobsProperties properties,
            Clock clock) {
        this.configurationService = configurationService;
        this.jobRegistry = jobRegistry;
        this.jobLauncher = jobLauncher;
        this.marketHoursGate = marketHoursGate;
        this.stuckRunCleaner = stuckRunCleaner;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
        this.zone = properties.zoneId();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduler().isEnabled()) {
            log.info("Job scheduler is disabled");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (started) {
            log.warn("Scheduler already started");
            return;
        }
        stuckRunCleaner.failRunning(RESTART_MESSAGE);
        started = true;
        ReloadResult result = reload();
        log.info("Scheduler started in zone {} with {} armed jobs", zone, result.getArmed().size());
    }

    /**
     * Re-read all configurations and bring the armed triggers in line with them.
     */
    public synchronized ReloadResult reload() {
        ReloadResult result = new ReloadResult();
        if (!started) {
            log.warn("Scheduler not started, configuration will be applied on start");
            return result;
        }

        Map<String, ScheduleSpec> desired = new LinkedHashMap<>();
        for (JobConfiguration config : configurationService.listAll()) {
            if (!Boolean.TRUE.equals(config.getEnabled())) {
                continue;
            }
            if (jobRegistry.find(config.getJobName()).isEmpty()) {
                log.warn("No job registered for configuration {}, not arming it", config.getJobName());
                result.getInvalid().add(config.getJobName());
                continue;
            }
            try {
                desired.put(config.getJobName(), ScheduleSpec.from(config));
            } catch (InvalidScheduleException e) {
                log.error("Invalid schedule, job not armed: {}", e.getMessage());
                result.getInvalid().add(config.getJobName());
            }
        }

        Iterator<Map.Entry<String, ArmedJob>> it = armedJobs.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, ArmedJob> entry = it.next();
            ScheduleSpec wanted = desired.get(entry.getKey());
            if (wanted == null) {
                entry.getValue().cancel();
                it.remove();
                result.getDisarmed().add(entry.getKey());
                log.info("Disarmed {}", entry.getKey());
            } else if (!wanted.equals(entry.getValue().spec)) {
                entry.getValue().cancel();
                it.remove();
                result.getRearmed().add(entry.getKey());
            }
        }

        for (Map.Entry<String, ScheduleSpec> entry : desired.entrySet()) {
            String jobName = entry.getKey();
            if (armedJobs.containsKey(jobName)) {
                result.getUnchanged().add(jobName);
                continue;
            }
            arm(jobName, entry.getValue());
            if (!result.getRearmed().contains(jobName)) {
                result.getArmed().add(jobName);
            }
        }

        log.info("Scheduler reload: armed={}, rearmed={}, disarmed={}, unchanged={}, invalid={}",
                result.getArmed(), result.getRearmed(), result.getDisarmed(), result.getUnchanged(),
                result.getInvalid());
        return result;
    }

    @PreDestroy
    public synchronized void stop() {
        if (!started) {
            return;
        }
        armedJobs.values().forEach(ArmedJob::cancel);
        armedJobs.clear();
        started = false;
        log.info("Scheduler stopped, all triggers cancelled");
    }

    public boolean isStarted() {
        return started;
    }

    /**
     * Next planned fire of an armed job.
     */
    public Optional<ZonedDateTime> nextFireTime(String jobName) {
        ArmedJob armed = armedJobs.get(jobName);
        if (armed == null) {
            return Optional.empty();
        }
        return Optional.of(armed.spec.nextFireAfter(ZonedDateTime.now(clock.withZone(zone))));
    }

    Map<String, ScheduleSpec> armedSpecs() {
        Map<String, ScheduleSpec> specs = new HashMap<>();
        armedJobs.forEach((name, armed) -> specs.put(name, armed.spec));
        return specs;
    }

    private void arm(String jobName, ScheduleSpec spec) {
        MisfireAwareTrigger trigger = new MisfireAwareTrigger(toTrigger(spec));
        ScheduledFuture<?> future = taskScheduler.schedule(() -> fire(jobName, spec, trigger), trigger);
        if (future == null) {
            log.error("Task scheduler refused to arm {}", jobName);
            return;
        }
        armedJobs.put(jobName, new ArmedJob(spec, future));
        log.info("Armed {}: {}", jobName, spec.describe());
    }

    private Trigger toTrigger(ScheduleSpec spec) {
        if (spec.getType() == ScheduleType.CRON) {
            return new CronTrigger(spec.cronExpression(), zone);
        }
        PeriodicTrigger periodic = new PeriodicTrigger(spec.getInterval());
        periodic.setFixedRate(true);
        periodic.setInitialDelay(spec.getInterval());
        return periodic;
    }

    void fire(String jobName, ScheduleSpec spec, MisfireAwareTrigger trigger) {
        Instant now = clock.instant();
        Instant scheduledFor = trigger.getCurrentScheduledTime();
        int grace = properties.getScheduler().getMisfireGraceSeconds();
        if (scheduledFor != null && Duration.between(scheduledFor, now).getSeconds() > grace) {
            log.warn("Fire of {} scheduled for {} missed its {}s grace period, skipped", jobName, scheduledFor, grace);
            return;
        }
        if (spec.isOnlyMarketHours() && !withinMarketWindow(spec, now)) {
            log.info("Fire of {} skipped: outside market hours", jobName);
            return;
        }

        LocalDateTime nextRunAt = LocalDateTime.ofInstant(
                spec.nextFireAfter(now.atZone(zone)).toInstant(), clock.getZone());
        try {
            jobLauncher.launchScheduled(jobName, nextRunAt);
        } catch (RuntimeException e) {
            // a failed launch must not cancel future fires
            log.error("Failed to launch {}: {}", jobName, e.getMessage(), e);
        }
    }

    boolean withinMarketWindow(ScheduleSpec spec, Instant now) {
        if (!marketHoursGate.isOpen(now)) {
            return false;
        }
        if (spec.getMarketStartHour() == null || spec.getMarketEndHour() == null) {
            return true;
        }
        int hour = now.atZone(zone).getHour();
        return hour >= spec.getMarketStartHour() && hour < spec.getMarketEndHour();
    }

    private static final class ArmedJob {
        private final ScheduleSpec spec;
        private final ScheduledFuture<?> future;

        private ArmedJob(ScheduleSpec spec, ScheduledFuture<?> future) {
            this.spec = spec;
            this.future = future;
        }

        private void cancel() {
            future.cancel(false);
        }
    }

    /**
     * Remembers the time the next execution was planned for, so a fire can tell how late it is.
     */
    static final class MisfireAwareTrigger implements Trigger {
        private final Trigger delegate;
        private volatile Instant currentScheduledTime;

        MisfireAwareTrigger(Trigger delegate) {
            this.delegate = delegate;
        }

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            Instant next = delegate.nextExecution(triggerContext);
            currentScheduledTime = next;
            return next;
        }

        Instant getCurrentScheduledTime() {
            return currentScheduledTime;
        }
    }
}
