package com.marketdata.jobs.infrastructure;

import com.marketdata.jobs.domain.DateRange;
import com.marketdata.jobs.exception.JobAlreadyRunningException;
import com.marketdata.jobs.jobs.JobContext;
import com.marketdata.jobs.jobs.JobRegistry;
import com.marketdata.jobs.jobs.ScheduledJob;
import com.marketdata.jobs.jobs.TriggerSource;
import com.marketdata.jobs.service.ExecutionTracker;
import com.marketdata.jobs.service.JobMetricsService;
import com.marketdata.jobs.service.JobRunner;
import com.marketdata.jobs.service.RunOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Single entry point for starting jobs.
 * Scheduled, manual and chained runs all take the per-job-name lock here,
 * so at most one instance of a job runs at a time whichever path started it.
 */
@Component
@Slf4j
public class JobLauncher {

    private final JobRegistry jobRegistry;
    private final JobRunner jobRunner;
    private final JobLockService jobLockService;
    private final ExecutionTracker executionTracker;
    private final JobMetricsService metricsService;
    private final TaskExecutor jobExecutor;

    public JobLauncher(JobRegistry jobRegistry,
            JobRunner jobRunner,
            JobLockService jobLockService,
            ExecutionTracker executionTracker,
            JobMetricsService metricsService,
            @Qualifier("jobExecutor") TaskExecutor jobExecutor) {
        this.jobRegistry = jobRegistry;
        this.jobRunner = jobRunner;
        this.jobLockService = jobLockService;
        this.executionTracker = executionTracker;
        this.metricsService = metricsService;
        this.jobExecutor = jobExecutor;
    }

    /**
     * Fire a job from its trigger. Runs asynchronously on the job executor.
     * A fire that finds the job still running is recorded as SKIPPED.
     *
     * @return future of the run outcome
     */
    public CompletableFuture<RunOutcome> launchScheduled(String jobName, LocalDateTime nextRunAt) {
        ScheduledJob job = jobRegistry.require(jobName);
        if (!jobLockService.tryAcquire(jobName)) {
            log.warn("Scheduled fire of {} skipped: previous run still in progress", jobName);
            metricsService.recordJobSkipped();
            Long skippedId = executionTracker.recordSkipped(jobName, "Previous run still in progress");
            return CompletableFuture.completedFuture(RunOutcome.skipped(jobName, skippedId,
                    "Previous run still in progress"));
        }

        JobContext context = JobContext.builder()
                .jobName(jobName)
                .trigger(TriggerSource.SCHEDULED)
                .nextRunAt(nextRunAt)
                .build();
        return submitLocked(job, context);
    }

    /**
     * Start a job on demand. Runs asynchronously on the job executor.
     *
     * @param dateRange optional explicit range, only for jobs that support one
     * @throws JobAlreadyRunningException if another run of the job holds the lock
     * @throws IllegalArgumentException   if a range is given to a job without range support
     */
    public CompletableFuture<RunOutcome> launchManual(String jobName, DateRange dateRange) {
        ScheduledJob job = jobRegistry.require(jobName);
        if (dateRange != null && !job.supportsDateRange()) {
            throw new IllegalArgumentException("Job " + jobName + " does not accept a date range");
        }
        if (!jobLockService.tryAcquire(jobName)) {
            throw new JobAlreadyRunningException(jobName);
        }

        log.info("Manual run of {} requested{}", jobName, dateRange != null ? " for " + dateRange.label() : "");
        JobContext context = JobContext.builder()
                .jobName(jobName)
                .trigger(TriggerSource.MANUAL)
                .dateRange(dateRange)
                .build();
        return submitLocked(job, context);
    }

    /**
     * Run a downstream job of a chain on the calling thread.
     *
     * @return the outcome, or empty if the job was already running and the step was skipped
     */
    public Optional<RunOutcome> runChained(String jobName) {
        ScheduledJob job = jobRegistry.require(jobName);
        if (!jobLockService.tryAcquire(jobName)) {
            log.warn("Chained run of {} skipped: already running", jobName);
            metricsService.recordJobSkipped();
            return Optional.empty();
        }
        try {
            return Optional.of(jobRunner.execute(job, JobContext.of(jobName, TriggerSource.CHAINED)));
        } finally {
            jobLockService.release(jobName);
        }
    }

    /**
     * Run arbitrary work under a job's lock on the calling thread.
     *
     * @throws JobAlreadyRunningException if the job is running
     */
    public <T> T runExclusive(String jobName, Supplier<T> work) {
        if (!jobLockService.tryAcquire(jobName)) {
            throw new JobAlreadyRunningException(jobName);
        }
        try {
            return work.get();
        } finally {
            jobLockService.release(jobName);
        }
    }

    public boolean isRunning(String jobName) {
        return jobLockService.isLocked(jobName);
    }

    private CompletableFuture<RunOutcome> submitLocked(ScheduledJob job, JobContext context) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return jobRunner.execute(job, context);
                } finally {
                    jobLockService.release(job.name());
                }
            }, jobExecutor).whenComplete((outcome, error) -> {
                if (error != null) {
                    log.error("Run of {} could not be tracked: {}", job.name(), error.getMessage(), error);
                }
            });
        } catch (TaskRejectedException e) {
            jobLockService.release(job.name());
            log.error("Job executor rejected {}: {}", job.name(), e.getMessage());
            throw e;
        }
    }
}
