package com.marketdata.jobs.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking job and scan metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class JobMetricsService {

    private final Counter jobsStartedCounter;
    private final Counter jobsCompletedCounter;
    private final Counter jobsFailedCounter;
    private final Counter jobsSkippedCounter;
    private final Counter scansCompletedCounter;
    private final Counter scansFailedCounter;
    private final Counter symbolsFetchedCounter;
    private final Counter scanErrorsCounter;
    private final Timer executionTimer;

    public JobMetricsService(MeterRegistry meterRegistry) {
        this.jobsStartedCounter = Counter.builder("jobs.runs.started")
                .description("Total number of job runs started")
                .register(meterRegistry);

        this.jobsCompletedCounter = Counter.builder("jobs.runs.completed")
                .description("Total number of job runs completed successfully")
                .register(meterRegistry);

        this.jobsFailedCounter = Counter.builder("jobs.runs.failed")
                .description("Total number of job runs that failed")
                .register(meterRegistry);

        this.jobsSkippedCounter = Counter.builder("jobs.runs.skipped")
                .description("Total number of fires skipped because the job was already running")
                .register(meterRegistry);

        this.scansCompletedCounter = Counter.builder("jobs.scans.completed")
                .description("Total number of EOD scans completed")
                .register(meterRegistry);

        this.scansFailedCounter = Counter.builder("jobs.scans.failed")
                .description("Total number of EOD scans aborted")
                .register(meterRegistry);

        this.symbolsFetchedCounter = Counter.builder("jobs.scans.symbols.fetched")
                .description("Total number of symbols fetched with data")
                .register(meterRegistry);

        this.scanErrorsCounter = Counter.builder("jobs.scans.errors")
                .description("Total number of scan diagnostics recorded")
                .register(meterRegistry);

        this.executionTimer = Timer.builder("jobs.execution.time")
                .description("Job run execution time")
                .register(meterRegistry);

        log.info("JobMetricsService initialized with Micrometer metrics");
    }

    public void recordJobStarted() {
        jobsStartedCounter.increment();
    }

    /**
     * Record a successful run with its execution time.
     */
    public void recordJobCompleted(long executionTimeMs) {
        jobsCompletedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordJobFailed(long executionTimeMs) {
        jobsFailedCounter.increment();
        executionTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordJobSkipped() {
        jobsSkippedCounter.increment();
    }

    public void recordScanCompleted() {
        scansCompletedCounter.increment();
    }

    public void recordScanFailed() {
        scansFailedCounter.increment();
    }

    public void recordSymbolFetched() {
        symbolsFetchedCounter.increment();
    }

    public void recordScanError() {
        scanErrorsCounter.increment();
    }

    /**
     * One-line summary of the process-wide counters, logged after each run.
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Started=%d, Completed=%d, Failed=%d, Skipped=%d, Scans=%d/%d, AvgExecTime=%.2fs",
                (long) jobsStartedCounter.count(),
                (long) jobsCompletedCounter.count(),
                (long) jobsFailedCounter.count(),
                (long) jobsSkippedCounter.count(),
                (long) scansCompletedCounter.count(),
                (long) scansFailedCounter.count(),
                executionTimer.mean(TimeUnit.SECONDS));
    }
}
