package com.marketdata.jobs.service;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.ExecutionStatus;
import com.marketdata.jobs.jobs.JobContext;
import com.marketdata.jobs.jobs.JobResult;
import com.marketdata.jobs.jobs.ScheduledJob;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs a job body under execution tracking.
 * Opens the run record, executes the body, records the terminal status,
 * prunes history and, on success only, hands over to the chain manager.
 * Callers are expected to hold the job's lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobRunner {

    private final ExecutionTracker executionTracker;
    private final ChainManager chainManager;
    private final JobMetricsService metricsService;
    private final JobsProperties properties;

    public RunOutcome execute(ScheduledJob job, JobContext context) {
        String previousJobName = MDC.get("jobName");
        MDC.put("jobName", job.name());
        try {
            RunOutcome outcome = executeInternal(job, context);
            if (outcome.isCompleted()) {
                chainManager.triggerNext(job.name());
            }
            return outcome;
        } finally {
            // chained runs nest inside their parent's MDC scope
            if (previousJobName != null) {
                MDC.put("jobName", previousJobName);
            } else {
                MDC.remove("jobName");
            }
        }
    }

    private RunOutcome executeInternal(ScheduledJob job, JobContext context) {
        // No run id means no work: begin() failures propagate to the caller
        Long runId = executionTracker.begin(job.name(), context.getNextRunAt());
        MDC.put("runId", String.valueOf(runId));
        metricsService.recordJobStarted();

        long startTime = System.currentTimeMillis();
        log.info("Started ({})", context.getTrigger());

        try {
            JobResult result = job.run(context.toBuilder().runId(runId).build());
            if (result == null) {
                throw new IllegalStateException("Job " + job.name() + " returned no result");
            }

            executionTracker.complete(runId, result.getRecordsProcessed());
            long executionTimeMs = System.currentTimeMillis() - startTime;
            metricsService.recordJobCompleted(executionTimeMs);
            log.info("Completed in {}s{}", executionTimeMs / 1000.0,
                    result.getSummary() != null ? ": " + result.getSummary() : "");

            return RunOutcome.builder()
                    .jobName(job.name())
                    .runId(runId)
                    .status(ExecutionStatus.COMPLETED)
                    .recordsProcessed(result.getRecordsProcessed())
                    .build();

        } catch (IllegalStateException e) {
            log.error("Invalid state: {}", e.getMessage(), e);
            return handleFailure(job, runId, e, startTime);
        } catch (RuntimeException e) {
            log.error("Error during execution: {}", e.getMessage(), e);
            return handleFailure(job, runId, e, startTime);
        } finally {
            pruneHistory(job.name());
            log.debug(metricsService.getMetricsSummary());
            MDC.remove("runId");
        }
    }

    private RunOutcome handleFailure(ScheduledJob job, Long runId, Exception error, long startTime) {
        String errorMessage = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        metricsService.recordJobFailed(System.currentTimeMillis() - startTime);

        try {
            executionTracker.fail(runId, errorMessage);
        } catch (IllegalStateException e) {
            // the row was already closed, e.g. by a stuck-run cleanup
            log.warn("Could not mark run {} failed: {}", runId, e.getMessage());
        }

        return RunOutcome.builder()
                .jobName(job.name())
                .runId(runId)
                .status(ExecutionStatus.FAILED)
                .errorMessage(ExecutionTracker.truncate(errorMessage))
                .build();
    }

    private void pruneHistory(String jobName) {
        try {
            executionTracker.pruneHistory(jobName, properties.getHistory().getKeep());
        } catch (RuntimeException e) {
            log.warn("Failed to prune history of {}: {}", jobName, e.getMessage());
        }
    }
}
