package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.ExecutionStatus;
import com.marketdata.jobs.domain.JobExecutionStatus;
import com.marketdata.jobs.repository.JobExecutionStatusRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Records the lifecycle of job runs in {@code job_execution_status}.
 * Each operation is its own short transaction; no transaction spans a job body.
 * A run leaves RUNNING exactly once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExecutionTracker {

    static final int MAX_ERROR_MESSAGE_LENGTH = 1000;

    private final JobExecutionStatusRepository repository;
    private final Clock clock;

    /**
     * Open a RUNNING row for a job.
     *
     * @param jobName   the job name
     * @param nextRunAt next scheduled fire, or null for unscheduled runs
     * @return the run id
     * @throws IllegalStateException if the row could not be written
     */
    @Transactional
    public Long begin(String jobName, LocalDateTime nextRunAt) {
        JobExecutionStatus run = JobExecutionStatus.builder()
                .jobName(jobName)
                .status(ExecutionStatus.RUNNING)
                .startedAt(now())
                .nextRunAt(nextRunAt)
                .build();

        JobExecutionStatus saved = repository.saveAndFlush(run);
        if (saved.getId() == null) {
            throw new IllegalStateException("Run record for " + jobName + " was not assigned an id");
        }
        log.info("Run {} of {} started", saved.getId(), jobName);
        return saved.getId();
    }

    @Transactional
    public Long begin(String jobName) {
        return begin(jobName, null);
    }

    /**
     * Mark a run completed.
     *
     * @throws IllegalStateException if the run is unknown or already terminal
     */
    @Transactional
    public void complete(Long runId, long recordsProcessed) {
        JobExecutionStatus run = loadRunning(runId);
        LocalDateTime finishedAt = now();
        run.setStatus(ExecutionStatus.COMPLETED);
        run.setCompletedAt(finishedAt);
        run.setDurationSeconds(secondsBetween(run.getStartedAt(), finishedAt));
        run.setRecordsProcessed(recordsProcessed);
        persistTransition(run);
        log.info("Run {} of {} completed in {}s, {} records", runId, run.getJobName(),
                run.getDurationSeconds(), recordsProcessed);
    }

    /**
     * Mark a run failed. The message is truncated to fit the column.
     *
     * @throws IllegalStateException if the run is unknown or already terminal
     */
    @Transactional
    public void fail(Long runId, String message) {
        JobExecutionStatus run = loadRunning(runId);
        LocalDateTime finishedAt = now();
        run.setStatus(ExecutionStatus.FAILED);
        run.setCompletedAt(finishedAt);
        run.setDurationSeconds(secondsBetween(run.getStartedAt(), finishedAt));
        run.setErrorMessage(truncate(message));
        persistTransition(run);
        log.warn("Run {} of {} failed after {}s: {}", runId, run.getJobName(), run.getDurationSeconds(),
                run.getErrorMessage());
    }

    /**
     * Write a terminal SKIPPED row for a fire that did not run.
     */
    @Transactional
    public Long recordSkipped(String jobName, String reason) {
        LocalDateTime at = now();
        JobExecutionStatus skipped = repository.save(JobExecutionStatus.builder()
                .jobName(jobName)
                .status(ExecutionStatus.SKIPPED)
                .startedAt(at)
                .completedAt(at)
                .durationSeconds(0.0)
                .recordsProcessed(0L)
                .errorMessage(truncate(reason))
                .build());
        log.info("Recorded skipped fire of {}: {}", jobName, reason);
        return skipped.getId();
    }

    /**
     * Delete all but the {@code keep} most recently started runs of a job.
     *
     * @return number of rows deleted
     */
    @Transactional
    public int pruneHistory(String jobName, int keep) {
        if (keep < 1) {
            throw new IllegalArgumentException("keep must be at least 1");
        }
        List<Long> keepIds = repository.findIdsByJobNameNewestFirst(jobName, PageRequest.of(0, keep));
        if (keepIds.isEmpty()) {
            return 0;
        }
        int deleted = repository.deleteByJobNameAndIdNotIn(jobName, keepIds);
        if (deleted > 0) {
            log.debug("Pruned {} history rows of {}", deleted, jobName);
        }
        return deleted;
    }

    /**
     * Fail every RUNNING row. Used at startup, when no run of this process
     * can be in progress yet.
     *
     * @return number of rows marked failed
     */
    @Transactional
    public int failAllRunning(String message) {
        return failAllRunning(message, Collections.emptySet());
    }

    /**
     * Fail every RUNNING row except those of jobs that are live in this process.
     *
     * @param liveJobs job names whose RUNNING rows are left alone
     * @return number of rows marked failed
     */
    @Transactional
    public int failAllRunning(String message, Set<String> liveJobs) {
        List<JobExecutionStatus> running = repository.findByStatus(ExecutionStatus.RUNNING).stream()
                .filter(run -> !liveJobs.contains(run.getJobName()))
                .collect(Collectors.toList());
        LocalDateTime finishedAt = now();
        for (JobExecutionStatus run : running) {
            run.setStatus(ExecutionStatus.FAILED);
            run.setCompletedAt(finishedAt);
            run.setDurationSeconds(secondsBetween(run.getStartedAt(), finishedAt));
            run.setErrorMessage(truncate(message));
        }
        repository.saveAll(running);
        if (!running.isEmpty()) {
            log.warn("Marked {} dangling runs as failed", running.size());
        }
        return running.size();
    }

    @Transactional(readOnly = true)
    public List<JobExecutionStatus> history(String jobName, int limit) {
        return repository.findByJobNameOrderByStartedAtDescIdDesc(jobName, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public Optional<JobExecutionStatus> latest(String jobName) {
        return repository.findFirstByJobNameOrderByStartedAtDescIdDesc(jobName);
    }

    @Transactional(readOnly = true)
    public List<String> trackedJobNames() {
        return repository.findDistinctJobNames();
    }

    private JobExecutionStatus loadRunning(Long runId) {
        JobExecutionStatus run = repository.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Run not found: " + runId));
        if (run.getStatus().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.getStatus());
        }
        return run;
    }

    private void persistTransition(JobExecutionStatus run) {
        try {
            repository.saveAndFlush(run);
        } catch (OptimisticLockingFailureException e) {
            throw new IllegalStateException("Run " + run.getId() + " was finished concurrently", e);
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static double secondsBetween(LocalDateTime start, LocalDateTime end) {
        return Duration.between(start, end).toMillis() / 1000.0;
    }

    static String truncate(String message) {
        if (message == null) {
            return null;
        }
        // Truncate error message to prevent database field overflow
        if (message.length() > MAX_ERROR_MESSAGE_LENGTH) {
            return message.substring(0, MAX_ERROR_MESSAGE_LENGTH - 3) + "...";
        }
        return message;
    }
}
