package com.marketdata.jobs.jobs;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.service.ExecutionTracker;
import com.marketdata.jobs.service.scan.ScanRunRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Retention sweep: keeps the most recent history rows of every job and the
 * most recent scans with their errors.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionCleanupJob implements ScheduledJob {

    private final ExecutionTracker executionTracker;
    private final ScanRunRecorder scanRunRecorder;
    private final JobsProperties properties;

    @Override
    public String name() {
        return "ttl_cleanup";
    }

    @Override
    public JobResult run(JobContext context) {
        int keep = properties.getHistory().getKeep();
        long deleted = 0;
        for (String jobName : executionTracker.trackedJobNames()) {
            deleted += executionTracker.pruneHistory(jobName, keep);
        }
        int scansDeleted = scanRunRecorder.pruneScans(properties.getScan().getKeepRuns());
        log.info("Retention removed {} history rows and {} scans", deleted, scansDeleted);
        return JobResult.of(deleted + scansDeleted);
    }
}
