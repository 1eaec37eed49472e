package com.marketdata.jobs.service;

import com.marketdata.jobs.controller.dto.CleanupResponse;
import com.marketdata.jobs.jobs.EodScanJob;
import com.marketdata.jobs.service.scan.ScanRunRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Set;

/**
 * Closes runs and scans left RUNNING by a process that died mid-run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StuckRunCleaner {

    private final ExecutionTracker executionTracker;
    private final ScanRunRecorder scanRunRecorder;

    /**
     * Startup recovery: nothing of this process is running yet.
     */
    public CleanupResponse failRunning(String reason) {
        return failRunning(reason, Collections.emptySet());
    }

    /**
     * Fail dangling rows, leaving alone the jobs this process is still running.
     * Scans are only touched when the scan job is idle, since a live scan holds its lock.
     *
     * @param liveJobs names of jobs currently holding their lock
     */
    public CleanupResponse failRunning(String reason, Set<String> liveJobs) {
        int runs = executionTracker.failAllRunning(reason, liveJobs);
        int scans = liveJobs.contains(EodScanJob.NAME) ? 0 : scanRunRecorder.failAllRunning();
        log.info("Stuck-run cleanup: {} runs and {} scans marked failed, live jobs skipped: {}",
                runs, scans, liveJobs);
        return CleanupResponse.builder()
                .runsFailed(runs)
                .scansFailed(scans)
                .build();
    }
}
