package com.marketdata.jobs.service;

import com.marketdata.jobs.controller.dto.CleanupResponse;
import com.marketdata.jobs.controller.dto.ExecutionResponse;
import com.marketdata.jobs.controller.dto.JobConfigUpdateRequest;
import com.marketdata.jobs.controller.dto.JobSummaryResponse;
import com.marketdata.jobs.controller.dto.RunJobRequest;
import com.marketdata.jobs.controller.dto.RunJobResponse;
import com.marketdata.jobs.controller.dto.ScanErrorResponse;
import com.marketdata.jobs.controller.dto.ScanResponse;
import com.marketdata.jobs.domain.MarketStatus;
import com.marketdata.jobs.infrastructure.ReloadResult;
import com.marketdata.jobs.service.scan.RetrySummary;

import java.util.List;

/**
 * Administrative operations over jobs and scans.
 */
public interface JobControlService {

    /**
     * List every configured or registered job with its latest run.
     */
    List<JobSummaryResponse> listJobs();

    /**
     * Partially update a job's configuration. Takes effect on the next reload.
     *
     * @param jobName the job name
     * @param request fields to change
     * @return the updated job
     */
    JobSummaryResponse updateJobConfig(String jobName, JobConfigUpdateRequest request);

    /**
     * Re-arm triggers whose configuration changed.
     */
    ReloadResult reloadSchedules();

    /**
     * Start a job now, optionally over an explicit date range.
     *
     * @param jobName the job name
     * @param request optional date range, may be null
     * @return acknowledgement; the run continues in the background
     */
    RunJobResponse runJobNow(String jobName, RunJobRequest request);

    /**
     * Most recent runs of a job, newest first.
     *
     * @param jobName the job name
     * @param limit   maximum number of rows, 1 to 100
     */
    List<ExecutionResponse> getExecutionHistory(String jobName, int limit);

    List<ScanResponse> listScans(int limit);

    /**
     * Diagnostics of one scan, newest first.
     *
     * @param scanId the scan id
     * @param limit  maximum number of rows, 1 to 1000
     */
    List<ScanErrorResponse> getScanErrors(Long scanId, int limit);

    /**
     * Retry the transient provider errors of a scan.
     */
    RetrySummary retryScan(Long scanId);

    /**
     * Fail every run and scan still marked running, except those of jobs
     * this process is still running.
     */
    CleanupResponse cleanupStuckRuns();

    /**
     * Current session state of the exchange as seen by the market-hours gate.
     */
    MarketStatus getMarketStatus();
}
