package com.marketdata.jobs.controller;

import com.marketdata.jobs.controller.dto.CleanupResponse;
import com.marketdata.jobs.controller.dto.ExecutionResponse;
import com.marketdata.jobs.controller.dto.JobConfigUpdateRequest;
import com.marketdata.jobs.controller.dto.JobSummaryResponse;
import com.marketdata.jobs.controller.dto.RunJobRequest;
import com.marketdata.jobs.controller.dto.RunJobResponse;
import com.marketdata.jobs.infrastructure.ReloadResult;
import com.marketdata.jobs.service.JobControlService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for job configuration and manual runs.
 */
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobController {

    private final JobControlService jobControlService;

    /**
     * List every job with its schedule, running flag and latest run.
     */
    @GetMapping
    public ResponseEntity<List<JobSummaryResponse>> listJobs() {
        return ResponseEntity.ok(jobControlService.listJobs());
    }

    /**
     * Update part of a job's configuration. Triggers pick it up on the next reload.
     *
     * @param jobName the job name
     * @param request the fields to change
     * @return the updated job
     */
    @PatchMapping("/{jobName}")
    public ResponseEntity<JobSummaryResponse> updateJobConfig(
            @PathVariable String jobName,
            @Valid @RequestBody JobConfigUpdateRequest request) {

        log.info("PATCH /jobs/{} - Updating configuration", jobName);

        return ResponseEntity.ok(jobControlService.updateJobConfig(jobName, request));
    }

    @PostMapping("/reload")
    public ResponseEntity<ReloadResult> reload() {
        log.info("POST /jobs/reload - Reloading schedules");
        return ResponseEntity.ok(jobControlService.reloadSchedules());
    }

    /**
     * Start a job now. The run continues in the background.
     *
     * @param jobName the job name
     * @param request optional date range
     * @return 202 with an acknowledgement, 409 if the job is already running
     */
    @PostMapping("/{jobName}/run")
    public ResponseEntity<RunJobResponse> runJobNow(
            @PathVariable String jobName,
            @RequestBody(required = false) RunJobRequest request) {

        log.info("POST /jobs/{}/run - Manual run requested", jobName);

        RunJobResponse response = jobControlService.runJobNow(jobName, request);

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/{jobName}/history")
    public ResponseEntity<List<ExecutionResponse>> getExecutionHistory(
            @PathVariable String jobName,
            @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(jobControlService.getExecutionHistory(jobName, limit));
    }

    /**
     * Mark every run and scan still flagged as running as failed.
     */
    @PostMapping("/cleanup-stuck")
    public ResponseEntity<CleanupResponse> cleanupStuckRuns() {
        log.info("POST /jobs/cleanup-stuck - Failing stuck runs");
        return ResponseEntity.ok(jobControlService.cleanupStuckRuns());
    }
}
