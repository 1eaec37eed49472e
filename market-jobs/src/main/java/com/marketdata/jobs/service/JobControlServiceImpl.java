package com.marketdata.jobs.service;

import com.marketdata.jobs.controller.dto.CleanupResponse;
import com.marketdata.jobs.controller.dto.ExecutionResponse;
import com.marketdata.jobs.controller.dto.JobConfigUpdateRequest;
import com.marketdata.jobs.controller.dto.JobSummaryResponse;
import com.marketdata.jobs.controller.dto.RunJobRequest;
import com.marketdata.jobs.controller.dto.RunJobResponse;
import com.marketdata.jobs.controller.dto.ScanErrorResponse;
import com.marketdata.jobs.controller.dto.ScanResponse;
import com.marketdata.jobs.domain.DateRange;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.domain.MarketStatus;
import com.marketdata.jobs.exception.InvalidScheduleException;
import com.marketdata.jobs.exception.JobNotFoundException;
import com.marketdata.jobs.infrastructure.JobLauncher;
import com.marketdata.jobs.infrastructure.ReloadResult;
import com.marketdata.jobs.infrastructure.SchedulerService;
import com.marketdata.jobs.jobs.EodScanJob;
import com.marketdata.jobs.jobs.JobRegistry;
import com.marketdata.jobs.service.scan.EodScanEngine;
import com.marketdata.jobs.service.scan.RetrySummary;
import com.marketdata.jobs.service.scan.ScanRunRecorder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Implementation of JobControlService over the configuration store,
 * the launcher, the tracker and the scan engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobControlServiceImpl implements JobControlService {

    static final int MAX_HISTORY_LIMIT = 100;
    static final int MAX_ERRORS_LIMIT = 1000;

    private final JobConfigurationService configurationService;
    private final JobRegistry jobRegistry;
    private final JobLauncher jobLauncher;
    private final SchedulerService schedulerService;
    private final ExecutionTracker executionTracker;
    private final ScanRunRecorder scanRunRecorder;
    private final EodScanEngine scanEngine;
    private final StuckRunCleaner stuckRunCleaner;
    private final MarketHoursGate marketHoursGate;
    private final Clock clock;

    @Override
    public List<JobSummaryResponse> listJobs() {
        Map<String, JobSummaryResponse> jobs = new TreeMap<>();
        for (JobConfiguration config : configurationService.listAll()) {
            jobs.put(config.getJobName(), toSummary(config));
        }
        for (String name : jobRegistry.names()) {
            jobs.computeIfAbsent(name, n -> JobSummaryResponse.builder()
                    .jobName(n)
                    .configured(false)
                    .registered(true)
                    .enabled(false)
                    .running(jobLauncher.isRunning(n))
                    .lastRun(executionTracker.latest(n).map(ExecutionResponse::from).orElse(null))
                    .build());
        }
        return new ArrayList<>(jobs.values());
    }

    @Override
    public JobSummaryResponse updateJobConfig(String jobName, JobConfigUpdateRequest request) {
        log.info("Updating configuration of {}", jobName);
        return toSummary(configurationService.update(jobName, request));
    }

    @Override
    public ReloadResult reloadSchedules() {
        return schedulerService.reload();
    }

    @Override
    public RunJobResponse runJobNow(String jobName, RunJobRequest request) {
        DateRange range = toRange(request);
        jobLauncher.launchManual(jobName, range);
        return RunJobResponse.builder()
                .jobName(jobName)
                .dateRange(range != null ? range.label() : null)
                .message("Job started")
                .build();
    }

    @Override
    public List<ExecutionResponse> getExecutionHistory(String jobName, int limit) {
        checkLimit(limit, MAX_HISTORY_LIMIT);
        if (configurationService.find(jobName).isEmpty() && jobRegistry.find(jobName).isEmpty()) {
            throw new JobNotFoundException(jobName);
        }
        return executionTracker.history(jobName, limit).stream()
                .map(ExecutionResponse::from)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScanResponse> listScans(int limit) {
        checkLimit(limit, MAX_HISTORY_LIMIT);
        return scanRunRecorder.recent(limit).stream()
                .map(ScanResponse::from)
                .collect(Collectors.toList());
    }

    @Override
    public List<ScanErrorResponse> getScanErrors(Long scanId, int limit) {
        checkLimit(limit, MAX_ERRORS_LIMIT);
        scanRunRecorder.require(scanId);
        return scanRunRecorder.errors(scanId, limit).stream()
                .map(ScanErrorResponse::from)
                .collect(Collectors.toList());
    }

    @Override
    public RetrySummary retryScan(Long scanId) {
        scanRunRecorder.require(scanId);
        log.info("Retrying transient errors of scan {}", scanId);
        return jobLauncher.runExclusive(EodScanJob.NAME, () -> scanEngine.retryScan(scanId));
    }

    @Override
    public CleanupResponse cleanupStuckRuns() {
        Set<String> liveJobs = jobRegistry.names().stream()
                .filter(jobLauncher::isRunning)
                .collect(Collectors.toCollection(TreeSet::new));
        return stuckRunCleaner.failRunning("Marked failed by stuck-run cleanup", liveJobs);
    }

    @Override
    public MarketStatus getMarketStatus() {
        return marketHoursGate.status(clock.instant());
    }

    private JobSummaryResponse toSummary(JobConfiguration config) {
        String jobName = config.getJobName();
        String schedule;
        try {
            schedule = ScheduleSpec.from(config).describe();
        } catch (InvalidScheduleException e) {
            schedule = "invalid: " + e.getMessage();
        }
        return JobSummaryResponse.builder()
                .jobName(jobName)
                .description(config.getDescription())
                .enabled(config.getEnabled())
                .configured(true)
                .registered(jobRegistry.find(jobName).isPresent())
                .running(jobLauncher.isRunning(jobName))
                .schedule(schedule)
                .scheduleType(config.getScheduleType())
                .intervalValue(config.getIntervalValue())
                .intervalUnit(config.getIntervalUnit())
                .cronDayOfWeek(config.getCronDayOfWeek())
                .cronHour(config.getCronHour())
                .cronMinute(config.getCronMinute())
                .onlyMarketHours(config.getOnlyMarketHours())
                .marketStartHour(config.getMarketStartHour())
                .marketEndHour(config.getMarketEndHour())
                .nextFireTime(schedulerService.nextFireTime(jobName).orElse(null))
                .lastRun(executionTracker.latest(jobName).map(ExecutionResponse::from).orElse(null))
                .build();
    }

    private static DateRange toRange(RunJobRequest request) {
        if (request == null || (request.getStartDate() == null && request.getEndDate() == null)) {
            return null;
        }
        if (request.getStartDate() == null || request.getEndDate() == null) {
            throw new IllegalArgumentException("startDate and endDate must be given together");
        }
        return new DateRange(request.getStartDate(), request.getEndDate());
    }

    private static void checkLimit(int limit, int max) {
        if (limit < 1 || limit > max) {
            throw new IllegalArgumentException("limit must be between 1 and " + max);
        }
    }
}
