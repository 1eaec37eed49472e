package com.marketdata.jobs.service;

import com.marketdata.jobs.controller.dto.JobConfigUpdateRequest;
import com.marketdata.jobs.domain.JobConfiguration;
import com.marketdata.jobs.exception.JobNotFoundException;
import com.marketdata.jobs.repository.JobConfigurationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of job schedules.
 * Updates are persisted immediately but only take effect on the next
 * scheduler reload; armed triggers are never changed from here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JobConfigurationService {

    private final JobConfigurationRepository repository;

    @Transactional(readOnly = true)
    public List<JobConfiguration> listAll() {
        return repository.findAllByOrderByJobNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<JobConfiguration> find(String jobName) {
        return repository.findByJobName(jobName);
    }

    /**
     * @throws JobNotFoundException if no configuration exists for the job
     */
    @Transactional(readOnly = true)
    public JobConfiguration require(String jobName) {
        return find(jobName).orElseThrow(() -> new JobNotFoundException(jobName));
    }

    /**
     * Apply the non-null fields of {@code update} to a job's configuration.
     * The merged configuration must still describe a valid schedule.
     *
     * @throws JobNotFoundException                                 if the job is unknown
     * @throws com.marketdata.jobs.exception.InvalidScheduleException if the result is not schedulable
     */
    @Transactional
    public JobConfiguration update(String jobName, JobConfigUpdateRequest update) {
        JobConfiguration config = require(jobName);

        if (update.getDescription() != null) {
            config.setDescription(update.getDescription());
        }
        if (update.getEnabled() != null) {
            config.setEnabled(update.getEnabled());
        }
        if (update.getScheduleType() != null) {
            config.setScheduleType(update.getScheduleType());
        }
        if (update.getIntervalValue() != null) {
            config.setIntervalValue(update.getIntervalValue());
        }
        if (update.getIntervalUnit() != null) {
            config.setIntervalUnit(update.getIntervalUnit());
        }
        if (update.getCronDayOfWeek() != null) {
            config.setCronDayOfWeek(update.getCronDayOfWeek());
        }
        if (update.getCronHour() != null) {
            config.setCronHour(update.getCronHour());
        }
        if (update.getCronMinute() != null) {
            config.setCronMinute(update.getCronMinute());
        }
        if (update.getOnlyMarketHours() != null) {
            config.setOnlyMarketHours(update.getOnlyMarketHours());
        }
        if (update.getMarketStartHour() != null) {
            config.setMarketStartHour(update.getMarketStartHour());
        }
        if (update.getMarketEndHour() != null) {
            config.setMarketEndHour(update.getMarketEndHour());
        }

        ScheduleSpec spec = ScheduleSpec.from(config);
        JobConfiguration saved = repository.save(config);
        log.info("Updated configuration of {}: {} (enabled={}), applies on next reload",
                jobName, spec.describe(), saved.getEnabled());
        return saved;
    }

    /**
     * Insert the configurations whose job name is not stored yet.
     * Existing rows are left as they are.
     *
     * @return number of rows inserted
     */
    @Transactional
    public int seedMissing(List<JobConfiguration> defaults) {
        int inserted = 0;
        for (JobConfiguration config : defaults) {
            if (repository.existsByJobName(config.getJobName())) {
                continue;
            }
            repository.save(config);
            inserted++;
            log.info("Seeded configuration for {}", config.getJobName());
        }
        return inserted;
    }
}
