package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.JobConfiguration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for JobConfiguration entity.
 */
@Repository
public interface JobConfigurationRepository extends JpaRepository<JobConfiguration, Long> {

    /**
     * Find the configuration of a job by its unique name.
     *
     * @param jobName the job name
     * @return Optional containing the configuration if found
     */
    Optional<JobConfiguration> findByJobName(String jobName);

    /**
     * Check whether a configuration exists for the given job name.
     *
     * @param jobName the job name
     * @return true if exists, false otherwise
     */
    boolean existsByJobName(String jobName);

    List<JobConfiguration> findAllByOrderByJobNameAsc();
}
