package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.ExecutionStatus;
import com.marketdata.jobs.domain.JobExecutionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for JobExecutionStatus entity.
 * Provides run history queries and retention deletes.
 */
@Repository
public interface JobExecutionStatusRepository extends JpaRepository<JobExecutionStatus, Long> {

    /**
     * Find the most recent runs of a job, newest first.
     *
     * @param jobName  the job name
     * @param pageable page limiting the number of rows
     * @return list of runs
     */
    List<JobExecutionStatus> findByJobNameOrderByStartedAtDescIdDesc(String jobName, Pageable pageable);

    /**
     * Find the latest run of a job.
     *
     * @param jobName the job name
     * @return Optional containing the latest run if any
     */
    Optional<JobExecutionStatus> findFirstByJobNameOrderByStartedAtDescIdDesc(String jobName);

    /**
     * Find all runs in a given status.
     *
     * @param status the execution status
     * @return list of runs with the given status
     */
    List<JobExecutionStatus> findByStatus(ExecutionStatus status);

    long countByJobName(String jobName);

    /**
     * Ids of a job's runs ordered newest first, used to select the rows to keep.
     */
    @Query("SELECT e.id FROM JobExecutionStatus e WHERE e.jobName = :jobName ORDER BY e.startedAt DESC, e.id DESC")
    List<Long> findIdsByJobNameNewestFirst(@Param("jobName") String jobName, Pageable pageable);

    /**
     * Delete every run of a job except the given ids.
     *
     * @return number of rows deleted
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM JobExecutionStatus e WHERE e.jobName = :jobName AND e.id NOT IN :keepIds")
    int deleteByJobNameAndIdNotIn(@Param("jobName") String jobName, @Param("keepIds") Collection<Long> keepIds);

    @Query("SELECT DISTINCT e.jobName FROM JobExecutionStatus e")
    List<String> findDistinctJobNames();
}
