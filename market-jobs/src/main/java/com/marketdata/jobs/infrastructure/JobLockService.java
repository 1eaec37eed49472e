package com.marketdata.jobs.infrastructure;

/**
 * Per-job-name mutual exclusion shared by scheduled, manual and chained runs.
 */
public interface JobLockService {

    /**
     * Try to take the lock for a job without waiting.
     *
     * @param jobName the job name
     * @return true if the lock was taken, false if another run holds it
     */
    boolean tryAcquire(String jobName);

    /**
     * Release a lock previously taken with {@link #tryAcquire(String)}.
     *
     * @param jobName the job name
     */
    void release(String jobName);

    /**
     * Check whether a run of the job currently holds the lock.
     *
     * @param jobName the job name
     * @return true if locked
     */
    boolean isLocked(String jobName);
}
