package com.marketdata.jobs.jobs;

/**
 * A named unit of background work.
 * Implementations signal failure by throwing; returning normally means the run completed.
 */
public interface ScheduledJob {

    /**
     * Unique job name, matching {@code job_configurations.job_name}.
     */
    String name();

    /**
     * Execute the job body.
     *
     * @param context run inputs
     * @return number of records processed and an optional summary
     */
    JobResult run(JobContext context);

    /**
     * Whether manual runs may pass an explicit date range.
     */
    default boolean supportsDateRange() {
        return false;
    }
}
