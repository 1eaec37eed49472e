package com.marketdata.jobs.exception;

/**
 * Thrown when a manual trigger finds another instance of the same job in progress.
 */
public class JobAlreadyRunningException extends RuntimeException {

    private final String jobName;

    public JobAlreadyRunningException(String jobName) {
        super("Job is already running: " + jobName);
        this.jobName = jobName;
    }

    public String getJobName() {
        return jobName;
    }
}
