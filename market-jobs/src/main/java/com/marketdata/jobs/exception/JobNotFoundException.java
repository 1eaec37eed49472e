package com.marketdata.jobs.exception;

/**
 * Thrown when an operation names a job that is neither configured nor registered.
 */
public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobName) {
        super("Unknown job: " + jobName);
    }
}
