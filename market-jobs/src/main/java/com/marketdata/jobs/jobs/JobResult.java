package com.marketdata.jobs.jobs;

import lombok.Value;

/**
 * What a job body reports back on success.
 */
@Value
public class JobResult {

    long recordsProcessed;
    String summary;

    public static JobResult of(long recordsProcessed) {
        return new JobResult(recordsProcessed, null);
    }

    public static JobResult of(long recordsProcessed, String summary) {
        return new JobResult(recordsProcessed, summary);
    }
}
