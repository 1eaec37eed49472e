package com.marketdata.jobs.jobs;

import com.marketdata.jobs.client.AnalyticsClient;
import lombok.extern.slf4j.Slf4j;

/**
 * Delegates to one named computation of the analytics service.
 * Instances are declared in {@link AnalyticsJobsConfig}.
 */
@Slf4j
public class AnalyticsComputeJob implements ScheduledJob {

    private final String name;
    private final String computation;
    private final AnalyticsClient analyticsClient;

    public AnalyticsComputeJob(String name, String computation, AnalyticsClient analyticsClient) {
        this.name = name;
        this.computation = computation;
        this.analyticsClient = analyticsClient;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public JobResult run(JobContext context) {
        log.info("Requesting {} from analytics service", computation);
        long records = analyticsClient.compute(computation);
        return JobResult.of(records, computation + " wrote " + records + " records");
    }
}
