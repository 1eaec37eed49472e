package com.marketdata.jobs.client;

/**
 * Remote analytics service computing indicators, movers and weekly bars.
 */
public interface AnalyticsClient {

    /**
     * Run one named computation and wait for it to finish.
     *
     * @param computation computation name, e.g. {@code technical_compute}
     * @return number of records the computation wrote
     */
    long compute(String computation);
}
