package com.marketdata.jobs.client;

public interface UniverseClient {

    /**
     * Download and store the current symbol universe.
     *
     * @return number of symbols stored
     */
    long refreshUniverse();
}
