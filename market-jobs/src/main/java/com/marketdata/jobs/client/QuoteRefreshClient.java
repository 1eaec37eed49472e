package com.marketdata.jobs.client;

public interface QuoteRefreshClient {

    /**
     * Refresh cached intraday quotes.
     *
     * @return number of quotes refreshed
     */
    long refreshQuotes();
}
