package com.marketdata.jobs.client;

import com.marketdata.jobs.domain.DailyBar;

import java.time.LocalDate;
import java.util.List;

/**
 * Upstream source of daily price bars.
 */
public interface MarketDataProvider {

    /**
     * Obtain (or refresh) the access token before a scan fans out.
     *
     * @throws com.marketdata.jobs.exception.UpstreamAuthException if no valid token can be obtained
     */
    void preWarmToken();

    /**
     * Fetch daily bars for a symbol over an inclusive date range.
     *
     * @return bars, possibly empty, never null
     * @throws com.marketdata.jobs.exception.ProviderException on upstream failure
     */
    List<DailyBar> fetchDailyBars(String symbol, LocalDate start, LocalDate end);
}
