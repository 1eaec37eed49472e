package com.marketdata.jobs.jobs;

import com.marketdata.jobs.client.QuoteRefreshClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MarketDataRefreshJob implements ScheduledJob {

    private final QuoteRefreshClient quoteRefreshClient;

    @Override
    public String name() {
        return "market_data_refresh";
    }

    @Override
    public JobResult run(JobContext context) {
        return JobResult.of(quoteRefreshClient.refreshQuotes());
    }
}
