package com.marketdata.jobs.jobs;

import com.marketdata.jobs.client.UniverseClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class UniverseRefreshJob implements ScheduledJob {

    private final UniverseClient universeClient;

    @Override
    public String name() {
        return "universe_refresh";
    }

    @Override
    public JobResult run(JobContext context) {
        return JobResult.of(universeClient.refreshUniverse());
    }
}
