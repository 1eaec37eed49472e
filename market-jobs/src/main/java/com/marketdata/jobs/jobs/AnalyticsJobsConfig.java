package com.marketdata.jobs.jobs;

import com.marketdata.jobs.client.AnalyticsClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Jobs that only trigger a computation in the analytics service.
 */
@Configuration
public class AnalyticsJobsConfig {

    @Bean
    public ScheduledJob techAnalysisJob(AnalyticsClient analyticsClient) {
        return new AnalyticsComputeJob("tech_analysis", "technical_compute", analyticsClient);
    }

    @Bean
    public ScheduledJob technicalComputeJob(AnalyticsClient analyticsClient) {
        return new AnalyticsComputeJob("technical_compute", "technical_compute", analyticsClient);
    }

    @Bean
    public ScheduledJob dailyMoversJob(AnalyticsClient analyticsClient) {
        return new AnalyticsComputeJob("daily_movers_calculation", "daily_movers", analyticsClient);
    }

    @Bean
    public ScheduledJob weeklyBarsJob(AnalyticsClient analyticsClient) {
        return new AnalyticsComputeJob("weekly_bars_etl", "weekly_bars", analyticsClient);
    }
}
