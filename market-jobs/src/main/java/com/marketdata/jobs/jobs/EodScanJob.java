package com.marketdata.jobs.jobs;

import com.marketdata.jobs.domain.ScanStatus;
import com.marketdata.jobs.service.scan.EodScanEngine;
import com.marketdata.jobs.service.scan.ScanSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * End-of-day price scan over the whole symbol universe.
 * A scan that does not end COMPLETED fails the run, so nothing is chained after it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EodScanJob implements ScheduledJob {

    public static final String NAME = "eod_scan";

    private final EodScanEngine scanEngine;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public JobResult run(JobContext context) {
        ScanSummary summary = scanEngine.runScan(context.getDateRange());
        if (summary.getStatus() != ScanStatus.COMPLETED) {
            throw new IllegalStateException("EOD scan " + summary.getScanId() + " ended " + summary.getStatus()
                    + " with " + summary.getErrorCount() + " errors");
        }
        return JobResult.of(summary.getSymbolsFetched(), summary.describe());
    }

    @Override
    public boolean supportsDateRange() {
        return true;
    }
}
