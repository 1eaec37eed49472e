package com.marketdata.jobs.service.scan;

import com.marketdata.jobs.client.MarketDataProvider;
import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.DailyBar;
import com.marketdata.jobs.domain.DateRange;
import com.marketdata.jobs.domain.ScanError;
import com.marketdata.jobs.domain.ScanErrorType;
import com.marketdata.jobs.domain.ScanRun;
import com.marketdata.jobs.domain.ScanStatus;
import com.marketdata.jobs.exception.ProviderException;
import com.marketdata.jobs.infrastructure.SlidingWindowRateLimiter;
import com.marketdata.jobs.service.DailyPriceUpsertService;
import com.marketdata.jobs.service.JobMetricsService;
import com.marketdata.jobs.service.MarketHoursGate;
import com.marketdata.jobs.service.SymbolUniverseService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * End-of-day scan: fetches daily bars for the whole symbol universe and stores them.
 * <p>
 * A run creates its scan row, resolves the universe and pre-warms the upstream
 * token before any fan-out; a token failure aborts the run with a single AUTH row.
 * Symbols are then processed in sequential batches on a bounded pool sharing one
 * rate limiter. Afterwards, provider errors in the transient class are retried on a
 * smaller pool behind a stricter limiter. Residual errors do not fail the run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EodScanEngine {

    static final String AUTH_SYMBOL = "AUTH";

    private final MarketDataProvider marketDataProvider;
    private final DailyPriceUpsertService upsertService;
    private final SymbolUniverseService symbolUniverseService;
    private final ScanRunRecorder recorder;
    private final MarketHoursGate marketHoursGate;
    private final JobMetricsService metricsService;
    private final JobsProperties properties;
    private final Clock clock;

    /**
     * Run a full scan.
     *
     * @param explicitRange range to scan, or null to scan the current trading date
     * @return final counters of the scan
     */
    public ScanSummary runScan(DateRange explicitRange) {
        DateRange range = explicitRange != null
                ? explicitRange
                : DateRange.ofDay(marketHoursGate.resolveTradingDate(clock.instant()));

        ScanRun scan = recorder.create(range.label());
        Long scanId = scan.getId();
        MDC.put("scanId", String.valueOf(scanId));
        ScanTotals totals = new ScanTotals();

        try {
            List<String> symbols = symbolUniverseService.resolveSymbols();
            recorder.setRequested(scanId, symbols.size());
            log.info("Scanning {} symbols for {}", symbols.size(), range.label());

            if (symbols.isEmpty()) {
                recorder.finish(scanId, ScanStatus.COMPLETED);
                metricsService.recordScanCompleted();
                return summarize(scanId, totals);
            }

            if (!preWarm(scanId)) {
                recorder.finish(scanId, ScanStatus.FAILED);
                metricsService.recordScanFailed();
                return summarize(scanId, totals);
            }

            runBulkPass(scanId, range, symbols, totals);

            RetrySummary retry = runRetryPass(scanId, range);
            totals.retried = retry.getRetried();
            totals.recovered = retry.getRecovered();
            totals.add(new UpsertResult(retry.getInserted(), retry.getUpdated(), retry.getSkipped()));

            recorder.finish(scanId, ScanStatus.COMPLETED);
            metricsService.recordScanCompleted();
            return summarize(scanId, totals);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recorder.finish(scanId, ScanStatus.FAILED);
            metricsService.recordScanFailed();
            throw new IllegalStateException("Scan " + scanId + " interrupted", e);
        } catch (RuntimeException e) {
            log.error("Scan {} failed: {}", scanId, e.getMessage(), e);
            recorder.finish(scanId, ScanStatus.FAILED);
            metricsService.recordScanFailed();
            throw e;
        } finally {
            pruneOldScans();
            MDC.remove("scanId");
        }
    }

    /**
     * Retry the transient provider errors of an existing scan over its original date range.
     *
     * @throws com.marketdata.jobs.exception.ScanNotFoundException if the scan does not exist
     * @throws com.marketdata.jobs.exception.UpstreamAuthException if the token cannot be obtained
     */
    public RetrySummary retryScan(Long scanId) {
        ScanRun scan = recorder.require(scanId);
        DateRange range = DateRange.parse(scan.getScanDate());
        MDC.put("scanId", String.valueOf(scanId));
        try {
            marketDataProvider.preWarmToken();
            return runRetryPass(scanId, range);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry of scan " + scanId + " interrupted", e);
        } finally {
            MDC.remove("scanId");
        }
    }

    private boolean preWarm(Long scanId) {
        try {
            marketDataProvider.preWarmToken();
            return true;
        } catch (RuntimeException e) {
            Integer status = e instanceof ProviderException ? ((ProviderException) e).getStatusCode() : null;
            log.error("Token pre-warm failed, aborting scan {} before fan-out: {}", scanId, e.getMessage());
            recorder.recordError(scanId, AUTH_SYMBOL, ScanErrorType.AUTH,
                    "Token pre-warm failed: " + e.getMessage(), status);
            metricsService.recordScanError();
            return false;
        }
    }

    private void runBulkPass(Long scanId, DateRange range, List<String> symbols, ScanTotals totals)
            throws InterruptedException {
        JobsProperties.Scan config = properties.getScan();
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config.getMaxRps());
        ExecutorService pool = newPool(config.getWorkers(), "EodScan-");
        try {
            SymbolBatchDispatcher dispatcher = new SymbolBatchDispatcher(pool, limiter, config.getTaskTimeout(),
                    symbol -> fetchAndStore(symbol, range));

            int batchSize = Math.max(1, config.getBatchSize());
            for (int from = 0; from < symbols.size(); from += batchSize) {
                List<String> batch = symbols.subList(from, Math.min(from + batchSize, symbols.size()));
                dispatcher.dispatch(batch, outcome -> recordBulkOutcome(scanId, range, outcome, totals));
                log.info("Batch {}-{} of {} done: fetched={}, noData={}, failed={}",
                        from + 1, from + batch.size(), symbols.size(), totals.fetched, totals.noData, totals.failed);
            }
        } finally {
            shutdown(pool);
        }
    }

    private RetrySummary runRetryPass(Long scanId, DateRange range) throws InterruptedException {
        List<ScanError> candidates = recorder.transientErrors(scanId);
        Set<String> symbols = new LinkedHashSet<>();
        for (ScanError error : candidates) {
            symbols.add(error.getSymbol());
        }
        if (symbols.isEmpty()) {
            return RetrySummary.nothingToRetry(scanId);
        }

        JobsProperties.Scan config = properties.getScan();
        log.info("Retrying {} symbols with transient errors ({} workers, {} req/s)",
                symbols.size(), config.getRetryWorkers(), config.getRetryMaxRps());

        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(config.getRetryMaxRps());
        ExecutorService pool = newPool(config.getRetryWorkers(), "EodRetry-");
        ScanTotals retryTotals = new ScanTotals();
        AtomicInteger recovered = new AtomicInteger();
        try {
            SymbolBatchDispatcher dispatcher = new SymbolBatchDispatcher(pool, limiter, config.getTaskTimeout(),
                    symbol -> fetchAndStore(symbol, range));
            dispatcher.dispatch(new ArrayList<>(symbols), outcome -> {
                if (outcome.getKind() == SymbolFetchOutcome.Kind.STORED) {
                    int removed = recorder.clearProviderErrors(scanId, outcome.getSymbol());
                    recorder.recordFetched(scanId);
                    metricsService.recordSymbolFetched();
                    retryTotals.add(outcome.getUpsert());
                    recovered.incrementAndGet();
                    log.info("Retry recovered {} ({} error rows removed)", outcome.getSymbol(), removed);
                } else {
                    // original error rows stay as they are
                    log.debug("Retry of {} did not succeed: {}", outcome.getSymbol(),
                            outcome.getKind() == SymbolFetchOutcome.Kind.NO_DATA ? "no data" : outcome.getErrorMessage());
                }
            });
        } finally {
            shutdown(pool);
        }

        RetrySummary summary = RetrySummary.builder()
                .scanId(scanId)
                .retried(symbols.size())
                .recovered(recovered.get())
                .failed(symbols.size() - recovered.get())
                .inserted(retryTotals.inserted)
                .updated(retryTotals.updated)
                .skipped(retryTotals.skipped)
                .build();
        log.info("Retry pass done: retried={}, recovered={}, failed={}", summary.getRetried(),
                summary.getRecovered(), summary.getFailed());
        return summary;
    }

    /**
     * Worker body: fetch one symbol and store its bars. Never throws.
     */
    SymbolFetchOutcome fetchAndStore(String symbol, DateRange range) {
        try {
            List<DailyBar> bars = marketDataProvider.fetchDailyBars(symbol, range.getStart(), range.getEnd());
            if (bars == null || bars.isEmpty()) {
                return SymbolFetchOutcome.noData(symbol);
            }
            UpsertResult result = upsertService.upsertBars(symbol, bars, properties.getScan().getSource());
            return SymbolFetchOutcome.stored(symbol, result);
        } catch (ProviderException e) {
            return SymbolFetchOutcome.failed(symbol, e.getMessage(), e.getStatusCode());
        } catch (RuntimeException e) {
            return SymbolFetchOutcome.failed(symbol, e.getClass().getSimpleName() + ": " + e.getMessage(), null);
        }
    }

    private void recordBulkOutcome(Long scanId, DateRange range, SymbolFetchOutcome outcome, ScanTotals totals) {
        try {
            switch (outcome.getKind()) {
                case STORED -> {
                    recorder.recordFetched(scanId);
                    metricsService.recordSymbolFetched();
                    totals.fetched++;
                    totals.add(outcome.getUpsert());
                }
                case NO_DATA -> {
                    recorder.recordError(scanId, outcome.getSymbol(), ScanErrorType.NO_DATA,
                            "No candles for " + outcome.getSymbol() + " in range " + range.getStart() + ".."
                                    + range.getEnd(), null);
                    metricsService.recordScanError();
                    totals.noData++;
                }
                case FAILED -> {
                    log.warn("Provider error for {} (status {}): {}", outcome.getSymbol(), outcome.getHttpStatus(),
                            outcome.getErrorMessage());
                    recorder.recordError(scanId, outcome.getSymbol(), ScanErrorType.PROVIDER_ERROR,
                            outcome.getErrorMessage(), outcome.getHttpStatus());
                    metricsService.recordScanError();
                    totals.failed++;
                }
            }
        } catch (DataAccessException e) {
            log.error("Could not record outcome of {} for scan {}: {}", outcome.getSymbol(), scanId,
                    e.getMessage(), e);
        }
    }

    private ScanSummary summarize(Long scanId, ScanTotals totals) {
        ScanRun scan = recorder.require(scanId);
        return ScanSummary.builder()
                .scanId(scanId)
                .status(scan.getStatus())
                .scanDate(scan.getScanDate())
                .symbolsRequested(scan.getSymbolsRequested())
                .symbolsFetched(scan.getSymbolsFetched())
                .errorCount(scan.getErrorCount())
                .inserted(totals.inserted)
                .updated(totals.updated)
                .skipped(totals.skipped)
                .noData(totals.noData)
                .retried(totals.retried)
                .recovered(totals.recovered)
                .build();
    }

    private void pruneOldScans() {
        try {
            recorder.pruneScans(properties.getScan().getKeepRuns());
        } catch (RuntimeException e) {
            log.warn("Failed to prune old scans: {}", e.getMessage());
        }
    }

    private static ExecutorService newPool(int size, String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, size), r -> {
            Thread thread = new Thread(r);
            thread.setName(namePrefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Scan workers did not terminate in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Running totals, only touched from the dispatching thread.
     */
    private static final class ScanTotals {
        private int fetched;
        private int noData;
        private int failed;
        private int inserted;
        private int updated;
        private int skipped;
        private int retried;
        private int recovered;

        private void add(UpsertResult result) {
            inserted += result.getInserted();
            updated += result.getUpdated();
            skipped += result.getSkipped();
        }
    }
}
