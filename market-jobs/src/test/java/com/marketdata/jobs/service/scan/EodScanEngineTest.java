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
import com.marketdata.jobs.exception.UpstreamAuthException;
import com.marketdata.jobs.repository.DailyPriceRepository;
import com.marketdata.jobs.repository.ScanErrorRepository;
import com.marketdata.jobs.repository.ScanRunRepository;
import com.marketdata.jobs.service.DailyPriceUpsertService;
import com.marketdata.jobs.service.JobMetricsService;
import com.marketdata.jobs.service.MarketHoursGate;
import com.marketdata.jobs.service.SymbolUniverseService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for EodScanEngine against the JPA schema, with the upstream provider
 * and the symbol universe mocked. Writes commit, so tables are cleared per test.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({ScanRunRecorder.class, DailyPriceUpsertService.class, EodScanEngineTest.ClockConfig.class})
class EodScanEngineTest {

    private static final LocalDate FRIDAY = LocalDate.of(2024, 3, 15);

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(ZonedDateTime.of(2024, 3, 15, 17, 0, 0, 0, ZoneId.of("America/Chicago")).toInstant(),
                    ZoneId.of("UTC"));
        }
    }

    @Autowired
    private ScanRunRecorder recorder;

    @Autowired
    private DailyPriceUpsertService upsertService;

    @Autowired
    private ScanRunRepository scanRunRepository;

    @Autowired
    private ScanErrorRepository scanErrorRepository;

    @Autowired
    private DailyPriceRepository dailyPriceRepository;

    @Autowired
    private Clock clock;

    private MarketDataProvider provider;
    private SymbolUniverseService universe;
    private JobsProperties properties;
    private EodScanEngine engine;

    @BeforeEach
    void setUp() {
        scanErrorRepository.deleteAll();
        scanRunRepository.deleteAll();
        dailyPriceRepository.deleteAll();

        provider = mock(MarketDataProvider.class);
        universe = mock(SymbolUniverseService.class);
        properties = new JobsProperties();
        properties.setTimezone("America/Chicago");
        JobsProperties.Scan scan = properties.getScan();
        scan.setWorkers(3);
        scan.setMaxRps(100);
        scan.setBatchSize(2);
        scan.setRetryWorkers(2);
        scan.setRetryMaxRps(100);
        scan.setTaskTimeout(Duration.ofSeconds(1));
        scan.setKeepRuns(5);

        engine = new EodScanEngine(provider, upsertService, universe, recorder, new MarketHoursGate(properties),
                new JobMetricsService(new SimpleMeterRegistry()), properties, clock);
    }

    @Test
    void testRunScan_MixedOutcomes_CountersMatchRows() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT", "ZZZZ"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any())).thenReturn(List.of(bar(FRIDAY, "420.55")));
        when(provider.fetchDailyBars(eq("ZZZZ"), any(), any())).thenReturn(Collections.emptyList());

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        ScanRun scan = scanRunRepository.findById(summary.getScanId()).orElseThrow();
        assertEquals(ScanStatus.COMPLETED, scan.getStatus());
        assertEquals("2024-03-15", scan.getScanDate());
        assertEquals(3, scan.getSymbolsRequested());
        assertEquals(2, scan.getSymbolsFetched());
        assertEquals(1, scan.getErrorCount());
        assertNotNull(scan.getCompletedAt());

        List<ScanError> errors = scanErrorRepository.findByScanRunId(scan.getId(), PageRequest.of(0, 10));
        assertEquals(1, errors.size());
        assertEquals("ZZZZ", errors.get(0).getSymbol());
        assertEquals(ScanErrorType.NO_DATA, errors.get(0).getErrorType());
        assertEquals("No candles for ZZZZ in range 2024-03-15..2024-03-15", errors.get(0).getErrorMessage());

        assertEquals(2, dailyPriceRepository.count());
        assertEquals(2, summary.getInserted());
        assertEquals(1, summary.getNoData());
    }

    @Test
    void testRunScan_PrewarmFails_AbortsWithSingleAuthRow() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT", "NVDA"));
        doThrow(new UpstreamAuthException("refresh token expired")).when(provider).preWarmToken();

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        assertEquals(ScanStatus.FAILED, summary.getStatus());
        ScanRun scan = scanRunRepository.findById(summary.getScanId()).orElseThrow();
        assertEquals(3, scan.getSymbolsRequested());
        assertEquals(0, scan.getSymbolsFetched());
        assertEquals(1, scan.getErrorCount());

        List<ScanError> errors = scanErrorRepository.findByScanRunId(scan.getId(), PageRequest.of(0, 10));
        assertEquals(1, errors.size());
        assertEquals("AUTH", errors.get(0).getSymbol());
        assertEquals(ScanErrorType.AUTH, errors.get(0).getErrorType());
        verify(provider, never()).fetchDailyBars(any(), any(), any());
    }

    @Test
    void testRunScan_RateLimitedSymbol_RecoveredByRetryPass() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT", "NVDA"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("NVDA"), any(), any())).thenReturn(List.of(bar(FRIDAY, "880.00")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any()))
                .thenThrow(new ProviderException("Too Many Requests", 429))
                .thenReturn(List.of(bar(FRIDAY, "420.55")));

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        ScanRun scan = scanRunRepository.findById(summary.getScanId()).orElseThrow();
        assertEquals(ScanStatus.COMPLETED, scan.getStatus());
        assertEquals(3, scan.getSymbolsFetched());
        assertEquals(0, scan.getErrorCount());
        assertEquals(0, scanErrorRepository.countByScanRun_IdAndSymbol(scan.getId(), "MSFT"));
        assertEquals(1, summary.getRetried());
        assertEquals(1, summary.getRecovered());
        assertEquals(3, dailyPriceRepository.count());
    }

    @Test
    void testRunScan_NonTransientError_NotRetried() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "GONE"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("GONE"), any(), any()))
                .thenThrow(new ProviderException("Bad Request", 400));

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(1, summary.getErrorCount());
        assertEquals(0, summary.getRetried());
        verify(provider, times(1)).fetchDailyBars(eq("GONE"), any(), any());
        ScanError error = scanErrorRepository.findByScanRunId(summary.getScanId(), PageRequest.of(0, 10)).get(0);
        assertEquals(ScanErrorType.PROVIDER_ERROR, error.getErrorType());
        assertEquals(400, error.getHttpStatus());
    }

    @Test
    void testRunScan_PersistentServerError_RowKeptAfterRetry() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any()))
                .thenThrow(new ProviderException("Service Unavailable", 503));

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(1, summary.getSymbolsFetched());
        assertEquals(1, summary.getErrorCount());
        assertEquals(1, summary.getRetried());
        assertEquals(0, summary.getRecovered());
        assertEquals(1, scanErrorRepository.countByScanRun_IdAndSymbol(summary.getScanId(), "MSFT"));
        verify(provider, times(2)).fetchDailyBars(eq("MSFT"), any(), any());
    }

    @Test
    void testRunScan_HangingFetch_RecordedAsTimeout() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "SLOW"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("SLOW"), any(), any())).thenAnswer(invocation -> {
            try {
                TimeUnit.SECONDS.sleep(30);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Collections.emptyList();
        });

        // Act
        long start = System.nanoTime();
        ScanSummary summary = engine.runScan(null);
        long elapsedSeconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start);

        // Assert
        assertTrue(elapsedSeconds < 15, "Scan should not wait for the hanging fetch, took " + elapsedSeconds + "s");
        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(1, summary.getSymbolsFetched());
        assertEquals(1, summary.getErrorCount());
        ScanError error = scanErrorRepository.findByScanRunId(summary.getScanId(), PageRequest.of(0, 10)).get(0);
        assertEquals("SLOW", error.getSymbol());
        assertEquals(ScanErrorType.PROVIDER_ERROR, error.getErrorType());
        assertNull(error.getHttpStatus());
        assertEquals("Timed out after 1s", error.getErrorMessage());
    }

    @Test
    void testRunScan_EmptyUniverse_CompletesWithoutUpstreamCalls() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(Collections.emptyList());

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        assertEquals(ScanStatus.COMPLETED, summary.getStatus());
        assertEquals(0, summary.getSymbolsRequested());
        verifyNoInteractions(provider);
    }

    @Test
    void testRunScan_ExplicitRange_UsedForFetchAndLabel() {
        // Arrange
        DateRange range = new DateRange(LocalDate.of(2024, 3, 11), FRIDAY);
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL"));
        when(provider.fetchDailyBars("AAPL", range.getStart(), range.getEnd()))
                .thenReturn(List.of(bar(LocalDate.of(2024, 3, 11), "171.00"), bar(FRIDAY, "170.10")));

        // Act
        ScanSummary summary = engine.runScan(range);

        // Assert
        assertEquals("2024-03-11..2024-03-15", summary.getScanDate());
        assertEquals(2, summary.getInserted());
        assertEquals(2, dailyPriceRepository.countBySymbol("AAPL"));
    }

    @Test
    void testRunScan_SameDataTwice_SecondRunInsertsNothing() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any())).thenReturn(List.of(bar(FRIDAY, "420.55")));

        // Act
        ScanSummary first = engine.runScan(null);
        ScanSummary second = engine.runScan(null);

        // Assert
        assertEquals(2, first.getInserted());
        assertEquals(0, second.getInserted());
        assertEquals(0, second.getUpdated());
        assertEquals(2, second.getSkipped());
        assertEquals(2, dailyPriceRepository.count());
    }

    @Test
    void testRunScan_KeepsFiveMostRecentScans() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(Collections.emptyList());

        // Act
        Long lastId = null;
        for (int i = 0; i < 7; i++) {
            lastId = engine.runScan(null).getScanId();
        }

        // Assert
        assertEquals(5, scanRunRepository.count());
        assertTrue(scanRunRepository.findById(lastId).isPresent());
    }

    @Test
    void testRetryScan_RecoversResidualErrors() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any()))
                .thenThrow(new ProviderException("Bad Gateway", 502))
                .thenThrow(new ProviderException("Bad Gateway", 502))
                .thenReturn(List.of(bar(FRIDAY, "420.55")));
        Long scanId = engine.runScan(null).getScanId();

        // Act
        RetrySummary retry = engine.retryScan(scanId);

        // Assert
        assertEquals(1, retry.getRetried());
        assertEquals(1, retry.getRecovered());
        ScanRun scan = scanRunRepository.findById(scanId).orElseThrow();
        assertEquals(0, scan.getErrorCount());
        assertEquals(2, scan.getSymbolsFetched());
        assertEquals(0, scanErrorRepository.countByScanRun_IdAndSymbol(scanId, "MSFT"));
    }

    @Test
    void testRetryScan_NoTransientErrors_NothingToRetry() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("ZZZZ"));
        when(provider.fetchDailyBars(eq("ZZZZ"), any(), any())).thenReturn(Collections.emptyList());
        Long scanId = engine.runScan(null).getScanId();

        // Act
        RetrySummary retry = engine.retryScan(scanId);

        // Assert
        assertEquals(0, retry.getRetried());
        assertEquals(1, scanRunRepository.findById(scanId).orElseThrow().getErrorCount());
    }

    @Test
    void testRunScan_CleanupDuringScan_KeepsFailedStatusAndCounters() {
        // Arrange
        when(universe.resolveSymbols()).thenReturn(List.of("AAPL", "MSFT"));
        when(provider.fetchDailyBars(eq("AAPL"), any(), any())).thenReturn(List.of(bar(FRIDAY, "170.10")));
        when(provider.fetchDailyBars(eq("MSFT"), any(), any())).thenAnswer(invocation -> {
            recorder.failAllRunning();
            return List.of(bar(FRIDAY, "420.55"));
        });

        // Act
        ScanSummary summary = engine.runScan(null);

        // Assert
        ScanRun scan = scanRunRepository.findById(summary.getScanId()).orElseThrow();
        assertEquals(ScanStatus.FAILED, scan.getStatus());
        assertEquals(ScanStatus.FAILED, summary.getStatus());
        assertEquals(2, scan.getSymbolsRequested());
        assertEquals(2, scan.getSymbolsFetched());
        assertEquals(0, scan.getErrorCount());
        assertEquals(2, dailyPriceRepository.count());
    }

    @Test
    void testFinish_ScanAlreadyClosed_StatusUnchanged() {
        // Arrange
        ScanRun scan = recorder.create("2024-03-15");
        recorder.recordFetched(scan.getId());
        assertEquals(1, recorder.failAllRunning());

        // Act
        boolean closed = recorder.finish(scan.getId(), ScanStatus.COMPLETED);

        // Assert
        assertFalse(closed);
        ScanRun stored = scanRunRepository.findById(scan.getId()).orElseThrow();
        assertEquals(ScanStatus.FAILED, stored.getStatus());
        assertEquals(1, stored.getSymbolsFetched());
        assertEquals(0, recorder.failAllRunning());
    }

    private static DailyBar bar(LocalDate date, String close) {
        BigDecimal price = new BigDecimal(close);
        return DailyBar.builder()
                .date(date)
                .open(price)
                .high(price.add(BigDecimal.ONE))
                .low(price.subtract(BigDecimal.ONE))
                .close(price)
                .volume(1_000_000L)
                .build();
    }
}
