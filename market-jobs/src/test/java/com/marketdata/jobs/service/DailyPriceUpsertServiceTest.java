package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.DailyBar;
import com.marketdata.jobs.domain.DailyPrice;
import com.marketdata.jobs.repository.DailyPriceRepository;
import com.marketdata.jobs.service.scan.UpsertResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DailyPriceUpsertService insert, update and skip decisions.
 */
@ExtendWith(MockitoExtension.class)
class DailyPriceUpsertServiceTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 15);

    @Mock
    private DailyPriceRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private DailyPriceUpsertService service;

    @BeforeEach
    void setUp() {
        service = new DailyPriceUpsertService(repository,
                Clock.fixed(Instant.parse("2024-03-15T22:00:00Z"), ZoneId.of("UTC")), transactionManager);
    }

    @Test
    void testUpsertBars_NewBars_Inserted() {
        // Arrange
        when(repository.findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection())).thenReturn(Collections.emptyList());

        // Act
        UpsertResult result = service.upsertBars("AAPL",
                List.of(bar(DAY.minusDays(1), "171.00"), bar(DAY, "172.00")), "schwab");

        // Assert
        assertEquals(2, result.getInserted());
        assertEquals(0, result.getUpdated());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<DailyPrice>> saved = ArgumentCaptor.forClass(List.class);
        verify(repository).saveAllAndFlush(saved.capture());
        assertEquals(2, saved.getValue().size());
        assertEquals("schwab", saved.getValue().get(0).getSource());
        assertNotNull(saved.getValue().get(0).getUpdatedAt());
    }

    @Test
    void testUpsertBars_UnchangedRow_Skipped() {
        // Arrange
        DailyPrice existing = DailyPrice.fromBar("AAPL", bar(DAY, "172.00"), "schwab");
        existing.setClose(new BigDecimal("172.0000"));
        when(repository.findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection())).thenReturn(List.of(existing));

        // Act
        UpsertResult result = service.upsertBars("AAPL", List.of(bar(DAY, "172.00")), "schwab");

        // Assert
        assertEquals(0, result.getInserted());
        assertEquals(0, result.getUpdated());
        assertEquals(1, result.getSkipped());
    }

    @Test
    void testUpsertBars_ChangedClose_Updated() {
        // Arrange
        DailyPrice existing = DailyPrice.fromBar("AAPL", bar(DAY, "172.00"), "schwab");
        when(repository.findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection())).thenReturn(List.of(existing));

        // Act
        UpsertResult result = service.upsertBars("AAPL", List.of(bar(DAY, "173.25")), "schwab");

        // Assert
        assertEquals(1, result.getUpdated());
        assertEquals(0, new BigDecimal("173.25").compareTo(existing.getClose()));
    }

    @Test
    void testUpsertBars_ChangedSource_Updated() {
        // Arrange
        DailyPrice existing = DailyPrice.fromBar("AAPL", bar(DAY, "172.00"), "legacy");
        when(repository.findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection())).thenReturn(List.of(existing));

        // Act
        UpsertResult result = service.upsertBars("AAPL", List.of(bar(DAY, "172.00")), "schwab");

        // Assert
        assertEquals(1, result.getUpdated());
        assertEquals("schwab", existing.getSource());
    }

    @Test
    void testUpsertBars_IncompleteBar_Skipped() {
        // Arrange
        DailyBar incomplete = bar(DAY, "172.00");
        incomplete.setVolume(null);
        List<DailyBar> bars = new ArrayList<>(Arrays.asList(incomplete, null));

        // Act
        UpsertResult result = service.upsertBars("AAPL", bars, "schwab");

        // Assert
        assertEquals(2, result.getSkipped());
        verify(repository, never()).saveAllAndFlush(any());
    }

    @Test
    void testUpsertBars_Empty_ReturnsEmpty() {
        assertSame(UpsertResult.EMPTY, service.upsertBars("AAPL", Collections.emptyList(), "schwab"));
        verifyNoInteractions(repository);
    }

    @Test
    void testUpsertBars_ConcurrentInsert_ReadsAgainAndSkips() {
        // Arrange
        DailyPrice storedByOtherWriter = DailyPrice.fromBar("AAPL", bar(DAY, "172.00"), "schwab");
        when(repository.findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection()))
                .thenReturn(Collections.emptyList())
                .thenReturn(List.of(storedByOtherWriter));
        when(repository.saveAllAndFlush(anyList()))
                .thenThrow(new DataIntegrityViolationException("uk_prices_symbol_trade_date"))
                .thenReturn(Collections.emptyList());

        // Act
        UpsertResult result = service.upsertBars("AAPL", List.of(bar(DAY, "172.00")), "schwab");

        // Assert
        assertEquals(0, result.getInserted());
        assertEquals(0, result.getUpdated());
        assertEquals(1, result.getSkipped());
        verify(repository, times(2)).findBySymbolAndTradeDateIn(eq("AAPL"), anyCollection());
        verify(transactionManager).rollback(any());
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
