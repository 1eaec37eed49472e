package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Persisted daily OHLCV price, one row per symbol and trade date.
 */
@Entity
@Table(name = "prices_daily_ohlc", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prices_symbol_trade_date", columnNames = { "symbol", "trade_date" })
}, indexes = {
        @Index(name = "idx_prices_symbol", columnList = "symbol")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyPrice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, length = 20)
    private String symbol;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "open", nullable = false, precision = 12, scale = 4)
    private BigDecimal open;

    @Column(name = "high", nullable = false, precision = 12, scale = 4)
    private BigDecimal high;

    @Column(name = "low", nullable = false, precision = 12, scale = 4)
    private BigDecimal low;

    @Column(name = "close", nullable = false, precision = 12, scale = 4)
    private BigDecimal close;

    @Column(name = "volume", nullable = false)
    private Long volume;

    @Column(name = "source", length = 50)
    private String source;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * Create a new entity from a provider bar.
     */
    public static DailyPrice fromBar(String symbol, DailyBar bar, String source) {
        return DailyPrice.builder()
                .symbol(symbol)
                .tradeDate(bar.getDate())
                .open(bar.getOpen())
                .high(bar.getHigh())
                .low(bar.getLow())
                .close(bar.getClose())
                .volume(bar.getVolume())
                .source(source)
                .build();
    }

    /**
     * Whether the stored values differ from the given bar.
     * Prices are compared by value, ignoring scale.
     */
    public boolean differsFrom(DailyBar bar) {
        return !sameValue(open, bar.getOpen())
                || !sameValue(high, bar.getHigh())
                || !sameValue(low, bar.getLow())
                || !sameValue(close, bar.getClose())
                || !Objects.equals(volume, bar.getVolume());
    }

    /**
     * Copy the bar's values onto this entity.
     */
    public void applyBar(DailyBar bar, String source) {
        this.open = bar.getOpen();
        this.high = bar.getHigh();
        this.low = bar.getLow();
        this.close = bar.getClose();
        this.volume = bar.getVolume();
        this.source = source;
    }

    private static boolean sameValue(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }
}
