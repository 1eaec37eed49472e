package com.marketdata.jobs.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single daily OHLCV bar as returned by the market data provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyBar {

    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;
}
