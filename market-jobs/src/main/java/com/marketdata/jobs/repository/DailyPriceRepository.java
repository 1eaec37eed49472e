package com.marketdata.jobs.repository;

import com.marketdata.jobs.domain.DailyPrice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for DailyPrice entity.
 */
@Repository
public interface DailyPriceRepository extends JpaRepository<DailyPrice, Long> {

    /**
     * Find the stored prices of a symbol for a set of trade dates.
     *
     * @param symbol     the symbol
     * @param tradeDates trade dates to look up
     * @return list of existing rows
     */
    List<DailyPrice> findBySymbolAndTradeDateIn(String symbol, Collection<LocalDate> tradeDates);

    long countBySymbol(String symbol);
}
