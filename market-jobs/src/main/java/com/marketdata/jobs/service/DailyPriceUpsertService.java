package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.DailyBar;
import com.marketdata.jobs.domain.DailyPrice;
import com.marketdata.jobs.repository.DailyPriceRepository;
import com.marketdata.jobs.service.scan.UpsertResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Idempotent insert-or-update of daily prices keyed by symbol and trade date.
 * Rows whose values and source are unchanged are skipped, so storing the same
 * bars twice only inserts the first time.
 */
@Service
@Slf4j
public class DailyPriceUpsertService {

    private final DailyPriceRepository dailyPriceRepository;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public DailyPriceUpsertService(DailyPriceRepository dailyPriceRepository, Clock clock,
            PlatformTransactionManager transactionManager) {
        this.dailyPriceRepository = dailyPriceRepository;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Store bars for one symbol in a transaction of its own. When another
     * writer inserts the same symbol and date first, the rows are read again
     * and the bars applied as updates.
     */
    public UpsertResult upsertBars(String symbol, List<DailyBar> bars, String source) {
        if (bars == null || bars.isEmpty()) {
            return UpsertResult.EMPTY;
        }
        try {
            return transactionTemplate.execute(status -> upsertOnce(symbol, bars, source));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent insert of {} prices, applying bars again: {}", symbol,
                    e.getMostSpecificCause().getMessage());
            return transactionTemplate.execute(status -> upsertOnce(symbol, bars, source));
        }
    }

    private UpsertResult upsertOnce(String symbol, List<DailyBar> bars, String source) {
        int skipped = 0;
        // Last bar wins when the provider repeats a date
        Map<LocalDate, DailyBar> byDate = new LinkedHashMap<>();
        for (DailyBar bar : bars) {
            if (!isComplete(bar)) {
                log.debug("Skipping incomplete bar for {}: {}", symbol, bar);
                skipped++;
                continue;
            }
            byDate.put(bar.getDate(), bar);
        }
        if (byDate.isEmpty()) {
            return new UpsertResult(0, 0, skipped);
        }

        Map<LocalDate, DailyPrice> existing = dailyPriceRepository
                .findBySymbolAndTradeDateIn(symbol, byDate.keySet()).stream()
                .collect(Collectors.toMap(DailyPrice::getTradeDate, Function.identity()));

        LocalDateTime now = LocalDateTime.now(clock);
        List<DailyPrice> toSave = new ArrayList<>();
        int inserted = 0;
        int updated = 0;

        for (DailyBar bar : byDate.values()) {
            DailyPrice current = existing.get(bar.getDate());
            if (current == null) {
                DailyPrice created = DailyPrice.fromBar(symbol, bar, source);
                created.setUpdatedAt(now);
                toSave.add(created);
                inserted++;
            } else if (current.differsFrom(bar) || !Objects.equals(current.getSource(), source)) {
                current.applyBar(bar, source);
                current.setUpdatedAt(now);
                toSave.add(current);
                updated++;
            } else {
                skipped++;
            }
        }

        dailyPriceRepository.saveAllAndFlush(toSave);
        log.debug("Upserted {}: inserted={}, updated={}, skipped={}", symbol, inserted, updated, skipped);
        return new UpsertResult(inserted, updated, skipped);
    }

    private static boolean isComplete(DailyBar bar) {
        return bar != null && bar.getDate() != null && bar.getOpen() != null && bar.getHigh() != null
                && bar.getLow() != null && bar.getClose() != null && bar.getVolume() != null;
    }
}
