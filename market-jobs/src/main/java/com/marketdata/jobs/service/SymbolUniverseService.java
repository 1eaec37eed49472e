package com.marketdata.jobs.service;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.ListedSymbol;
import com.marketdata.jobs.repository.ListedSymbolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Resolves the symbols an EOD scan should fetch from the reference table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SymbolUniverseService {

    /** Warrants, rights, units. */
    static final List<String> EXCLUDED_SUFFIXES = List.of(".WS", ".RT", ".UN", ".WT");

    private final ListedSymbolRepository listedSymbolRepository;
    private final JobsProperties properties;

    /**
     * Non-test symbols without an excluded suffix, sorted and de-duplicated,
     * capped at {@code jobs.scan.max-symbols} when that is positive.
     */
    @Transactional(readOnly = true)
    public List<String> resolveSymbols() {
        List<ListedSymbol> rows = listedSymbolRepository.findByTestIssueFalse();
        List<String> symbols = rows.stream()
                .map(ListedSymbol::getSymbol)
                .filter(SymbolUniverseService::isScannable)
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        log.info("Filtered {} symbols down to {} scannable symbols", rows.size(), symbols.size());

        int cap = properties.getScan().getMaxSymbols();
        if (cap > 0 && symbols.size() > cap) {
            log.info("Capping universe at {} symbols", cap);
            return symbols.subList(0, cap);
        }
        return symbols;
    }

    static boolean isScannable(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return false;
        }
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        return EXCLUDED_SUFFIXES.stream().noneMatch(normalized::endsWith);
    }
}
