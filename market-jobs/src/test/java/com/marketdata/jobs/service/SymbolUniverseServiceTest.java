package com.marketdata.jobs.service;

import com.marketdata.jobs.config.JobsProperties;
import com.marketdata.jobs.domain.ListedSymbol;
import com.marketdata.jobs.repository.ListedSymbolRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SymbolUniverseService filtering.
 */
@ExtendWith(MockitoExtension.class)
class SymbolUniverseServiceTest {

    @Mock
    private ListedSymbolRepository repository;

    private JobsProperties properties;
    private SymbolUniverseService service;

    @BeforeEach
    void setUp() {
        properties = new JobsProperties();
        service = new SymbolUniverseService(repository, properties);
    }

    @Test
    void testResolveSymbols_FiltersSortsAndDeduplicates() {
        // Arrange
        when(repository.findByTestIssueFalse()).thenReturn(List.of(
                symbol("msft"), symbol("AAPL"), symbol(" aapl "), symbol("SPAC.WS"), symbol("ABC.RT"),
                symbol("XYZ.UN"), symbol("DEF.WT"), symbol(""), symbol(null)));

        // Act
        List<String> symbols = service.resolveSymbols();

        // Assert
        assertEquals(List.of("AAPL", "MSFT"), symbols);
    }

    @Test
    void testResolveSymbols_AppliesCap() {
        // Arrange
        properties.getScan().setMaxSymbols(2);
        when(repository.findByTestIssueFalse()).thenReturn(List.of(
                symbol("NVDA"), symbol("AAPL"), symbol("MSFT")));

        // Act
        List<String> symbols = service.resolveSymbols();

        // Assert
        assertEquals(List.of("AAPL", "MSFT"), symbols);
    }

    @Test
    void testIsScannable() {
        assertTrue(SymbolUniverseService.isScannable("BRK.B"));
        assertFalse(SymbolUniverseService.isScannable("abc.ws"));
        assertFalse(SymbolUniverseService.isScannable("  "));
    }

    private static ListedSymbol symbol(String value) {
        return ListedSymbol.builder().symbol(value).testIssue(false).build();
    }
}
