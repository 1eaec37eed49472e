package com.marketdata.jobs.controller;

import com.marketdata.jobs.domain.MarketStatus;
import com.marketdata.jobs.service.JobControlService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for MarketController REST endpoints.
 */
@WebMvcTest(MarketController.class)
class MarketControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private JobControlService jobControlService;

    @Test
    void testGetMarketStatus_ClosedOnHoliday() throws Exception {
        // Arrange
        ZoneId chicago = ZoneId.of("America/Chicago");
        when(jobControlService.getMarketStatus()).thenReturn(MarketStatus.builder()
                .open(false)
                .reason(MarketStatus.ClosedReason.HOLIDAY)
                .currentTime(ZonedDateTime.of(2024, 7, 4, 10, 0, 0, 0, chicago))
                .nextOpen(ZonedDateTime.of(2024, 7, 5, 8, 30, 0, 0, chicago))
                .build());

        // Act & Assert
        mockMvc.perform(get("/market/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.open").value(false))
                .andExpect(jsonPath("$.reason").value("HOLIDAY"))
                .andExpect(jsonPath("$.nextOpen").exists());
    }
}
