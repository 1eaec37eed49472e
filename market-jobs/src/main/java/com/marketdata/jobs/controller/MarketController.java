package com.marketdata.jobs.controller;

import com.marketdata.jobs.domain.MarketStatus;
import com.marketdata.jobs.service.JobControlService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller exposing the exchange session used to gate market-hours jobs.
 */
@RestController
@RequestMapping("/market")
@RequiredArgsConstructor
public class MarketController {

    private final JobControlService jobControlService;

    @GetMapping("/status")
    public ResponseEntity<MarketStatus> getMarketStatus() {
        return ResponseEntity.ok(jobControlService.getMarketStatus());
    }
}
