package com.marketdata.jobs.controller;

import com.marketdata.jobs.controller.dto.ScanErrorResponse;
import com.marketdata.jobs.controller.dto.ScanResponse;
import com.marketdata.jobs.service.JobControlService;
import com.marketdata.jobs.service.scan.RetrySummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for end-of-day scan diagnostics.
 */
@RestController
@RequestMapping("/scans")
@RequiredArgsConstructor
@Slf4j
public class ScanController {

    private final JobControlService jobControlService;

    @GetMapping
    public ResponseEntity<List<ScanResponse>> listScans(@RequestParam(defaultValue = "5") int limit) {
        return ResponseEntity.ok(jobControlService.listScans(limit));
    }

    /**
     * Errors recorded by a scan, newest first.
     *
     * @param scanId the scan id
     * @param limit  maximum number of rows
     * @return the error rows
     */
    @GetMapping("/{scanId}/errors")
    public ResponseEntity<List<ScanErrorResponse>> getScanErrors(
            @PathVariable Long scanId,
            @RequestParam(defaultValue = "100") int limit) {
        return ResponseEntity.ok(jobControlService.getScanErrors(scanId, limit));
    }

    /**
     * Retry the transient provider errors of a scan on the calling thread.
     *
     * @param scanId the scan id
     * @return counts of the retry pass
     */
    @PostMapping("/{scanId}/retry")
    public ResponseEntity<RetrySummary> retryScan(@PathVariable Long scanId) {

        log.info("POST /scans/{}/retry - Retrying transient errors", scanId);

        return ResponseEntity.ok(jobControlService.retryScan(scanId));
    }
}
