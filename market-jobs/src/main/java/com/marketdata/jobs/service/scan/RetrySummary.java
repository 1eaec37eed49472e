package com.marketdata.jobs.service.scan;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts of a transient-error retry pass over one scan.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RetrySummary {

    private Long scanId;
    private int retried;
    private int recovered;
    private int failed;
    private int inserted;
    private int updated;
    private int skipped;

    public static RetrySummary nothingToRetry(Long scanId) {
        return RetrySummary.builder().scanId(scanId).build();
    }
}
