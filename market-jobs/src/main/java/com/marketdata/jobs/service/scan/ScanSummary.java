package com.marketdata.jobs.service.scan;

import com.marketdata.jobs.domain.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Final state of one scan run as reported to the owning job.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanSummary {

    private Long scanId;
    private ScanStatus status;
    private String scanDate;
    private int symbolsRequested;
    private int symbolsFetched;
    private int errorCount;
    private int inserted;
    private int updated;
    private int skipped;
    private int noData;
    private int retried;
    private int recovered;

    public String describe() {
        return String.format("scan %d [%s] %s: requested=%d fetched=%d errors=%d inserted=%d updated=%d "
                + "skipped=%d noData=%d retried=%d recovered=%d",
                scanId, scanDate, status, symbolsRequested, symbolsFetched, errorCount, inserted, updated,
                skipped, noData, retried, recovered);
    }
}
