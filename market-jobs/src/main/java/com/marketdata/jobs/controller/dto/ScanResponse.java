package com.marketdata.jobs.controller.dto;

import com.marketdata.jobs.domain.ScanRun;
import com.marketdata.jobs.domain.ScanStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanResponse {

    private Long id;
    private ScanStatus status;
    private String scanDate;
    private Integer symbolsRequested;
    private Integer symbolsFetched;
    private Integer errorCount;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    public static ScanResponse from(ScanRun scan) {
        return ScanResponse.builder()
                .id(scan.getId())
                .status(scan.getStatus())
                .scanDate(scan.getScanDate())
                .symbolsRequested(scan.getSymbolsRequested())
                .symbolsFetched(scan.getSymbolsFetched())
                .errorCount(scan.getErrorCount())
                .startedAt(scan.getStartedAt())
                .completedAt(scan.getCompletedAt())
                .build();
    }
}
