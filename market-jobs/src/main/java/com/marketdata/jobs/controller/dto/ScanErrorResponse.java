package com.marketdata.jobs.controller.dto;

import com.marketdata.jobs.domain.ScanError;
import com.marketdata.jobs.domain.ScanErrorType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanErrorResponse {

    private Long id;
    private String symbol;
    private ScanErrorType errorType;
    private String errorMessage;
    private Integer httpStatus;
    private LocalDateTime occurredAt;

    public static ScanErrorResponse from(ScanError error) {
        return ScanErrorResponse.builder()
                .id(error.getId())
                .symbol(error.getSymbol())
                .errorType(error.getErrorType())
                .errorMessage(error.getErrorMessage())
                .httpStatus(error.getHttpStatus())
                .occurredAt(error.getOccurredAt())
                .build();
    }
}
