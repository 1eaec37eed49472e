package com.marketdata.jobs.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunJobResponse {

    private String jobName;
    private String dateRange;
    private String message;
}
