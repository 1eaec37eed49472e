package com.marketdata.jobs.controller.dto;

import com.marketdata.jobs.domain.ExecutionStatus;
import com.marketdata.jobs.domain.JobExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One entry of a job's run history.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionResponse {

    private Long id;
    private String jobName;
    private ExecutionStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Double durationSeconds;
    private Long recordsProcessed;
    private String errorMessage;
    private LocalDateTime nextRunAt;

    public static ExecutionResponse from(JobExecutionStatus run) {
        return ExecutionResponse.builder()
                .id(run.getId())
                .jobName(run.getJobName())
                .status(run.getStatus())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .durationSeconds(run.getDurationSeconds())
                .recordsProcessed(run.getRecordsProcessed())
                .errorMessage(run.getErrorMessage())
                .nextRunAt(run.getNextRunAt())
                .build();
    }
}
