package com.marketdata.jobs.service;

import com.marketdata.jobs.domain.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of one tracked run as seen by the caller that started it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RunOutcome {

    private String jobName;
    private Long runId;
    private ExecutionStatus status;
    private long recordsProcessed;
    private String errorMessage;

    public boolean isCompleted() {
        return status == ExecutionStatus.COMPLETED;
    }

    public static RunOutcome skipped(String jobName, Long runId, String reason) {
        return RunOutcome.builder()
                .jobName(jobName)
                .runId(runId)
                .status(ExecutionStatus.SKIPPED)
                .errorMessage(reason)
                .build();
    }
}
