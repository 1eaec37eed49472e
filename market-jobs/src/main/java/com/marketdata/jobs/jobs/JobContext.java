package com.marketdata.jobs.jobs;

import com.marketdata.jobs.domain.DateRange;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Inputs handed to a job body for one run.
 */
@Value
@Builder(toBuilder = true)
public class JobContext {

    String jobName;
    TriggerSource trigger;
    DateRange dateRange;
    LocalDateTime nextRunAt;
    Long runId;

    public Optional<DateRange> dateRange() {
        return Optional.ofNullable(dateRange);
    }

    public static JobContext of(String jobName, TriggerSource trigger) {
        return JobContext.builder().jobName(jobName).trigger(trigger).build();
    }
}
