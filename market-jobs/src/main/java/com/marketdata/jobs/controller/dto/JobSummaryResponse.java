package com.marketdata.jobs.controller.dto;

import com.marketdata.jobs.domain.IntervalUnit;
import com.marketdata.jobs.domain.ScheduleType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.ZonedDateTime;

/**
 * Response DTO describing a job: its configuration, whether it is running,
 * and its latest run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobSummaryResponse {

    private String jobName;
    private String description;
    private Boolean enabled;
    private Boolean configured;
    private Boolean registered;
    private Boolean running;
    private String schedule;
    private ScheduleType scheduleType;
    private Integer intervalValue;
    private IntervalUnit intervalUnit;
    private String cronDayOfWeek;
    private Integer cronHour;
    private Integer cronMinute;
    private Boolean onlyMarketHours;
    private Integer marketStartHour;
    private Integer marketEndHour;
    private ZonedDateTime nextFireTime;
    private ExecutionResponse lastRun;
}
