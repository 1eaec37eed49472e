package com.marketdata.jobs.controller.dto;

import com.marketdata.jobs.domain.IntervalUnit;
import com.marketdata.jobs.domain.ScheduleType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a job configuration. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobConfigUpdateRequest {

    @Size(max = 500, message = "Description must be at most 500 characters")
    private String description;

    private Boolean enabled;

    private ScheduleType scheduleType;

    @Positive(message = "Interval value must be positive")
    private Integer intervalValue;

    private IntervalUnit intervalUnit;

    @Size(max = 50, message = "Day of week must be at most 50 characters")
    private String cronDayOfWeek;

    @Min(value = 0, message = "Cron hour must be between 0 and 23")
    @Max(value = 23, message = "Cron hour must be between 0 and 23")
    private Integer cronHour;

    @Min(value = 0, message = "Cron minute must be between 0 and 59")
    @Max(value = 59, message = "Cron minute must be between 0 and 59")
    private Integer cronMinute;

    private Boolean onlyMarketHours;

    @Min(value = 0, message = "Market start hour must be between 0 and 23")
    @Max(value = 23, message = "Market start hour must be between 0 and 23")
    private Integer marketStartHour;

    @Min(value = 1, message = "Market end hour must be between 1 and 24")
    @Max(value = 24, message = "Market end hour must be between 1 and 24")
    private Integer marketEndHour;
}
