package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.LocalDateTime;

/**
 * Entity holding the schedule definition of a named job.
 * Rows are seeded at first boot and only ever updated afterwards.
 */
@Entity
@Table(name = "job_configurations", uniqueConstraints = {
                @UniqueConstraint(name = "uk_job_configurations_job_name", columnNames = "job_name")
})
@EntityListeners(AuditingEntityListener.class)
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobConfiguration {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Column(name = "job_name", nullable = false, unique = true, length = 100)
        private String jobName;

        @Column(name = "description", length = 500)
        private String description;

        @Column(name = "enabled", nullable = false)
        @Builder.Default
        private Boolean enabled = true;

        @Enumerated(EnumType.STRING)
        @Column(name = "schedule_type", nullable = false, length = 20)
        private ScheduleType scheduleType;

        @Column(name = "interval_value")
        private Integer intervalValue;

        @Enumerated(EnumType.STRING)
        @Column(name = "interval_unit", length = 20)
        private IntervalUnit intervalUnit;

        @Column(name = "cron_day_of_week", length = 50)
        private String cronDayOfWeek;

        @Column(name = "cron_hour")
        private Integer cronHour;

        @Column(name = "cron_minute")
        private Integer cronMinute;

        @Column(name = "only_market_hours", nullable = false)
        @Builder.Default
        private Boolean onlyMarketHours = false;

        @Column(name = "market_start_hour")
        private Integer marketStartHour;

        @Column(name = "market_end_hour")
        private Integer marketEndHour;

        @CreatedDate
        @Column(name = "created_at", nullable = false, updatable = false)
        private LocalDateTime createdAt;

        @LastModifiedDate
        @Column(name = "updated_at", nullable = false)
        private LocalDateTime updatedAt;
}
