package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity representing one run attempt of a named job.
 * Created as RUNNING and moved to a terminal status exactly once.
 */
@Entity
@Table(name = "job_execution_status", indexes = {
                @Index(name = "idx_execution_job_name_started", columnList = "job_name, started_at"),
                @Index(name = "idx_execution_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JobExecutionStatus {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Version
        @Column(name = "version")
        private Long version;

        @Column(name = "job_name", nullable = false, length = 100)
        private String jobName;

        @Enumerated(EnumType.STRING)
        @Column(name = "status", nullable = false, length = 20)
        private ExecutionStatus status;

        @Column(name = "started_at", nullable = false)
        private LocalDateTime startedAt;

        @Column(name = "completed_at")
        private LocalDateTime completedAt;

        @Column(name = "duration_seconds")
        private Double durationSeconds;

        @Column(name = "records_processed")
        private Long recordsProcessed;

        @Column(name = "error_message", columnDefinition = "TEXT")
        private String errorMessage;

        @Column(name = "next_run_at")
        private LocalDateTime nextRunAt;
}
