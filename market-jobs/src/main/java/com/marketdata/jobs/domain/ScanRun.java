package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Entity representing one invocation of the end-of-day scan.
 * Counters are updated in place by the scan engine through
 * single-row update statements, never through a loaded copy.
 */
@Entity
@Table(name = "scan_runs", indexes = {
                @Index(name = "idx_scan_runs_started_at", columnList = "started_at"),
                @Index(name = "idx_scan_runs_status", columnList = "status")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanRun {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @Enumerated(EnumType.STRING)
        @Column(name = "status", nullable = false, length = 20)
        private ScanStatus status;

        @Column(name = "scan_date", nullable = false, length = 30)
        private String scanDate;

        @Column(name = "symbols_requested", nullable = false)
        @Builder.Default
        private Integer symbolsRequested = 0;

        @Column(name = "symbols_fetched", nullable = false)
        @Builder.Default
        private Integer symbolsFetched = 0;

        @Column(name = "error_count", nullable = false)
        @Builder.Default
        private Integer errorCount = 0;

        @Column(name = "started_at", nullable = false)
        private LocalDateTime startedAt;

        @Column(name = "completed_at")
        private LocalDateTime completedAt;
}
