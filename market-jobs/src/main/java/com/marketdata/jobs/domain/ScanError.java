package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Per-symbol diagnostic row written during a scan.
 */
@Entity
@Table(name = "scan_errors", indexes = {
                @Index(name = "idx_scan_errors_run_symbol", columnList = "scan_run_id, symbol"),
                @Index(name = "idx_scan_errors_type", columnList = "error_type")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScanError {

        @Id
        @GeneratedValue(strategy = GenerationType.IDENTITY)
        private Long id;

        @ManyToOne(fetch = FetchType.LAZY, optional = false)
        @JoinColumn(name = "scan_run_id", nullable = false, foreignKey = @ForeignKey(name = "fk_scan_errors_scan_run"))
        @ToString.Exclude
        @EqualsAndHashCode.Exclude
        private ScanRun scanRun;

        @Column(name = "symbol", nullable = false, length = 20)
        private String symbol;

        @Enumerated(EnumType.STRING)
        @Column(name = "error_type", nullable = false, length = 20)
        private ScanErrorType errorType;

        @Column(name = "error_message", columnDefinition = "TEXT")
        private String errorMessage;

        @Column(name = "http_status")
        private Integer httpStatus;

        @Column(name = "occurred_at", nullable = false)
        private LocalDateTime occurredAt;
}
