package com.marketdata.jobs.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Reference row for a tradable symbol, maintained by the universe refresh.
 */
@Entity
@Table(name = "symbols", uniqueConstraints = {
        @UniqueConstraint(name = "uk_symbols_symbol", columnNames = "symbol")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ListedSymbol {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "symbol", nullable = false, unique = true, length = 20)
    private String symbol;

    @Column(name = "security_name", length = 255)
    private String securityName;

    @Column(name = "exchange", length = 20)
    private String exchange;

    @Column(name = "test_issue", nullable = false)
    @Builder.Default
    private Boolean testIssue = false;
}
