package com.rebalancer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the external_sales table. */
@Entity
@Table(name = "external_sales")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExternalSaleEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "portfolio_name", length = 100, nullable = false)
    private String portfolioName;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Column(precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "estimated_proceeds", precision = 15, scale = 2)
    private BigDecimal estimatedProceeds;

    @Column(name = "used_for_reinvestment")
    private boolean usedForReinvestment;

    @Column(name = "detected_at")
    private LocalDateTime detectedAt;

    @Column(name = "reinvested_at")
    private LocalDateTime reinvestedAt;
}
