package com.rebalancer.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the ownership table.
 * One row per (portfolio, symbol) the engine holds; the id is {@code <portfolio>_<symbol>}.
 */
@Entity
@Table(name = "ownership", indexes = @Index(name = "idx_ownership_symbol", columnList = "symbol"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OwnershipEntity {

    @Id
    @Column(length = 120)
    private String id;

    @Column(name = "portfolio_name", length = 100, nullable = false)
    private String portfolioName;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Column(precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(name = "total_cost", precision = 15, scale = 2)
    private BigDecimal totalCost;

    @Column(name = "first_purchase_at")
    private LocalDateTime firstPurchaseAt;

    @Column(name = "last_purchase_at")
    private LocalDateTime lastPurchaseAt;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;
}
