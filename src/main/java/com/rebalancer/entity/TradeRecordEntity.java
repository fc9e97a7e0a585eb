package com.rebalancer.entity;

import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.ReconciliationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trade_records table.
 * Written when an order is accepted; reconciliation columns are filled in later.
 */
@Entity
@Table(name = "trade_records")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeRecordEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "portfolio_name", length = 100, nullable = false)
    private String portfolioName;

    @Column(length = 20, nullable = false)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Column(precision = 19, scale = 6)
    private BigDecimal quantity;

    @Column(precision = 15, scale = 2)
    private BigDecimal price;

    @Column(precision = 15, scale = 2)
    private BigDecimal total;

    @Column(name = "submitted_at")
    private LocalDateTime submittedAt;

    @Column(name = "broker_trade_id", length = 64)
    private String brokerTradeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reconciliation_status", columnDefinition = "varchar(20)")
    private ReconciliationStatus reconciliationStatus;

    @Column(name = "reconciled_at")
    private LocalDateTime reconciledAt;

    @Column(name = "actual_price", precision = 15, scale = 2)
    private BigDecimal actualPrice;

    @Column(name = "actual_quantity", precision = 19, scale = 6)
    private BigDecimal actualQuantity;
}
