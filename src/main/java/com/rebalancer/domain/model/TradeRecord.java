package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.ReconciliationStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A trade the engine submitted, recorded when the broker accepted the order.
 *
 * <p>Fills are assumed to happen at submission price. The {@code actual*} fields and
 * {@code reconciledAt} are back-filled later from the broker's trade history; nothing
 * else changes after the record is written.
 */
@Data
@Builder(toBuilder = true)
public class TradeRecord {

    private String id;
    private String portfolioName;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal total;
    private LocalDateTime submittedAt;
    private String brokerTradeId;

    private ReconciliationStatus reconciliationStatus;
    private LocalDateTime reconciledAt;
    private BigDecimal actualPrice;
    private BigDecimal actualQuantity;
}
