package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** An entry of the broker's trade history. The broker trade id may be absent for some brokers. */
@Data
@Builder
public class BrokerTrade {

    private String brokerTradeId;
    private String symbol;
    private OrderSide side;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal total;
    private LocalDateTime executedAt;
}
