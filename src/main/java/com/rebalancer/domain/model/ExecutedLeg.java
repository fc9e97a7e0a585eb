package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.OrderSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExecutedLeg {

    private OrderSide side;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal total;
    private String brokerOrderId;
    private String tradeRecordId;
}
