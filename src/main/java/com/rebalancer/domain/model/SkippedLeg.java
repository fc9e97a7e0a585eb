package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.SkipReason;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SkippedLeg {

    private OrderSide side;
    private String symbol;
    private SkipReason reason;
    private String detail;
}
