package com.rebalancer.domain.model;

import lombok.Builder;
import lombok.Data;

/** Broker response to a single buy or sell submission. */
@Data
@Builder
public class OrderResult {

    private boolean accepted;
    private String brokerOrderId;
    private String reason;

    public static OrderResult accepted(String brokerOrderId) {
        return OrderResult.builder().accepted(true).brokerOrderId(brokerOrderId).build();
    }

    public static OrderResult rejected(String reason) {
        return OrderResult.builder().accepted(false).reason(reason).build();
    }
}
