package com.rebalancer.exception;

import java.util.Map;

/**
 * Thrown when the broker refuses a single order. Only the affected leg is skipped.
 */
public class OrderRejectedException extends BaseException {

    public OrderRejectedException(String symbol, String reason) {
        super(ErrorCode.ORDER_REJECTED, "Order rejected for " + symbol + ": " + reason, Map.of("symbol", symbol));
    }
}
