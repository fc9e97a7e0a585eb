package com.rebalancer.domain.enums;

/** Buy or sell side of a trade, as submitted to the broker and stored on trade records. */
public enum OrderSide {
    BUY,
    SELL
}
