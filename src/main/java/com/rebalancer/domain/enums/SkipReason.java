package com.rebalancer.domain.enums;

public enum SkipReason {
    NO_CAPITAL,
    ORDER_REJECTED,
    SOURCE_UNAVAILABLE,
    DRY_RUN
}
