package com.rebalancer.domain.enums;

/**
 * Lifecycle of a trade record against the broker's trade history.
 * PENDING until matched to a broker fill, UNFILLED once the grace period passes without one.
 */
public enum ReconciliationStatus {
    PENDING,
    MATCHED,
    UNFILLED
}
