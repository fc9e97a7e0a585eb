package com.rebalancer.domain.enums;

/**
 * Backing store for the ownership ledger. NONE keeps everything in process memory and
 * only supports a single enabled portfolio.
 */
public enum PersistenceMode {
    JPA,
    NONE
}
