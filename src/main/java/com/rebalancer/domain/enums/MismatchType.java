package com.rebalancer.domain.enums;

/** Kinds of discrepancy reported by the position and trade-history reconciliation passes. */
public enum MismatchType {
    /** Ledger claims more shares than the broker holds; the difference was sold outside the engine. */
    EXTERNAL_SALE,
    /** Broker holds shares the ledger does not account for. */
    UNTRACKED_HOLDING,
    /** Broker trade with no matching trade record (possible manual trade). */
    MISSING_TRADE_RECORD,
    /** Trade record with no broker fill after the grace period. */
    UNFILLED,
    /** Current price could not be fetched; average cost stood in for proceeds. */
    PRICE_UNAVAILABLE
}
