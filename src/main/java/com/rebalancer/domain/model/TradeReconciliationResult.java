package com.rebalancer.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Result of matching trade records against the broker trade history. */
@Data
@Builder
public class TradeReconciliationResult {

    private int brokerTradesScanned;
    private int matched;
    private int updated;
    private int missing;
    private int unfilled;

    /** Set when the pass could not run (e.g. broker history unavailable). */
    private String error;

    @Builder.Default
    private List<ReconciliationMismatch> mismatches = new ArrayList<>();
}
