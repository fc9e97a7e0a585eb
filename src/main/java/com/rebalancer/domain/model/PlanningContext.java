package com.rebalancer.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Data;

/** Everything the planner needs to decide one portfolio's trades. Assembled by the engine. */
@Data
@Builder
public class PlanningContext {

    private String portfolioName;
    private BigDecimal initialCapital;

    /** Previous top-N in rank order; empty when no snapshot exists. */
    private List<String> previousSymbols;

    private List<String> currentSymbols;

    /** Owned positions after reconciliation, keyed by symbol. */
    private Map<String, PositionView> positions;

    /** Current prices for owned symbols that are no longer on the leaderboard. */
    private Map<String, BigDecimal> prices;

    /** Symbols with a non-zero broker position, regardless of owner. */
    private Set<String> brokerHeldSymbols;

    private List<ExternalSaleRecord> unconsumedExternalSales;

    private boolean hasTraded;
}
