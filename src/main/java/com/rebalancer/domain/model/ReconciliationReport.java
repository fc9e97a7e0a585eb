package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.MismatchType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of reconciling the ledger with the broker for one run.
 *
 * <p>{@code positionViews} holds the apportioned view per portfolio and symbol, already
 * reflecting detected external sales. {@code detectedSales} lists the external sales
 * found in this run (persisted unless the run is a dry run).
 */
@Data
@Builder
public class ReconciliationReport {

    private LocalDateTime timestamp;
    private String trigger;
    private boolean dryRun;

    @Builder.Default
    private Map<String, Map<String, PositionView>> positionViews = new HashMap<>();

    @Builder.Default
    private List<ExternalSaleRecord> detectedSales = new ArrayList<>();

    @Builder.Default
    private List<ReconciliationMismatch> mismatches = new ArrayList<>();

    private TradeReconciliationResult tradeHistory;
    private long durationMs;

    public boolean hasMismatches() {
        return mismatches != null && !mismatches.isEmpty();
    }

    public int getTotalMismatches() {
        return mismatches != null ? mismatches.size() : 0;
    }

    public long countMismatches(MismatchType type) {
        return mismatches.stream().filter(m -> m.getType() == type).count();
    }

    public Map<String, PositionView> viewsFor(String portfolioName) {
        return positionViews.getOrDefault(portfolioName, Map.of());
    }

    public List<ExternalSaleRecord> salesFor(String portfolioName) {
        return detectedSales.stream()
                .filter(s -> s.getPortfolioName().equals(portfolioName))
                .toList();
    }
}
