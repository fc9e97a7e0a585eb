package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.RunStatus;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Result of one {@code executeRebalance} call across all enabled portfolios. */
@Data
@Builder
public class RunSummary {

    private String runId;
    private String trigger;
    private boolean dryRun;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private ReconciliationReport reconciliation;

    @Builder.Default
    private List<PortfolioRunResult> portfolios = new ArrayList<>();

    public int getExecutedCount() {
        return portfolios.stream().mapToInt(p -> p.getExecuted().size()).sum();
    }

    public int getSkippedCount() {
        return portfolios.stream().mapToInt(p -> p.getSkipped().size()).sum();
    }

    public boolean hasFailures() {
        return portfolios.stream()
                .anyMatch(p -> p.getStatus() == RunStatus.FAILED || p.getStatus() == RunStatus.PARTIAL);
    }
}
