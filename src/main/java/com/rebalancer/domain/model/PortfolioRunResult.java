package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.RunStatus;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PortfolioRunResult {

    private String portfolioName;
    private RunStatus status;
    private List<String> previousSymbols;
    private List<String> currentSymbols;
    private RebalancePlan plan;

    @Builder.Default
    private List<ExecutedLeg> executed = new ArrayList<>();

    @Builder.Default
    private List<SkippedLeg> skipped = new ArrayList<>();

    /** Ledger entries of the portfolio after the run. */
    @Builder.Default
    private List<OwnershipRecord> ledger = new ArrayList<>();

    private String errorMessage;
}
