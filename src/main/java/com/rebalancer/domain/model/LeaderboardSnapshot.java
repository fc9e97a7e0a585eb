package com.rebalancer.domain.model;

import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Ordered top-N symbols a portfolio rebalanced against. Becomes the "previous" list of the next run. */
@Data
@Builder
public class LeaderboardSnapshot {

    private String portfolioName;
    private String indexId;
    private List<String> symbols;
    private LocalDateTime capturedAt;
}
