package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.SkipReason;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** What the trade executor did with one plan. */
@Data
@Builder
public class ExecutionResult {

    @Builder.Default
    private List<ExecutedLeg> executed = new ArrayList<>();

    @Builder.Default
    private List<SkippedLeg> skipped = new ArrayList<>();

    private boolean externalSalesConsumed;

    public int getFailedCount() {
        return (int) skipped.stream()
                .filter(s -> s.getReason() == SkipReason.ORDER_REJECTED
                        || s.getReason() == SkipReason.SOURCE_UNAVAILABLE)
                .count();
    }
}
