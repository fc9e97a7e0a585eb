package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.BuyReason;
import com.rebalancer.domain.enums.PlannerState;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Sells and buys decided for one portfolio. Sells are executed first, in list order,
 * then buys.
 *
 * <p>{@code baseCapital} is the starting capital on a first run (zero afterwards);
 * {@code externalProceeds} is the pooled estimated proceeds of the external sales listed
 * in {@code consumedExternalSaleIds}. The executor re-derives buy amounts from these
 * plus the sells that actually went through.
 */
@Data
@Builder
public class RebalancePlan {

    private String portfolioName;
    private boolean firstRun;

    @Builder.Default
    private List<SellLeg> sells = new ArrayList<>();

    @Builder.Default
    private List<BuyLeg> buys = new ArrayList<>();

    @Builder.Default
    private List<SkippedLeg> skipped = new ArrayList<>();

    @Builder.Default
    private BigDecimal baseCapital = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal externalProceeds = BigDecimal.ZERO;

    @Builder.Default
    private List<String> consumedExternalSaleIds = new ArrayList<>();

    @Builder.Default
    private List<PlannerState> states = new ArrayList<>();

    public boolean isEmpty() {
        return sells.isEmpty() && buys.isEmpty();
    }

    public int getLegCount() {
        return sells.size() + buys.size();
    }

    @Data
    @Builder
    public static class SellLeg {
        private String symbol;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal estimatedProceeds;
    }

    @Data
    @Builder
    public static class BuyLeg {
        private String symbol;
        private BigDecimal amount;
        private BuyReason reason;
    }
}
