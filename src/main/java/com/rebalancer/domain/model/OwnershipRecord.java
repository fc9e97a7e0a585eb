package com.rebalancer.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Shares of one symbol that the engine itself bought for one portfolio, with the
 * remaining cost basis under the average-cost method.
 *
 * <p>A record only exists while its quantity is positive; a full sale or a complete
 * external sale deletes it.
 */
@Data
@Builder(toBuilder = true)
public class OwnershipRecord {

    private String portfolioName;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal totalCost;
    private LocalDateTime firstPurchaseAt;
    private LocalDateTime lastPurchaseAt;
    private LocalDateTime lastUpdated;

    /** Cost per share, or zero when nothing is held. */
    public BigDecimal getAverageCost() {
        if (quantity == null || quantity.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return totalCost.divide(quantity, 2, RoundingMode.HALF_UP);
    }
}
