package com.rebalancer.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * One portfolio's slice of a symbol after apportioning the broker quantity across all
 * portfolios that claim it.
 */
@Data
@Builder
public class PositionView {

    private String portfolioName;
    private String symbol;
    private BigDecimal ledgerQuantity;
    private BigDecimal totalLedgerQuantity;
    private BigDecimal brokerQuantity;
    private BigDecimal fraction;
    private BigDecimal apportionedQuantity;
    private BigDecimal averageCost;

    /** The most this portfolio may sell: its ledger quantity, capped by its share of the broker holding. */
    public BigDecimal getSellableQuantity() {
        return ledgerQuantity.min(apportionedQuantity);
    }
}
