package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.MismatchType;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * A discrepancy between the ledger (or trade records) and the broker. Informational:
 * reported in the run summary and never blocks trading.
 */
@Data
@Builder
public class ReconciliationMismatch {

    private MismatchType type;
    private String portfolioName;
    private String symbol;
    private BigDecimal ledgerQuantity;
    private BigDecimal brokerQuantity;
    private String detail;
}
