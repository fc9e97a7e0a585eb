package com.rebalancer.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * Shares the ledger attributed to a portfolio that disappeared from the broker account
 * without the engine selling them. The estimated proceeds are pooled into the
 * portfolio's next buy round and the record is then marked as used.
 */
@Data
@Builder(toBuilder = true)
public class ExternalSaleRecord {

    private String id;
    private String portfolioName;
    private String symbol;
    private BigDecimal quantity;
    private BigDecimal estimatedProceeds;
    private boolean usedForReinvestment;
    private LocalDateTime detectedAt;
    private LocalDateTime reinvestedAt;
}
