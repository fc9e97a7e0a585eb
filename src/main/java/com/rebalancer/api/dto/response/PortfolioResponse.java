package com.rebalancer.api.dto.response;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** One configured portfolio as listed by GET /api/portfolios. */
@Getter
@Builder
public class PortfolioResponse {

    private final String name;
    private final String indexId;
    private final BigDecimal initialCapital;
    private final boolean enabled;

    /** Number of symbols currently in the portfolio's ledger. */
    private final int holdings;
}
