package com.rebalancer.domain.model;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One independently capitalised portfolio tracking a leaderboard index.
 * Bound from {@code rebalancer.portfolios[n].*}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioConfig {

    @NotBlank
    private String name;

    @NotBlank
    private String indexId;

    @NotNull
    @DecimalMin(value = "0", inclusive = false)
    private BigDecimal initialCapital;

    @Builder.Default
    private boolean enabled = true;
}
