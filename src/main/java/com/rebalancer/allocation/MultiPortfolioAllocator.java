package com.rebalancer.allocation;

import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.PositionView;
import com.rebalancer.ledger.OwnershipLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Splits broker quantities across the portfolios that claim a symbol, in proportion to
 * their ledger quantities.
 *
 * <p>Rounding rule: each share is {@code total * weight / sum(weights)} rounded down to
 * {@value OwnershipLedger#QUANTITY_SCALE} decimals; whatever is left goes to the portfolio
 * with the largest weight (ties go to the portfolio name that sorts first). The shares
 * always add up to exactly the apportioned total, so no combination of sells can exceed
 * what the broker holds.
 *
 * <p>Views are built once per run from the full cross-portfolio snapshot, before any
 * portfolio trades, so every portfolio is apportioned against the same broker state.
 */
@Component
public class MultiPortfolioAllocator {

    private static final int FRACTION_SCALE = 6;

    /**
     * Ledger fraction of {@code portfolioName} in {@code symbol}: its quantity divided by the
     * quantity of all portfolios. Zero when nobody holds the symbol.
     */
    public BigDecimal fraction(String portfolioName, String symbol, List<OwnershipRecord> ledgerSnapshot) {
        BigDecimal mine = BigDecimal.ZERO;
        BigDecimal total = BigDecimal.ZERO;
        for (OwnershipRecord record : ledgerSnapshot) {
            if (!record.getSymbol().equals(symbol)) {
                continue;
            }
            total = total.add(record.getQuantity());
            if (record.getPortfolioName().equals(portfolioName)) {
                mine = mine.add(record.getQuantity());
            }
        }
        if (total.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return mine.divide(total, FRACTION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Apportions {@code total} across the keys of {@code weights}.
     *
     * @return share per key, summing exactly to {@code total} rounded down to quantity scale
     */
    public Map<String, BigDecimal> apportion(BigDecimal total, Map<String, BigDecimal> weights) {
        Map<String, BigDecimal> ordered = new TreeMap<>(weights);
        Map<String, BigDecimal> shares = new TreeMap<>();
        BigDecimal weightSum = ordered.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal target = total.max(BigDecimal.ZERO).setScale(OwnershipLedger.QUANTITY_SCALE, RoundingMode.DOWN);

        if (weightSum.signum() <= 0) {
            ordered.keySet().forEach(key -> shares.put(key, BigDecimal.ZERO.setScale(OwnershipLedger.QUANTITY_SCALE)));
            return shares;
        }

        BigDecimal allocated = BigDecimal.ZERO;
        String largest = null;
        for (Map.Entry<String, BigDecimal> entry : ordered.entrySet()) {
            BigDecimal share = target.multiply(entry.getValue())
                    .divide(weightSum, OwnershipLedger.QUANTITY_SCALE, RoundingMode.DOWN);
            shares.put(entry.getKey(), share);
            allocated = allocated.add(share);
            if (largest == null || entry.getValue().compareTo(ordered.get(largest)) > 0) {
                largest = entry.getKey();
            }
        }

        BigDecimal remainder = target.subtract(allocated);
        if (remainder.signum() > 0) {
            shares.put(largest, shares.get(largest).add(remainder));
        }
        return shares;
    }

    /**
     * Builds the apportioned view of every (portfolio, symbol) in the ledger.
     *
     * <p>When the broker holds at least the combined ledger quantity, each portfolio keeps
     * its own ledger quantity. Otherwise the broker quantity is apportioned by ledger
     * weight and the difference is what was sold externally.
     *
     * @return views keyed by portfolio name, then symbol
     */
    public Map<String, Map<String, PositionView>> buildViews(
            List<OwnershipRecord> ledgerSnapshot, Map<String, BigDecimal> brokerPositions) {
        Map<String, List<OwnershipRecord>> bySymbol = ledgerSnapshot.stream()
                .collect(Collectors.groupingBy(OwnershipRecord::getSymbol, TreeMap::new, Collectors.toList()));

        Map<String, Map<String, PositionView>> views = new HashMap<>();
        for (Map.Entry<String, List<OwnershipRecord>> entry : bySymbol.entrySet()) {
            String symbol = entry.getKey();
            List<OwnershipRecord> owners = new ArrayList<>(entry.getValue());
            BigDecimal brokerQuantity = brokerPositions.getOrDefault(symbol, BigDecimal.ZERO);

            Map<String, BigDecimal> weights = new TreeMap<>();
            for (OwnershipRecord owner : owners) {
                weights.merge(owner.getPortfolioName(), owner.getQuantity(), BigDecimal::add);
            }
            BigDecimal totalLedger = weights.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);

            Map<String, BigDecimal> apportioned =
                    brokerQuantity.compareTo(totalLedger) >= 0 ? weights : apportion(brokerQuantity, weights);

            for (OwnershipRecord owner : owners) {
                String portfolioName = owner.getPortfolioName();
                BigDecimal fraction = totalLedger.signum() == 0
                        ? BigDecimal.ZERO
                        : owner.getQuantity().divide(totalLedger, FRACTION_SCALE, RoundingMode.HALF_UP);
                views.computeIfAbsent(portfolioName, k -> new HashMap<>())
                        .put(
                                symbol,
                                PositionView.builder()
                                        .portfolioName(portfolioName)
                                        .symbol(symbol)
                                        .ledgerQuantity(owner.getQuantity())
                                        .totalLedgerQuantity(totalLedger)
                                        .brokerQuantity(brokerQuantity)
                                        .fraction(fraction)
                                        .apportionedQuantity(apportioned.get(portfolioName))
                                        .averageCost(owner.getAverageCost())
                                        .build());
            }
        }
        return views;
    }
}
