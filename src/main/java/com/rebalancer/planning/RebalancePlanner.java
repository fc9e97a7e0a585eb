package com.rebalancer.planning;

import com.rebalancer.domain.enums.BuyReason;
import com.rebalancer.domain.enums.OrderSide;
import com.rebalancer.domain.enums.PlannerState;
import com.rebalancer.domain.enums.SkipReason;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.PlanningContext;
import com.rebalancer.domain.model.PositionView;
import com.rebalancer.domain.model.RebalancePlan;
import com.rebalancer.domain.model.SkippedLeg;
import com.rebalancer.ledger.OwnershipLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides one portfolio's sells and buys from the previous and current leaderboard and the
 * reconciled ledger. Has no side effects.
 *
 * <p>First run (nothing owned, nothing ever traded): the initial capital plus any unused
 * external sale proceeds is split equally over every current symbol.
 *
 * <p>Later runs:
 * <ul>
 *   <li>symbols that left the leaderboard and are owned are sold in full (sellable quantity)</li>
 *   <li>current symbols the portfolio does not own, and current symbols with unused external
 *       sales, are bought</li>
 *   <li>buy capital is the estimated sell proceeds plus all unused external sale proceeds,
 *       split equally and rounded down to cents</li>
 *   <li>owned symbols that stayed on the leaderboard are left alone</li>
 * </ul>
 * No sells and no buys gives an empty plan, so re-running with unchanged inputs is a no-op.
 */
@Component
public class RebalancePlanner {

    private static final Logger log = LoggerFactory.getLogger(RebalancePlanner.class);

    public RebalancePlan plan(PlanningContext context) {
        String portfolioName = context.getPortfolioName();
        List<PlannerState> states = new ArrayList<>(List.of(PlannerState.IDLE, PlannerState.DETECTING_CHANGES));

        List<String> current = new ArrayList<>(new LinkedHashSet<>(context.getCurrentSymbols()));
        List<String> previous = context.getPreviousSymbols() == null ? List.of() : context.getPreviousSymbols();
        Map<String, PositionView> owned = ownedPositions(context);

        List<ExternalSaleRecord> externalSales =
                context.getUnconsumedExternalSales() == null ? List.of() : context.getUnconsumedExternalSales();
        BigDecimal externalProceeds = externalSales.stream()
                .map(ExternalSaleRecord::getEstimatedProceeds)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        List<String> externalSaleIds =
                externalSales.stream().map(ExternalSaleRecord::getId).toList();

        boolean firstRun = owned.isEmpty() && !context.isHasTraded();
        RebalancePlan plan = RebalancePlan.builder()
                .portfolioName(portfolioName)
                .firstRun(firstRun)
                .states(states)
                .build();

        if (firstRun) {
            planInitialAllocation(context, current, externalProceeds, externalSaleIds, plan);
            states.add(PlannerState.DONE);
            return plan;
        }

        Set<String> leavers = new LinkedHashSet<>(previous);
        leavers.removeAll(current);
        Set<String> entrants = new LinkedHashSet<>(current);
        entrants.removeAll(previous);
        log.info("[{}] leaderboard changes: leavers={}, entrants={}", portfolioName, leavers, entrants);

        BigDecimal sellProceeds = BigDecimal.ZERO;
        for (String symbol : leavers) {
            PositionView position = owned.get(symbol);
            if (position == null) {
                continue;
            }
            BigDecimal quantity = position.getSellableQuantity();
            BigDecimal price = context.getPrices() != null ? context.getPrices().get(symbol) : null;
            if (price == null) {
                price = position.getAverageCost();
                log.warn(
                        "[{}] no current price for {}, estimating proceeds at average cost {}",
                        portfolioName,
                        symbol,
                        price);
            }
            BigDecimal estimated = quantity.multiply(price).setScale(OwnershipLedger.MONEY_SCALE, RoundingMode.HALF_UP);
            plan.getSells().add(RebalancePlan.SellLeg.builder()
                    .symbol(symbol)
                    .quantity(quantity)
                    .price(price)
                    .estimatedProceeds(estimated)
                    .build());
            sellProceeds = sellProceeds.add(estimated);
        }

        Set<String> externallySold =
                externalSales.stream().map(ExternalSaleRecord::getSymbol).collect(Collectors.toSet());
        Map<String, BuyReason> targets = new LinkedHashMap<>();
        for (String symbol : current) {
            if (externallySold.contains(symbol)) {
                targets.put(symbol, BuyReason.BUYBACK);
            } else if (!owned.containsKey(symbol)) {
                boolean heldElsewhere = context.getBrokerHeldSymbols() != null
                        && context.getBrokerHeldSymbols().contains(symbol);
                targets.put(
                        symbol, previous.contains(symbol) || heldElsewhere ? BuyReason.NOT_OWNED : BuyReason.ENTRANT);
            }
        }

        if (!plan.getSells().isEmpty()) {
            states.add(PlannerState.SELLING);
        }

        if (plan.getSells().isEmpty() && targets.isEmpty()) {
            log.info("[{}] no changes, nothing to trade", portfolioName);
            states.add(PlannerState.DONE);
            return plan;
        }

        BigDecimal capital = sellProceeds.add(externalProceeds);
        if (!targets.isEmpty()) {
            BigDecimal perTarget = splitEqually(capital, targets.size());
            if (perTarget.signum() <= 0) {
                log.warn("[{}] no capital available for {} buy target(s)", portfolioName, targets.size());
                targets.keySet().forEach(symbol -> plan.getSkipped().add(noCapital(symbol)));
            } else {
                states.add(PlannerState.BUYING);
                targets.forEach((symbol, reason) -> plan.getBuys().add(RebalancePlan.BuyLeg.builder()
                        .symbol(symbol)
                        .amount(perTarget)
                        .reason(reason)
                        .build()));
                plan.setExternalProceeds(externalProceeds);
                plan.setConsumedExternalSaleIds(new ArrayList<>(externalSaleIds));
            }
        }

        states.add(PlannerState.DONE);
        log.info(
                "[{}] plan: {} sell(s), {} buy(s), capital {} (sells {} + external {})",
                portfolioName,
                plan.getSells().size(),
                plan.getBuys().size(),
                capital,
                sellProceeds,
                externalProceeds);
        return plan;
    }

    private void planInitialAllocation(
            PlanningContext context,
            List<String> current,
            BigDecimal externalProceeds,
            List<String> externalSaleIds,
            RebalancePlan plan) {
        if (current.isEmpty()) {
            log.warn("[{}] first run with an empty leaderboard, nothing to buy", context.getPortfolioName());
            return;
        }

        BigDecimal initialCapital = context.getInitialCapital() == null ? BigDecimal.ZERO : context.getInitialCapital();
        BigDecimal capital = initialCapital.add(externalProceeds);
        BigDecimal perSymbol = splitEqually(capital, current.size());
        if (perSymbol.signum() <= 0) {
            log.warn("[{}] first run without capital", context.getPortfolioName());
            current.forEach(symbol -> plan.getSkipped().add(noCapital(symbol)));
            return;
        }

        plan.getStates().add(PlannerState.BUYING);
        for (String symbol : current) {
            plan.getBuys().add(RebalancePlan.BuyLeg.builder()
                    .symbol(symbol)
                    .amount(perSymbol)
                    .reason(BuyReason.INITIAL_ALLOCATION)
                    .build());
        }
        plan.setBaseCapital(initialCapital);
        plan.setExternalProceeds(externalProceeds);
        plan.setConsumedExternalSaleIds(new ArrayList<>(externalSaleIds));
        log.info(
                "[{}] first run: {} buy(s) of {} from capital {}",
                context.getPortfolioName(),
                current.size(),
                perSymbol,
                capital);
    }

    /** Equal share of {@code capital} over {@code parts}, rounded down to cents. */
    public static BigDecimal splitEqually(BigDecimal capital, int parts) {
        if (parts <= 0 || capital.signum() <= 0) {
            return BigDecimal.ZERO.setScale(OwnershipLedger.MONEY_SCALE);
        }
        return capital.divide(BigDecimal.valueOf(parts), OwnershipLedger.MONEY_SCALE, RoundingMode.DOWN);
    }

    private static Map<String, PositionView> ownedPositions(PlanningContext context) {
        Map<String, PositionView> owned = new LinkedHashMap<>();
        if (context.getPositions() == null) {
            return owned;
        }
        context.getPositions().forEach((symbol, view) -> {
            if (view.getSellableQuantity().compareTo(OwnershipLedger.EPSILON) > 0) {
                owned.put(symbol, view);
            }
        });
        return owned;
    }

    private static SkippedLeg noCapital(String symbol) {
        return SkippedLeg.builder()
                .side(OrderSide.BUY)
                .symbol(symbol)
                .reason(SkipReason.NO_CAPITAL)
                .detail("No sale proceeds or external sale proceeds available")
                .build();
    }
}
