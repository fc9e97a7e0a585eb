package com.rebalancer.reconciliation;

import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.enums.ReconciliationStatus;
import com.rebalancer.domain.model.BrokerTrade;
import com.rebalancer.domain.model.ReconciliationMismatch;
import com.rebalancer.domain.model.TradeReconciliationResult;
import com.rebalancer.domain.model.TradeRecord;
import com.rebalancer.exception.BaseException;
import com.rebalancer.ledger.LedgerStore;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches the engine's trade records against the broker's trade history.
 *
 * <p>Matching order for each broker trade:
 * <ol>
 *   <li>a record carrying the same broker trade id</li>
 *   <li>otherwise the closest unmatched record with the same symbol and side submitted
 *       within the match tolerance (1 hour by default)</li>
 * </ol>
 * A matched record gets the broker's price and quantity back-filled. A broker trade with no
 * record is reported as {@link MismatchType#MISSING_TRADE_RECORD}; a pending record left
 * unmatched past the grace period becomes {@link ReconciliationStatus#UNFILLED}.
 *
 * <p>The pass is informational. It never changes the ledger and a failure only produces a
 * result with {@code error} set.
 */
@Component
public class TradeHistoryReconciler {

    private static final Logger log = LoggerFactory.getLogger(TradeHistoryReconciler.class);

    /** Price or quantity differences at or below this are not counted as corrections. */
    private static final BigDecimal UPDATE_THRESHOLD = new BigDecimal("0.01");

    private final BrokerGateway brokerGateway;
    private final TimedCallExecutor brokerCallExecutor;
    private final LedgerStore ledgerStore;
    private final RebalancerProperties.Reconciliation reconciliationProperties;

    public TradeHistoryReconciler(
            BrokerGateway brokerGateway,
            TimedCallExecutor brokerCallExecutor,
            LedgerStore ledgerStore,
            RebalancerProperties rebalancerProperties) {
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.ledgerStore = ledgerStore;
        this.reconciliationProperties = rebalancerProperties.getReconciliation();
    }

    public TradeReconciliationResult reconcile(LocalDateTime now, boolean dryRun) {
        LocalDateTime since = now.minusDays(reconciliationProperties.getLookbackDays());
        Duration tolerance = reconciliationProperties.getMatchTolerance();

        List<BrokerTrade> brokerTrades;
        List<TradeRecord> records;
        try {
            brokerTrades = brokerCallExecutor.call("getTradeHistory", () -> brokerGateway.getTradeHistory(since));
            records = new ArrayList<>(ledgerStore.findTradesSince(since));
        } catch (BaseException e) {
            log.warn("Trade history reconciliation skipped: {}", e.getMessage());
            return TradeReconciliationResult.builder().error(e.getMessage()).build();
        }

        List<ReconciliationMismatch> mismatches = new ArrayList<>();
        Set<String> matchedIds = new HashSet<>();
        int matched = 0;
        int updated = 0;
        int missing = 0;

        for (BrokerTrade brokerTrade : brokerTrades) {
            Optional<TradeRecord> match = findMatch(brokerTrade, records, matchedIds, tolerance);
            if (match.isEmpty()) {
                missing++;
                mismatches.add(ReconciliationMismatch.builder()
                        .type(MismatchType.MISSING_TRADE_RECORD)
                        .symbol(brokerTrade.getSymbol())
                        .brokerQuantity(brokerTrade.getQuantity())
                        .detail(String.format(
                                "Broker %s of %s %s at %s has no trade record",
                                brokerTrade.getSide(),
                                brokerTrade.getQuantity(),
                                brokerTrade.getSymbol(),
                                brokerTrade.getExecutedAt()))
                        .build());
                continue;
            }

            TradeRecord record = match.get();
            matchedIds.add(record.getId());
            matched++;

            boolean corrected = differs(record.getQuantity(), brokerTrade.getQuantity())
                    || differs(record.getPrice(), brokerTrade.getPrice());
            if (corrected) {
                updated++;
                log.info(
                        "[{}] trade {} {} corrected from broker: qty {} -> {}, price {} -> {}",
                        record.getPortfolioName(),
                        record.getSide(),
                        record.getSymbol(),
                        record.getQuantity(),
                        brokerTrade.getQuantity(),
                        record.getPrice(),
                        brokerTrade.getPrice());
            }

            if (corrected || record.getReconciliationStatus() != ReconciliationStatus.MATCHED) {
                TradeRecord reconciled = record.toBuilder()
                        .brokerTradeId(record.getBrokerTradeId() != null
                                ? record.getBrokerTradeId()
                                : brokerTrade.getBrokerTradeId())
                        .actualPrice(brokerTrade.getPrice())
                        .actualQuantity(brokerTrade.getQuantity())
                        .reconciledAt(now)
                        .reconciliationStatus(ReconciliationStatus.MATCHED)
                        .build();
                if (!dryRun) {
                    ledgerStore.saveTrade(reconciled);
                }
            }
        }

        int unfilled = 0;
        LocalDateTime graceCutoff = now.minus(reconciliationProperties.getUnfilledGracePeriod());
        for (TradeRecord record : records) {
            if (matchedIds.contains(record.getId())
                    || record.getReconciliationStatus() != ReconciliationStatus.PENDING
                    || !record.getSubmittedAt().isBefore(graceCutoff)) {
                continue;
            }
            unfilled++;
            mismatches.add(ReconciliationMismatch.builder()
                    .type(MismatchType.UNFILLED)
                    .portfolioName(record.getPortfolioName())
                    .symbol(record.getSymbol())
                    .ledgerQuantity(record.getQuantity())
                    .detail(String.format(
                            "%s %s submitted at %s has no broker fill",
                            record.getSide(), record.getSymbol(), record.getSubmittedAt()))
                    .build());
            if (!dryRun) {
                ledgerStore.saveTrade(record.toBuilder()
                        .reconciliationStatus(ReconciliationStatus.UNFILLED)
                        .reconciledAt(now)
                        .build());
            }
        }

        log.info(
                "Trade history reconciled: {} broker trades, {} matched, {} updated, {} missing, {} unfilled",
                brokerTrades.size(),
                matched,
                updated,
                missing,
                unfilled);

        return TradeReconciliationResult.builder()
                .brokerTradesScanned(brokerTrades.size())
                .matched(matched)
                .updated(updated)
                .missing(missing)
                .unfilled(unfilled)
                .mismatches(mismatches)
                .build();
    }

    private Optional<TradeRecord> findMatch(
            BrokerTrade brokerTrade, List<TradeRecord> records, Set<String> matchedIds, Duration tolerance) {
        if (brokerTrade.getBrokerTradeId() != null) {
            Optional<TradeRecord> byId = records.stream()
                    .filter(r -> !matchedIds.contains(r.getId()))
                    .filter(r -> brokerTrade.getBrokerTradeId().equals(r.getBrokerTradeId()))
                    .findFirst();
            if (byId.isPresent()) {
                return byId;
            }
        }

        TradeRecord best = null;
        Duration bestGap = null;
        for (TradeRecord record : records) {
            if (matchedIds.contains(record.getId())
                    || !record.getSymbol().equals(brokerTrade.getSymbol())
                    || record.getSide() != brokerTrade.getSide()
                    || (record.getBrokerTradeId() != null && brokerTrade.getBrokerTradeId() != null)) {
                continue;
            }
            Duration gap = Duration.between(record.getSubmittedAt(), brokerTrade.getExecutedAt()).abs();
            if (gap.compareTo(tolerance) < 0 && (bestGap == null || gap.compareTo(bestGap) < 0)) {
                best = record;
                bestGap = gap;
            }
        }
        return Optional.ofNullable(best);
    }

    private static boolean differs(BigDecimal recorded, BigDecimal actual) {
        if (recorded == null || actual == null) {
            return false;
        }
        return recorded.subtract(actual).abs().compareTo(UPDATE_THRESHOLD) > 0;
    }
}
