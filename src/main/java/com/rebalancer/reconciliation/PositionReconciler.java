package com.rebalancer.reconciliation;

import com.rebalancer.allocation.MultiPortfolioAllocator;
import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.OwnershipRecord;
import com.rebalancer.domain.model.PositionView;
import com.rebalancer.domain.model.ReconciliationMismatch;
import com.rebalancer.domain.model.ReconciliationReport;
import com.rebalancer.domain.model.TradeReconciliationResult;
import com.rebalancer.event.ReconciliationEvent;
import com.rebalancer.exception.BaseException;
import com.rebalancer.ledger.OwnershipLedger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Brings the ownership ledger in line with what the broker actually holds.
 *
 * <p>The broker is the truth for what exists, the ledger for who owns it. Per symbol:
 * <ul>
 *   <li>ledger total above the broker quantity: shares were sold outside the engine. The
 *       broker quantity is apportioned across owners and every owner above its share gets
 *       an {@link ExternalSaleRecord} for the difference, valued at the current price
 *       (average cost when no price is available); its ledger shrinks to the share.</li>
 *   <li>broker quantity above the ledger total, or a broker symbol nobody owns: reported as
 *       an untracked holding, never added to the ledger.</li>
 * </ul>
 * Afterwards no symbol's ledger total exceeds the broker quantity.
 *
 * <p>The trade-history pass runs first and is informational only. In a dry run nothing is
 * written; the detected external sales are returned in the report for planning.
 */
@Service
public class PositionReconciler {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciler.class);

    private final OwnershipLedger ownershipLedger;
    private final MultiPortfolioAllocator multiPortfolioAllocator;
    private final TradeHistoryReconciler tradeHistoryReconciler;
    private final BrokerGateway brokerGateway;
    private final TimedCallExecutor brokerCallExecutor;
    private final ApplicationEventPublisher applicationEventPublisher;

    public PositionReconciler(
            OwnershipLedger ownershipLedger,
            MultiPortfolioAllocator multiPortfolioAllocator,
            TradeHistoryReconciler tradeHistoryReconciler,
            BrokerGateway brokerGateway,
            TimedCallExecutor brokerCallExecutor,
            ApplicationEventPublisher applicationEventPublisher) {
        this.ownershipLedger = ownershipLedger;
        this.multiPortfolioAllocator = multiPortfolioAllocator;
        this.tradeHistoryReconciler = tradeHistoryReconciler;
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Reconciles trade history and positions against one broker positions snapshot.
     *
     * @param brokerPositions positions fetched once at the start of the run
     */
    public ReconciliationReport reconcile(String trigger, Map<String, BigDecimal> brokerPositions, boolean dryRun) {
        long startTime = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now();
        log.info("Reconciliation started: trigger={}, dryRun={}", trigger, dryRun);

        TradeReconciliationResult tradeHistory = tradeHistoryReconciler.reconcile(now, dryRun);

        List<OwnershipRecord> ledgerSnapshot = ownershipLedger.getAll();
        Map<String, Map<String, PositionView>> views =
                multiPortfolioAllocator.buildViews(ledgerSnapshot, brokerPositions);

        List<ReconciliationMismatch> mismatches = new ArrayList<>(tradeHistory.getMismatches());
        List<ExternalSaleRecord> detectedSales = new ArrayList<>();

        Map<String, List<PositionView>> viewsBySymbol = views.values().stream()
                .flatMap(m -> m.values().stream())
                .collect(Collectors.groupingBy(PositionView::getSymbol, TreeMap::new, Collectors.toList()));

        for (Map.Entry<String, List<PositionView>> entry : viewsBySymbol.entrySet()) {
            String symbol = entry.getKey();
            List<PositionView> owners = entry.getValue();
            BigDecimal totalLedger = owners.get(0).getTotalLedgerQuantity();
            BigDecimal brokerQuantity = owners.get(0).getBrokerQuantity();

            if (totalLedger.subtract(brokerQuantity).compareTo(OwnershipLedger.EPSILON) > 0) {
                detectExternalSales(symbol, owners, now, dryRun, detectedSales, mismatches);
            } else if (brokerQuantity.subtract(totalLedger).compareTo(OwnershipLedger.EPSILON) > 0) {
                mismatches.add(ReconciliationMismatch.builder()
                        .type(MismatchType.UNTRACKED_HOLDING)
                        .symbol(symbol)
                        .ledgerQuantity(totalLedger)
                        .brokerQuantity(brokerQuantity)
                        .detail("Broker holds " + brokerQuantity.subtract(totalLedger) + " more than the ledger")
                        .build());
            }
        }

        Set<String> untracked = new TreeSet<>(brokerPositions.keySet());
        untracked.removeAll(viewsBySymbol.keySet());
        for (String symbol : untracked) {
            mismatches.add(ReconciliationMismatch.builder()
                    .type(MismatchType.UNTRACKED_HOLDING)
                    .symbol(symbol)
                    .ledgerQuantity(BigDecimal.ZERO)
                    .brokerQuantity(brokerPositions.get(symbol))
                    .detail("Held at the broker, not owned by any portfolio")
                    .build());
        }

        ReconciliationReport report = ReconciliationReport.builder()
                .timestamp(now)
                .trigger(trigger)
                .dryRun(dryRun)
                .positionViews(views)
                .detectedSales(detectedSales)
                .mismatches(mismatches)
                .tradeHistory(tradeHistory)
                .durationMs(System.currentTimeMillis() - startTime)
                .build();

        if (report.hasMismatches()) {
            log.warn(
                    "Reconciliation found {} mismatch(es), {} external sale(s)",
                    report.getTotalMismatches(),
                    detectedSales.size());
        } else {
            log.info("Reconciliation clean: ledger matches broker");
        }

        applicationEventPublisher.publishEvent(new ReconciliationEvent(this, report));
        return report;
    }

    private void detectExternalSales(
            String symbol,
            List<PositionView> owners,
            LocalDateTime now,
            boolean dryRun,
            List<ExternalSaleRecord> detectedSales,
            List<ReconciliationMismatch> mismatches) {
        BigDecimal price = null;
        try {
            price = brokerCallExecutor.call("getCurrentPrice", () -> brokerGateway.getCurrentPrice(symbol));
        } catch (BaseException e) {
            log.warn("No current price for {}, valuing external sale at average cost: {}", symbol, e.getMessage());
            mismatches.add(ReconciliationMismatch.builder()
                    .type(MismatchType.PRICE_UNAVAILABLE)
                    .symbol(symbol)
                    .detail("External sale valued at average cost: " + e.getMessage())
                    .build());
        }

        for (PositionView view : owners) {
            BigDecimal soldExternally = view.getLedgerQuantity().subtract(view.getApportionedQuantity());
            if (soldExternally.compareTo(OwnershipLedger.EPSILON) <= 0) {
                continue;
            }

            BigDecimal unitValue = price != null ? price : view.getAverageCost();
            ExternalSaleRecord sale = ExternalSaleRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .portfolioName(view.getPortfolioName())
                    .symbol(symbol)
                    .quantity(OwnershipLedger.scaleQuantity(soldExternally))
                    .estimatedProceeds(soldExternally.multiply(unitValue).setScale(2, RoundingMode.HALF_UP))
                    .usedForReinvestment(false)
                    .detectedAt(now)
                    .build();
            detectedSales.add(sale);

            log.warn(
                    "[{}] external sale of {} {} detected (ledger {}, broker share {}), est. proceeds {}",
                    view.getPortfolioName(),
                    sale.getQuantity(),
                    symbol,
                    view.getLedgerQuantity(),
                    view.getApportionedQuantity(),
                    sale.getEstimatedProceeds());

            mismatches.add(ReconciliationMismatch.builder()
                    .type(MismatchType.EXTERNAL_SALE)
                    .portfolioName(view.getPortfolioName())
                    .symbol(symbol)
                    .ledgerQuantity(view.getLedgerQuantity())
                    .brokerQuantity(view.getApportionedQuantity())
                    .detail("Sold outside the engine: " + sale.getQuantity())
                    .build());

            if (!dryRun) {
                ownershipLedger.recordExternalSale(sale, view.getApportionedQuantity());
            }
        }
    }
}
