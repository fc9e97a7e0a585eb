package com.rebalancer.engine;

import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.RunStatus;
import com.rebalancer.domain.model.ExecutionResult;
import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.domain.model.ExternalSaleRecord;
import com.rebalancer.domain.model.LeaderboardSnapshot;
import com.rebalancer.domain.model.PlanningContext;
import com.rebalancer.domain.model.PortfolioConfig;
import com.rebalancer.domain.model.PortfolioRunResult;
import com.rebalancer.domain.model.PositionView;
import com.rebalancer.domain.model.RebalancePlan;
import com.rebalancer.domain.model.ReconciliationReport;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.event.RebalanceCompletedEvent;
import com.rebalancer.exception.BaseException;
import com.rebalancer.exception.RebalanceInProgressException;
import com.rebalancer.execution.TradeExecutor;
import com.rebalancer.leaderboard.LeaderboardSource;
import com.rebalancer.ledger.LedgerStore;
import com.rebalancer.ledger.OwnershipLedger;
import com.rebalancer.planning.RebalancePlanner;
import com.rebalancer.reconciliation.PositionReconciler;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one rebalance across every enabled portfolio.
 *
 * <p>Order of work:
 * <ol>
 *   <li>validate the configuration</li>
 *   <li>fetch broker positions once; a failure here fails every portfolio</li>
 *   <li>reconcile trade history and positions for all portfolios together</li>
 *   <li>per portfolio, sequentially: fetch the top-N, plan against the previous snapshot,
 *       execute, store the new snapshot</li>
 *   <li>publish a {@link RebalanceCompletedEvent} with the {@link RunSummary}</li>
 * </ol>
 * A failure inside one portfolio (leaderboard or store unreachable, or an unexpected
 * runtime error) marks that portfolio FAILED and the others proceed; the summary event is
 * published either way.
 *
 * <p>Only one run is active at a time. A second trigger while a run is active fails with
 * {@link RebalanceInProgressException}.
 */
@Service
public class RebalanceEngine {

    private static final Logger log = LoggerFactory.getLogger(RebalanceEngine.class);

    private final RebalancerProperties rebalancerProperties;
    private final PortfolioConfigValidator portfolioConfigValidator;
    private final BrokerGateway brokerGateway;
    private final TimedCallExecutor brokerCallExecutor;
    private final LeaderboardSource leaderboardSource;
    private final LedgerStore ledgerStore;
    private final OwnershipLedger ownershipLedger;
    private final PositionReconciler positionReconciler;
    private final RebalancePlanner rebalancePlanner;
    private final TradeExecutor tradeExecutor;
    private final ExecutionTracker executionTracker;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantLock runLock = new ReentrantLock();
    private volatile String activeRunId;

    public RebalanceEngine(
            RebalancerProperties rebalancerProperties,
            PortfolioConfigValidator portfolioConfigValidator,
            BrokerGateway brokerGateway,
            TimedCallExecutor brokerCallExecutor,
            LeaderboardSource leaderboardSource,
            LedgerStore ledgerStore,
            OwnershipLedger ownershipLedger,
            PositionReconciler positionReconciler,
            RebalancePlanner rebalancePlanner,
            TradeExecutor tradeExecutor,
            ExecutionTracker executionTracker,
            ApplicationEventPublisher applicationEventPublisher) {
        this.rebalancerProperties = rebalancerProperties;
        this.portfolioConfigValidator = portfolioConfigValidator;
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.leaderboardSource = leaderboardSource;
        this.ledgerStore = ledgerStore;
        this.ownershipLedger = ownershipLedger;
        this.positionReconciler = positionReconciler;
        this.rebalancePlanner = rebalancePlanner;
        this.tradeExecutor = tradeExecutor;
        this.executionTracker = executionTracker;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public RunSummary executeRebalance(String trigger) {
        return executeRebalance(trigger, false);
    }

    /**
     * @param dryRun plan without placing orders or writing anything
     * @throws RebalanceInProgressException if another run is active
     * @throws com.rebalancer.exception.ConfigurationException if the configuration is invalid
     */
    public RunSummary executeRebalance(String trigger, boolean dryRun) {
        if (!runLock.tryLock()) {
            log.warn("Rebalance trigger '{}' rejected: run {} in progress", trigger, activeRunId);
            throw new RebalanceInProgressException(activeRunId);
        }
        String runId = UUID.randomUUID().toString();
        activeRunId = runId;
        try {
            return run(runId, trigger, dryRun);
        } finally {
            activeRunId = null;
            runLock.unlock();
        }
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    public String getActiveRunId() {
        return activeRunId;
    }

    private RunSummary run(String runId, String trigger, boolean dryRun) {
        portfolioConfigValidator.validate();

        List<PortfolioConfig> portfolios = rebalancerProperties.getEnabledPortfolios();
        RunSummary summary = RunSummary.builder()
                .runId(runId)
                .trigger(trigger)
                .dryRun(dryRun)
                .startedAt(LocalDateTime.now())
                .build();
        log.info(
                "Rebalance run {} started: trigger={}, dryRun={}, portfolios={}",
                runId,
                trigger,
                dryRun,
                portfolios.stream().map(PortfolioConfig::getName).toList());

        Map<String, BigDecimal> brokerPositions;
        ReconciliationReport report;
        try {
            brokerPositions = brokerCallExecutor.call("getPositions", brokerGateway::getPositions);
            report = positionReconciler.reconcile(trigger, brokerPositions, dryRun);
        } catch (RuntimeException e) {
            // BaseException for a known source failure, anything else is a defect; both fail every portfolio
            String error = errorMessage(e);
            log.error("Run {} aborted before planning: {}", runId, error, e);
            for (PortfolioConfig portfolio : portfolios) {
                summary.getPortfolios().add(failAll(runId, trigger, portfolio, error, dryRun));
            }
            return finish(summary);
        }
        summary.setReconciliation(report);

        for (PortfolioConfig portfolio : portfolios) {
            summary.getPortfolios().add(processPortfolio(runId, trigger, portfolio, brokerPositions, report, dryRun));
        }
        return finish(summary);
    }

    private PortfolioRunResult processPortfolio(
            String runId,
            String trigger,
            PortfolioConfig portfolio,
            Map<String, BigDecimal> brokerPositions,
            ReconciliationReport report,
            boolean dryRun) {
        String name = portfolio.getName();
        ExecutionRun executionRun = executionTracker.start(runId, name, trigger, dryRun);
        PortfolioRunResult result = PortfolioRunResult.builder().portfolioName(name).build();

        try {
            List<String> current = leaderboardSource.fetchTopN(portfolio.getIndexId(), rebalancerProperties.getTopN());
            List<String> previous = ledgerStore.findLatestSnapshot(name)
                    .map(LeaderboardSnapshot::getSymbols)
                    .orElse(List.of());
            result.setCurrentSymbols(current);
            result.setPreviousSymbols(previous);
            log.info("[{}] previous top-{}: {}, current: {}", name, rebalancerProperties.getTopN(), previous, current);

            PlanningContext context = planningContext(portfolio, previous, current, brokerPositions, report, dryRun);
            RebalancePlan plan = rebalancePlanner.plan(context);
            result.setPlan(plan);

            ExecutionResult execution = tradeExecutor.execute(plan, dryRun);
            result.setExecuted(execution.getExecuted());
            result.setSkipped(execution.getSkipped());

            RunStatus status = statusOf(plan, execution);
            result.setStatus(status);

            // A failed leg keeps the old snapshot so the next run retries the same transition
            if (!dryRun && execution.getFailedCount() == 0) {
                ledgerStore.saveSnapshot(LeaderboardSnapshot.builder()
                        .portfolioName(name)
                        .indexId(portfolio.getIndexId())
                        .symbols(current)
                        .capturedAt(LocalDateTime.now())
                        .build());
            }
            result.setLedger(ownershipLedger.getPortfolioLedger(name));

            executionTracker.complete(
                    executionRun,
                    status,
                    plan.getLegCount(),
                    execution.getExecuted().size(),
                    execution.getFailedCount(),
                    null,
                    dryRun);
            log.info(
                    "[{}] {}: {} executed, {} skipped",
                    name,
                    status,
                    execution.getExecuted().size(),
                    execution.getSkipped().size());
        } catch (BaseException e) {
            log.error("[{}] portfolio aborted: {}", name, e.getMessage(), e);
            fail(executionRun, result, e.getMessage(), dryRun);
        } catch (RuntimeException e) {
            log.error("[{}] portfolio aborted by unexpected error: {}", name, errorMessage(e), e);
            fail(executionRun, result, errorMessage(e), dryRun);
        }
        return result;
    }

    private void fail(ExecutionRun executionRun, PortfolioRunResult result, String error, boolean dryRun) {
        result.setStatus(RunStatus.FAILED);
        result.setErrorMessage(error);
        executionTracker.complete(executionRun, RunStatus.FAILED, 0, result.getExecuted().size(), 0, error, dryRun);
    }

    private static String errorMessage(RuntimeException e) {
        if (e instanceof BaseException) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private PlanningContext planningContext(
            PortfolioConfig portfolio,
            List<String> previous,
            List<String> current,
            Map<String, BigDecimal> brokerPositions,
            ReconciliationReport report,
            boolean dryRun) {
        String name = portfolio.getName();
        Map<String, PositionView> positions = report.viewsFor(name);

        Map<String, BigDecimal> prices = new HashMap<>();
        for (String symbol : positions.keySet()) {
            if (current.contains(symbol)) {
                continue;
            }
            try {
                BigDecimal price =
                        brokerCallExecutor.call("getCurrentPrice", () -> brokerGateway.getCurrentPrice(symbol));
                prices.put(symbol, price);
            } catch (BaseException e) {
                log.warn("[{}] no current price for {}: {}", name, symbol, e.getMessage());
            }
        }

        Set<String> brokerHeld = new LinkedHashSet<>();
        brokerPositions.forEach((symbol, quantity) -> {
            if (quantity != null && quantity.compareTo(OwnershipLedger.EPSILON) > 0) {
                brokerHeld.add(symbol);
            }
        });

        List<ExternalSaleRecord> unconsumed = new ArrayList<>(ownershipLedger.findUnconsumedExternalSales(name));
        if (dryRun) {
            unconsumed.addAll(report.salesFor(name));
        }

        return PlanningContext.builder()
                .portfolioName(name)
                .initialCapital(portfolio.getInitialCapital())
                .previousSymbols(previous)
                .currentSymbols(current)
                .positions(positions)
                .prices(prices)
                .brokerHeldSymbols(brokerHeld)
                .unconsumedExternalSales(unconsumed)
                .hasTraded(ownershipLedger.hasTraded(name))
                .build();
    }

    private PortfolioRunResult failAll(
            String runId, String trigger, PortfolioConfig portfolio, String error, boolean dryRun) {
        ExecutionRun executionRun = executionTracker.start(runId, portfolio.getName(), trigger, dryRun);
        executionTracker.complete(executionRun, RunStatus.FAILED, 0, 0, 0, error, dryRun);
        return PortfolioRunResult.builder()
                .portfolioName(portfolio.getName())
                .status(RunStatus.FAILED)
                .errorMessage(error)
                .build();
    }

    private RunSummary finish(RunSummary summary) {
        summary.setCompletedAt(LocalDateTime.now());
        log.info(
                "Rebalance run {} finished: {} executed, {} skipped, failures={}",
                summary.getRunId(),
                summary.getExecutedCount(),
                summary.getSkippedCount(),
                summary.hasFailures());
        applicationEventPublisher.publishEvent(new RebalanceCompletedEvent(this, summary));
        return summary;
    }

    static RunStatus statusOf(RebalancePlan plan, ExecutionResult execution) {
        if (execution.getFailedCount() > 0) {
            return RunStatus.PARTIAL;
        }
        if (plan.isEmpty() && execution.getSkipped().isEmpty()) {
            return RunStatus.NO_OP;
        }
        return RunStatus.COMPLETED;
    }
}
