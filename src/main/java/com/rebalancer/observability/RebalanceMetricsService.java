package com.rebalancer.observability;

import com.rebalancer.domain.enums.MismatchType;
import com.rebalancer.domain.enums.RunStatus;
import com.rebalancer.domain.model.PortfolioRunResult;
import com.rebalancer.domain.model.ReconciliationReport;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.domain.model.SkippedLeg;
import com.rebalancer.event.RebalanceCompletedEvent;
import com.rebalancer.event.ReconciliationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters of the rebalancer, exposed through Spring Boot Actuator:
 * <ul>
 *   <li><b>rebalance.runs</b> (counter, tag {@code status}): one per portfolio per run</li>
 *   <li><b>rebalance.legs.executed</b> (counter, tag {@code side})</li>
 *   <li><b>rebalance.legs.skipped</b> (counter, tag {@code reason})</li>
 *   <li><b>rebalance.duration</b> (timer): wall time of a whole run</li>
 *   <li><b>reconciliation.external.sales</b> (counter)</li>
 *   <li><b>reconciliation.mismatches</b> (counter, tag {@code type})</li>
 * </ul>
 * Dry runs are not counted.
 */
@Service
public class RebalanceMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter externalSalesCounter;

    public RebalanceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.externalSalesCounter = Counter.builder("reconciliation.external.sales")
                .description("External sales detected during reconciliation")
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onReconciliationEvent(ReconciliationEvent event) {
        ReconciliationReport report = event.getReport();
        if (report.isDryRun()) {
            return;
        }
        externalSalesCounter.increment(report.getDetectedSales().size());
        for (MismatchType type : MismatchType.values()) {
            long count = report.countMismatches(type);
            if (count > 0) {
                meterRegistry.counter("reconciliation.mismatches", "type", type.name()).increment(count);
            }
        }
    }

    @EventListener
    @Order(20)
    public void onRebalanceCompleted(RebalanceCompletedEvent event) {
        RunSummary summary = event.getSummary();
        if (summary.isDryRun()) {
            return;
        }
        for (PortfolioRunResult portfolio : summary.getPortfolios()) {
            RunStatus status = portfolio.getStatus() != null ? portfolio.getStatus() : RunStatus.FAILED;
            meterRegistry.counter("rebalance.runs", "status", status.name()).increment();
            portfolio.getExecuted().forEach(leg -> meterRegistry
                    .counter("rebalance.legs.executed", "side", leg.getSide().name())
                    .increment());
            for (SkippedLeg leg : portfolio.getSkipped()) {
                meterRegistry
                        .counter("rebalance.legs.skipped", "reason", leg.getReason().name())
                        .increment();
            }
        }
        if (summary.getStartedAt() != null && summary.getCompletedAt() != null) {
            Duration elapsed = Duration.between(summary.getStartedAt(), summary.getCompletedAt());
            meterRegistry.timer("rebalance.duration").record(elapsed.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
