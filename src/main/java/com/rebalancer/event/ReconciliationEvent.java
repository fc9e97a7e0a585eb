package com.rebalancer.event;

import com.rebalancer.domain.model.ReconciliationReport;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every reconciliation of the ledger against the broker, before any
 * portfolio is planned.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>RebalanceMetricsService -- counts external sales and mismatches</li>
 * </ul>
 */
public class ReconciliationEvent extends ApplicationEvent {

    private final ReconciliationReport report;
    private final LocalDateTime reconciledAt;

    public ReconciliationEvent(Object source, ReconciliationReport report) {
        super(source);
        this.report = report;
        this.reconciledAt = LocalDateTime.now();
    }

    public ReconciliationReport getReport() {
        return report;
    }

    public LocalDateTime getReconciledAt() {
        return reconciledAt;
    }
}
