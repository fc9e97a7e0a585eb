package com.rebalancer.event;

import com.rebalancer.domain.model.RunSummary;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per rebalance run, after every portfolio has been processed.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>NotificationService -- renders the summary and sends it to the enabled channels</li>
 *   <li>RebalanceMetricsService -- run, leg and failure counters</li>
 * </ul>
 */
public class RebalanceCompletedEvent extends ApplicationEvent {

    private final RunSummary summary;

    public RebalanceCompletedEvent(Object source, RunSummary summary) {
        super(source);
        this.summary = summary;
    }

    public RunSummary getSummary() {
        return summary;
    }
}
