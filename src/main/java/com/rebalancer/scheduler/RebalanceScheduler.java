package com.rebalancer.scheduler;

import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.SchedulerMode;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.engine.RebalanceEngine;
import com.rebalancer.exception.BaseException;
import com.rebalancer.exception.RebalanceInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Weekly timer trigger. Fires on {@code rebalancer.scheduler.cron} in
 * {@code rebalancer.scheduler.zone} (Monday 09:30 New York by default).
 *
 * <p>With {@code rebalancer.scheduler.mode=EXTERNAL} the timer does nothing and runs only
 * start from the webhook.
 */
@Component
public class RebalanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(RebalanceScheduler.class);

    static final String TRIGGER = "SCHEDULED";

    private final RebalanceEngine rebalanceEngine;
    private final RebalancerProperties rebalancerProperties;

    public RebalanceScheduler(RebalanceEngine rebalanceEngine, RebalancerProperties rebalancerProperties) {
        this.rebalanceEngine = rebalanceEngine;
        this.rebalancerProperties = rebalancerProperties;
    }

    @Scheduled(
            cron = "${rebalancer.scheduler.cron:0 30 9 * * MON}",
            zone = "${rebalancer.scheduler.zone:America/New_York}")
    public void scheduledRebalance() {
        if (rebalancerProperties.getScheduler().getMode() == SchedulerMode.EXTERNAL) {
            log.debug("Internal scheduler disabled, waiting for an external trigger");
            return;
        }
        try {
            RunSummary summary = rebalanceEngine.executeRebalance(TRIGGER);
            log.info("Scheduled rebalance {} done, failures={}", summary.getRunId(), summary.hasFailures());
        } catch (RebalanceInProgressException e) {
            log.warn("Scheduled rebalance skipped: {}", e.getMessage());
        } catch (BaseException e) {
            log.error("Scheduled rebalance failed: {}", e.getMessage(), e);
        }
    }
}
