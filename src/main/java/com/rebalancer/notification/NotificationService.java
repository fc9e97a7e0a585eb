package com.rebalancer.notification;

import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.event.RebalanceCompletedEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Sends the summary of every finished rebalance run to each enabled channel.
 *
 * <p>Delivery runs on the {@code eventExecutor} pool so a slow SMTP server never holds up
 * the run. A channel that fails is logged and the remaining channels are still tried.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final List<RunSummaryNotifier> notifiers;
    private final NotificationTemplateEngine notificationTemplateEngine;

    public NotificationService(
            List<RunSummaryNotifier> notifiers, NotificationTemplateEngine notificationTemplateEngine) {
        this.notifiers = notifiers;
        this.notificationTemplateEngine = notificationTemplateEngine;
    }

    @Async("eventExecutor")
    @EventListener
    @Order(15)
    public void onRebalanceCompleted(RebalanceCompletedEvent event) {
        notify(event.getSummary());
    }

    public void notify(RunSummary summary) {
        List<RunSummaryNotifier> enabled =
                notifiers.stream().filter(RunSummaryNotifier::isEnabled).toList();
        if (enabled.isEmpty()) {
            log.debug("No notification channel enabled for run {}", summary.getRunId());
            return;
        }

        String subject = notificationTemplateEngine.renderSubject(summary);
        String body = notificationTemplateEngine.render(summary);

        for (RunSummaryNotifier notifier : enabled) {
            try {
                notifier.send(subject, body);
                log.info("Run {} summary sent via {}", summary.getRunId(), notifier.channel());
            } catch (Exception e) {
                log.error(
                        "Failed to send run {} summary via {}: {}",
                        summary.getRunId(),
                        notifier.channel(),
                        e.getMessage());
            }
        }
    }
}
