package com.rebalancer.engine;

import com.rebalancer.domain.enums.RunStatus;
import com.rebalancer.domain.model.ExecutionRun;
import com.rebalancer.ledger.LedgerStore;
import java.time.LocalDateTime;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Keeps one {@link ExecutionRun} per portfolio per rebalance run: RUNNING when the
 * portfolio starts, then its final status with trade counts. Dry runs are tracked in
 * memory only.
 *
 * <p>A store failure here is logged and does not affect the run.
 */
@Component
public class ExecutionTracker {

    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final LedgerStore ledgerStore;

    public ExecutionTracker(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    public ExecutionRun start(String runId, String portfolioName, String trigger, boolean dryRun) {
        ExecutionRun run = ExecutionRun.builder()
                .id(UUID.randomUUID().toString())
                .runId(runId)
                .portfolioName(portfolioName)
                .trigger(trigger)
                .status(RunStatus.RUNNING)
                .startedAt(LocalDateTime.now())
                .build();
        save(run, dryRun);
        return run;
    }

    public ExecutionRun complete(
            ExecutionRun run,
            RunStatus status,
            int tradesPlanned,
            int tradesSubmitted,
            int tradesFailed,
            String errorMessage,
            boolean dryRun) {
        ExecutionRun completed = run.toBuilder()
                .status(status)
                .completedAt(LocalDateTime.now())
                .tradesPlanned(tradesPlanned)
                .tradesSubmitted(tradesSubmitted)
                .tradesFailed(tradesFailed)
                .errorMessage(errorMessage)
                .build();
        save(completed, dryRun);
        return completed;
    }

    private void save(ExecutionRun run, boolean dryRun) {
        if (dryRun) {
            return;
        }
        try {
            ledgerStore.saveExecutionRun(run);
        } catch (RuntimeException e) {
            log.warn(
                    "[{}] could not store execution run {} ({}): {}",
                    run.getPortfolioName(),
                    run.getRunId(),
                    run.getStatus(),
                    e.getMessage());
        }
    }
}
