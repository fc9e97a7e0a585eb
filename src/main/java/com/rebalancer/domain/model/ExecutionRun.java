package com.rebalancer.domain.model;

import com.rebalancer.domain.enums.RunStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/** Execution history of one portfolio within one rebalance run. */
@Data
@Builder(toBuilder = true)
public class ExecutionRun {

    private String id;
    private String runId;
    private String portfolioName;
    private String trigger;
    private RunStatus status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private int tradesPlanned;
    private int tradesSubmitted;
    private int tradesFailed;
    private String errorMessage;
}
