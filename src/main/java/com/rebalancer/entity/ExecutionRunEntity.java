package com.rebalancer.entity;

import com.rebalancer.domain.enums.RunStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** JPA entity for the execution_runs table. One row per portfolio per rebalance run. */
@Entity
@Table(name = "execution_runs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionRunEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "run_id", length = 36)
    private String runId;

    @Column(name = "portfolio_name", length = 100)
    private String portfolioName;

    @Column(name = "trigger_source", length = 20)
    private String trigger;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(20)")
    private RunStatus status;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "trades_planned")
    private int tradesPlanned;

    @Column(name = "trades_submitted")
    private int tradesSubmitted;

    @Column(name = "trades_failed")
    private int tradesFailed;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;
}
