package com.rebalancer.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.enums.SchedulerMode;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.engine.RebalanceEngine;
import com.rebalancer.exception.ConfigurationException;
import com.rebalancer.exception.RebalanceInProgressException;
import com.rebalancer.scheduler.RebalanceScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RebalanceSchedulerTest {

    @Mock
    private RebalanceEngine rebalanceEngine;

    private RebalancerProperties properties;
    private RebalanceScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new RebalancerProperties();
        scheduler = new RebalanceScheduler(rebalanceEngine, properties);
    }

    @Test
    @DisplayName("Internal mode runs the engine with the SCHEDULED trigger")
    void runsInInternalMode() {
        when(rebalanceEngine.executeRebalance("SCHEDULED"))
                .thenReturn(RunSummary.builder().runId("run-1").build());

        scheduler.scheduledRebalance();

        verify(rebalanceEngine).executeRebalance("SCHEDULED");
    }

    @Test
    @DisplayName("External mode leaves triggering to the webhook")
    void idleInExternalMode() {
        properties.getScheduler().setMode(SchedulerMode.EXTERNAL);

        scheduler.scheduledRebalance();

        verifyNoInteractions(rebalanceEngine);
    }

    @Test
    @DisplayName("A run in progress or a failed run never escapes the timer thread")
    void swallowsRunFailures() {
        when(rebalanceEngine.executeRebalance("SCHEDULED"))
                .thenThrow(new RebalanceInProgressException("run-0"))
                .thenThrow(new ConfigurationException("no portfolios"));

        assertThatCode(scheduler::scheduledRebalance).doesNotThrowAnyException();
        assertThatCode(scheduler::scheduledRebalance).doesNotThrowAnyException();
    }
}
