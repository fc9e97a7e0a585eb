package com.rebalancer.api.controller;

import com.rebalancer.api.dto.response.HealthDetailedResponse;
import com.rebalancer.broker.BrokerGateway;
import com.rebalancer.concurrent.TimedCallExecutor;
import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.engine.RebalanceEngine;
import com.rebalancer.exception.BaseException;
import com.rebalancer.ledger.LedgerStore;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health check endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/health -- shallow check, 200 whenever the application responds</li>
 *   <li>GET /api/health/detailed -- ledger store, broker and engine state</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final LedgerStore ledgerStore;
    private final BrokerGateway brokerGateway;
    private final TimedCallExecutor brokerCallExecutor;
    private final RebalanceEngine rebalanceEngine;
    private final RebalancerProperties rebalancerProperties;

    public HealthController(
            LedgerStore ledgerStore,
            BrokerGateway brokerGateway,
            TimedCallExecutor brokerCallExecutor,
            RebalanceEngine rebalanceEngine,
            RebalancerProperties rebalancerProperties) {
        this.ledgerStore = ledgerStore;
        this.brokerGateway = brokerGateway;
        this.brokerCallExecutor = brokerCallExecutor;
        this.rebalanceEngine = rebalanceEngine;
        this.rebalancerProperties = rebalancerProperties;
    }

    @GetMapping
    public ResponseEntity<Map<String, String>> shallowHealth() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthDetailedResponse> detailedHealth() {
        Map<String, HealthDetailedResponse.SubsystemHealth> subsystems = new LinkedHashMap<>();

        try {
            int records = ledgerStore.findAllOwnership().size();
            subsystems.put("ledgerStore", health("UP", records + " ownership record(s)"));
        } catch (BaseException e) {
            subsystems.put("ledgerStore", health("DOWN", e.getMessage()));
        }

        try {
            Map<String, BigDecimal> positions = brokerCallExecutor.call("getPositions", brokerGateway::getPositions);
            subsystems.put("broker", health("UP", positions.size() + " position(s)"));
        } catch (BaseException e) {
            subsystems.put("broker", health("DOWN", e.getMessage()));
        }

        String engineState =
                rebalanceEngine.isRunning() ? "Run " + rebalanceEngine.getActiveRunId() + " in progress" : "Idle";
        subsystems.put("engine", health("UP", engineState));

        boolean anyDown = subsystems.values().stream().anyMatch(s -> "DOWN".equals(s.getStatus()));

        return ResponseEntity.ok(HealthDetailedResponse.builder()
                .status(anyDown ? "DEGRADED" : "UP")
                .subsystems(subsystems)
                .persistenceMode(rebalancerProperties.getPersistence().getMode().name())
                .schedulerMode(rebalancerProperties.getScheduler().getMode().name())
                .build());
    }

    private static HealthDetailedResponse.SubsystemHealth health(String status, String message) {
        return HealthDetailedResponse.SubsystemHealth.builder()
                .status(status)
                .message(message)
                .build();
    }
}
