package com.rebalancer.api.controller;

import com.rebalancer.config.RebalancerProperties;
import com.rebalancer.domain.model.RunSummary;
import com.rebalancer.engine.RebalanceEngine;
import com.rebalancer.exception.UnauthorizedException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook trigger for rebalance runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/rebalance -- run now; {@code ?dryRun=true} plans without trading</li>
 *   <li>GET /api/rebalance/status -- whether a run is in progress</li>
 * </ul>
 *
 * <p>When {@code rebalancer.webhook.secret} is set the caller must send it in the
 * {@code X-Webhook-Secret} header. A trigger while a run is active answers 409.
 */
@RestController
@RequestMapping("/api/rebalance")
public class RebalanceController {

    private static final Logger log = LoggerFactory.getLogger(RebalanceController.class);

    static final String SECRET_HEADER = "X-Webhook-Secret";
    static final String TRIGGER = "WEBHOOK";

    private final RebalanceEngine rebalanceEngine;
    private final RebalancerProperties rebalancerProperties;

    public RebalanceController(RebalanceEngine rebalanceEngine, RebalancerProperties rebalancerProperties) {
        this.rebalanceEngine = rebalanceEngine;
        this.rebalancerProperties = rebalancerProperties;
    }

    @PostMapping
    public ResponseEntity<RunSummary> rebalance(
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestHeader(value = SECRET_HEADER, required = false) String secret) {
        checkSecret(secret);
        log.info("Rebalance requested via webhook, dryRun={}", dryRun);
        return ResponseEntity.ok(rebalanceEngine.executeRebalance(TRIGGER, dryRun));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("running", rebalanceEngine.isRunning());
        status.put("activeRunId", rebalanceEngine.getActiveRunId());
        return ResponseEntity.ok(status);
    }

    private void checkSecret(String provided) {
        String expected = rebalancerProperties.getWebhook().getSecret();
        if (expected == null || expected.isBlank()) {
            return;
        }
        if (provided == null
                || !MessageDigest.isEqual(
                        expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Missing or invalid " + SECRET_HEADER + " header");
        }
    }
}
