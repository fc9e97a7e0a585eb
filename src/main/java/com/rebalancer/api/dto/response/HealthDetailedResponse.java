package com.rebalancer.api.dto.response;

import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Detailed health check response, returned by GET /api/health/detailed.
 */
@Getter
@Builder
public class HealthDetailedResponse {

    /** "UP" or "DEGRADED". */
    private final String status;

    private final Map<String, SubsystemHealth> subsystems;

    private final String persistenceMode;

    private final String schedulerMode;

    @Getter
    @Builder
    public static class SubsystemHealth {
        private final String status;
        private final String message;
    }
}
