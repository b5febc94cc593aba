package com.liquidity.backend.model;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate health of the signal pipeline. All scores are in [0, 1].
 */
public record SystemHealthMetrics(
        double overallHealth,
        double engineHealth,
        double dataFlowHealth,
        double integrationHealth,
        Instant lastHealthCheck,
        List<String> unhealthyComponents
) {
    public SystemHealthMetrics {
        unhealthyComponents = unhealthyComponents == null ? List.of() : List.copyOf(unhealthyComponents);
    }
}
