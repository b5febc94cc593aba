package com.liquidity.backend.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of an engine's rolling execution record.
 *
 * @param successRate rolling score in [0, 100]
 */
public record PerformanceMetrics(
        String engineId,
        double successRate,
        double confidence,
        int errorCount,
        Instant lastExecution,
        Duration executionTime,
        Trend trend
) {
    public enum Trend {
        IMPROVING,
        STABLE,
        DEGRADING
    }

    public static PerformanceMetrics initial(String engineId, Instant now) {
        return new PerformanceMetrics(engineId, 100.0, 0.0, 0, now, Duration.ZERO, Trend.STABLE);
    }
}
