package com.liquidity.backend.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Output of one engine execution cycle. Instances are immutable once built.
 */
public record EngineReport(
        PrimaryMetric primaryMetric,
        Signal signal,
        double confidence,
        String analysis,
        Map<String, Object> subMetrics,
        List<Alert> alerts,
        Instant generatedAt
) {
    public EngineReport {
        confidence = Math.max(0.0, Math.min(100.0, confidence));
        subMetrics = subMetrics == null ? Map.of() : Map.copyOf(subMetrics);
        alerts = alerts == null ? List.of() : List.copyOf(alerts);
        analysis = analysis == null ? "" : analysis;
    }

    public boolean hasCriticalAlert() {
        return alerts.stream().anyMatch(alert -> alert.level() == Alert.Level.CRITICAL);
    }
}
