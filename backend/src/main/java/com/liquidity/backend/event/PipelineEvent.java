package com.liquidity.backend.event;

import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.SystemHealthMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle notifications of the integrated pipeline. {@code results}, {@code health} and
 * {@code executionTime} are only set on completion, {@code error} only on failure.
 */
public record PipelineEvent(Type type, Map<String, EngineReport> results, SystemHealthMetrics health,
                            Duration executionTime, Throwable error, Instant occurredAt) {

    public enum Type {
        STARTED,
        COMPLETED,
        ERROR
    }

    public static PipelineEvent started(Instant now) {
        return new PipelineEvent(Type.STARTED, Map.of(), null, null, null, now);
    }

    public static PipelineEvent completed(Map<String, EngineReport> results, SystemHealthMetrics health,
                                          Duration executionTime, Instant now) {
        return new PipelineEvent(Type.COMPLETED, Map.copyOf(results), health, executionTime, null, now);
    }

    public static PipelineEvent failed(Throwable error, Instant now) {
        return new PipelineEvent(Type.ERROR, Map.of(), null, null, error, now);
    }
}
