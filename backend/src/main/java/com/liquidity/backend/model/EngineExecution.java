package com.liquidity.backend.model;

import java.time.Duration;

/**
 * Outcome of a single engine inside a pipeline run. {@code report} is only set on success,
 * {@code error} only when the engine failed or was skipped.
 */
public record EngineExecution(String engineId, ExecutionStatus status, EngineReport report, String error, Duration duration) {

    public static EngineExecution success(String engineId, EngineReport report, Duration duration) {
        return new EngineExecution(engineId, ExecutionStatus.SUCCESS, report, null, duration);
    }

    public static EngineExecution failed(String engineId, String error, Duration duration) {
        return new EngineExecution(engineId, ExecutionStatus.FAILED, null, error, duration);
    }

    public static EngineExecution skipped(String engineId, String reason, Duration duration) {
        return new EngineExecution(engineId, ExecutionStatus.SKIPPED, null, reason, duration);
    }

    public boolean succeeded() {
        return status == ExecutionStatus.SUCCESS;
    }
}
