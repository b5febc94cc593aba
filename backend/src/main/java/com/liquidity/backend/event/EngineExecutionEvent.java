package com.liquidity.backend.event;

import com.liquidity.backend.model.EngineReport;

import java.time.Duration;
import java.time.Instant;

/**
 * Emitted by the registry after every engine invocation. Exactly one of {@code report} and
 * {@code error} is set.
 */
public record EngineExecutionEvent(Type type, String engineId, EngineReport report, Throwable error,
                                   Duration duration, Instant occurredAt) {

    public enum Type {
        SUCCESS,
        ERROR
    }

    public static EngineExecutionEvent success(String engineId, EngineReport report, Duration duration, Instant now) {
        return new EngineExecutionEvent(Type.SUCCESS, engineId, report, null, duration, now);
    }

    public static EngineExecutionEvent error(String engineId, Throwable error, Duration duration, Instant now) {
        return new EngineExecutionEvent(Type.ERROR, engineId, null, error, duration, now);
    }
}
