package com.liquidity.backend.event;

import com.liquidity.backend.model.BridgedData;

import java.time.Instant;
import java.util.List;

/**
 * Data bridge notifications. {@code transformationId} is only set for transformation events,
 * {@code error} only for failures, {@code evicted} only for cache cleanup.
 */
public record BridgeEvent(Type type, String engineId, String transformationId, List<BridgedData> data,
                          Throwable error, int evicted, Instant occurredAt) {

    public enum Type {
        DATA_BRIDGED,
        ENGINE_ERROR,
        TRANSFORMATION_APPLIED,
        TRANSFORMATION_ERROR,
        CACHE_CLEANUP
    }

    public static BridgeEvent bridged(String engineId, List<BridgedData> data, Instant now) {
        return new BridgeEvent(Type.DATA_BRIDGED, engineId, null, List.copyOf(data), null, 0, now);
    }

    public static BridgeEvent engineError(String engineId, Throwable error, Instant now) {
        return new BridgeEvent(Type.ENGINE_ERROR, engineId, null, List.of(), error, 0, now);
    }

    public static BridgeEvent transformationApplied(String engineId, String transformationId, BridgedData data, Instant now) {
        return new BridgeEvent(Type.TRANSFORMATION_APPLIED, engineId, transformationId, List.of(data), null, 0, now);
    }

    public static BridgeEvent transformationFailed(String engineId, String transformationId, Throwable error, Instant now) {
        return new BridgeEvent(Type.TRANSFORMATION_ERROR, engineId, transformationId, List.of(), error, 0, now);
    }

    public static BridgeEvent cleanup(int evicted, Instant now) {
        return new BridgeEvent(Type.CACHE_CLEANUP, null, null, List.of(), null, evicted, now);
    }
}
