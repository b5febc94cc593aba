package com.liquidity.backend.service.bridge;

import com.liquidity.backend.model.BridgeFormat;
import com.liquidity.backend.model.EngineReport;

import java.util.Objects;
import java.util.function.Function;

/**
 * Derived view computed from every successful report of {@code sourceEngineId}. The output is cached
 * under the id {@code sourceEngineId:id}.
 */
public record DataTransformation(String id, String name, String sourceEngineId, BridgeFormat targetFormat,
                                 Function<EngineReport, Object> transform) {

    public DataTransformation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceEngineId, "sourceEngineId");
        Objects.requireNonNull(targetFormat, "targetFormat");
        Objects.requireNonNull(transform, "transform");
        name = name == null ? id : name;
    }

    public String cacheId() {
        return sourceEngineId + ":" + id;
    }
}
