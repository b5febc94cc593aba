package com.liquidity.backend.model;

import java.util.Objects;
import java.util.Set;

/**
 * Static registration record of an engine. Dependencies are advisory and only consulted when the
 * orchestrator builds its execution plan.
 *
 * @param pillar analytical pillar (1-3) the engine belongs to
 */
public record EngineMetadata(
        String id,
        String name,
        int pillar,
        int priority,
        EngineCategory category,
        Set<String> dependencies
) {
    public EngineMetadata {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        name = name == null ? id : name;
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }
}
