package com.liquidity.backend.service.orchestration;

import com.liquidity.backend.model.EngineCategory;

import java.util.List;

/**
 * Engines that may run concurrently: same category, all in-category dependencies already executed.
 */
public record ExecutionPhase(int number, EngineCategory category, List<String> engineIds) {

    public ExecutionPhase {
        engineIds = List.copyOf(engineIds);
    }
}
