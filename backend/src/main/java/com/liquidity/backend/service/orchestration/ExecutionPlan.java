package com.liquidity.backend.service.orchestration;

import java.util.List;

public record ExecutionPlan(List<ExecutionPhase> phases) {

    public ExecutionPlan {
        phases = List.copyOf(phases);
    }

    public int engineCount() {
        return phases.stream().mapToInt(phase -> phase.engineIds().size()).sum();
    }

    public boolean isEmpty() {
        return phases.isEmpty();
    }
}
