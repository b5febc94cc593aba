package com.liquidity.backend.event;

import com.liquidity.backend.model.EngineExecution;

import java.util.List;
import java.util.Map;

public record PhaseEvent(Type type, int phaseNumber, List<String> engineIds, Map<String, EngineExecution> results) {

    public enum Type {
        STARTED,
        COMPLETED
    }
}
