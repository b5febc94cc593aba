package com.liquidity.backend.service.orchestration;

import com.liquidity.backend.model.EngineExecution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record PhaseResult(ExecutionPhase phase, Map<String, EngineExecution> executions) {

    public PhaseResult {
        executions = Collections.unmodifiableMap(new LinkedHashMap<>(executions));
    }
}
