package com.liquidity.backend.service.orchestration;

import com.liquidity.backend.model.EngineExecution;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.ExecutionStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one orchestrated run, keyed by engine id in execution order.
 */
public record OrchestrationResult(String runId, Map<String, EngineExecution> executions, List<PhaseResult> phases,
                                  Duration duration) {

    public OrchestrationResult {
        executions = Collections.unmodifiableMap(new LinkedHashMap<>(executions));
        phases = List.copyOf(phases);
    }

    public Map<String, EngineReport> successfulReports() {
        Map<String, EngineReport> reports = new LinkedHashMap<>();
        executions.forEach((engineId, execution) -> {
            if (execution.succeeded()) {
                reports.put(engineId, execution.report());
            }
        });
        return reports;
    }

    public long count(ExecutionStatus status) {
        return executions.values().stream().filter(execution -> execution.status() == status).count();
    }
}
