package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.EngineReport;

import java.util.Map;

/**
 * Engines that consume the reports of the engines they declare as dependencies. The orchestrator
 * hands over only successful reports, keyed by engine id, right before the engine runs.
 */
public interface DataInjectable {

    void injectData(Map<String, EngineReport> dependencyReports);
}
