package com.liquidity.backend.model;

/**
 * Pipeline phases in execution order.
 */
public enum EngineCategory {
    FOUNDATION,
    CORE,
    SYNTHESIS,
    EXECUTION
}
