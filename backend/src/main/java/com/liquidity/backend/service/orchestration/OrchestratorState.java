package com.liquidity.backend.service.orchestration;

public enum OrchestratorState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
