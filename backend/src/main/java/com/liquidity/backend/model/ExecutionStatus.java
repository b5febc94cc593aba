package com.liquidity.backend.model;

public enum ExecutionStatus {
    SUCCESS,
    FAILED,
    SKIPPED
}
