package com.liquidity.backend.exception;

public class DuplicateEngineException extends RuntimeException {
    public DuplicateEngineException(String engineId) {
        super("Engine " + engineId + " is already registered");
    }
}
