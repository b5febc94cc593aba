package com.liquidity.backend.exception;

public class EngineNotFoundException extends RuntimeException {
    public EngineNotFoundException(String engineId) {
        super("Engine " + engineId + " not found");
    }
}
