package com.liquidity.backend.exception;

public class InsufficientDataException extends RuntimeException {
    private final String engineId;
    private final int available;
    private final int required;

    public InsufficientDataException(String engineId, int available, int required) {
        super("Engine " + engineId + " has " + available + " of " + required + " required indicators");
        this.engineId = engineId;
        this.available = available;
        this.required = required;
    }

    public String getEngineId() {
        return engineId;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
