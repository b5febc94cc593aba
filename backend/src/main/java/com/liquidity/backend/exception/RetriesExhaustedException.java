package com.liquidity.backend.exception;

public class RetriesExhaustedException extends RuntimeException {
    private final int attempts;

    public RetriesExhaustedException(String context, int attempts, Throwable cause) {
        super(context + " failed after " + attempts + " attempts: " + cause.getMessage(), cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
