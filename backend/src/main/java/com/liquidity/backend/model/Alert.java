package com.liquidity.backend.model;

import java.time.Instant;

public record Alert(Level level, String message, Instant timestamp) {

    public enum Level {
        INFO,
        WARNING,
        CRITICAL
    }
}
