package com.liquidity.backend.event;

import com.liquidity.backend.model.SystemHealthMetrics;

public record HealthEvent(Level level, SystemHealthMetrics health) {

    public enum Level {
        UPDATED,
        WARNING,
        CRITICAL
    }
}
