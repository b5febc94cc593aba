package com.liquidity.backend.model;

import java.time.Instant;

/**
 * Cached representation of an engine output. {@code expiresAt} is the absolute instant after which
 * the entry is no longer served.
 */
public record BridgedData(String engineId, BridgeFormat format, Object payload, Instant timestamp, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
