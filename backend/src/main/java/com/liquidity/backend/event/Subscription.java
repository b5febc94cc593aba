package com.liquidity.backend.event;

/**
 * Handle returned by every subscribe call. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
