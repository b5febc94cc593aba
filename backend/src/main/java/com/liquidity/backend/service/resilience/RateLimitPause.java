package com.liquidity.backend.service.resilience;

import java.time.Duration;

/**
 * Holds back a caller of an API whose rate limiter has no token left.
 */
@FunctionalInterface
public interface RateLimitPause {

    void pause(String api, Duration wait);
}
