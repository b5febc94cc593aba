package com.liquidity.backend.service.resilience;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Token bucket with a one minute refill interval. The bucket starts full; tokens accrue in
 * proportion to elapsed time and never exceed the burst size.
 */
@Slf4j
public class TokenBucketRateLimiter {

    private static final long REFILL_INTERVAL_MS = Duration.ofMinutes(1).toMillis();

    private final String name;
    private final int requestsPerMinute;
    private final int burstSize;
    private final Clock clock;
    private final RateLimitPause pause;

    // guarded by this
    private double tokens;
    private Instant lastRefill;

    public TokenBucketRateLimiter(String name, int requestsPerMinute, Clock clock, RateLimitPause pause) {
        this(name, requestsPerMinute, requestsPerMinute, clock, pause);
    }

    public TokenBucketRateLimiter(String name, int requestsPerMinute, int burstSize, Clock clock,
                                  RateLimitPause pause) {
        if (requestsPerMinute <= 0 || burstSize <= 0) {
            throw new IllegalArgumentException("requestsPerMinute and burstSize must be positive");
        }
        this.name = name;
        this.requestsPerMinute = requestsPerMinute;
        this.burstSize = burstSize;
        this.clock = clock;
        this.pause = pause;
        this.tokens = burstSize;
        this.lastRefill = clock.instant();
    }

    /**
     * Takes one token, suspending the caller until one is available.
     */
    public void waitForToken() {
        while (true) {
            long waitMillis;
            synchronized (this) {
                refill();
                if (tokens >= 1.0) {
                    tokens -= 1.0;
                    return;
                }
                waitMillis = millisUntilNextToken();
            }
            log.debug("Rate limit reached api={} waiting={}ms", name, waitMillis);
            pause.pause(name, Duration.ofMillis(waitMillis));
        }
    }

    /**
     * Takes a token only if one is available right now.
     */
    public synchronized boolean tryAcquire() {
        refill();
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    public synchronized RateLimiterStatus getStatus() {
        refill();
        return new RateLimiterStatus(tokens, requestsPerMinute, burstSize);
    }

    private void refill() {
        Instant now = clock.instant();
        long elapsed = Duration.between(lastRefill, now).toMillis();
        if (elapsed <= 0) {
            return;
        }
        if (elapsed >= REFILL_INTERVAL_MS) {
            tokens = burstSize;
        } else {
            double tokensToAdd = elapsed * (double) requestsPerMinute / REFILL_INTERVAL_MS;
            tokens = Math.min(burstSize, tokens + tokensToAdd);
        }
        lastRefill = now;
    }

    private long millisUntilNextToken() {
        double missing = 1.0 - tokens;
        return Math.max(1L, (long) Math.ceil(missing * REFILL_INTERVAL_MS / requestsPerMinute));
    }

    public String getName() {
        return name;
    }
}
