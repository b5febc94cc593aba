package com.liquidity.backend.service.resilience;

import com.liquidity.backend.config.ResilienceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One rate limiter and one retry handler per external API, created on first use from the static
 * per-API configuration. APIs without an entry share the default policy values.
 */
@Service
@Slf4j
public class ResilienceRegistry {

    private final ResilienceProperties properties;
    private final Clock clock;
    private final RateLimitPause pause;
    private final Map<String, TokenBucketRateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, RetryHandler> retryHandlers = new ConcurrentHashMap<>();

    public ResilienceRegistry(ResilienceProperties properties, Clock clock, RateLimitPause pause) {
        this.properties = properties;
        this.clock = clock;
        this.pause = pause;
    }

    public TokenBucketRateLimiter rateLimiter(String api) {
        return rateLimiters.computeIfAbsent(api, key -> {
            ResilienceProperties.ApiPolicy policy = properties.policyFor(key);
            log.info("Creating rate limiter api={} requestsPerMinute={} burst={}",
                    key, policy.getRequestsPerMinute(), policy.effectiveBurstSize());
            return new TokenBucketRateLimiter(key, policy.getRequestsPerMinute(), policy.effectiveBurstSize(),
                    clock, pause);
        });
    }

    public RetryHandler retryHandler(String api) {
        return retryHandlers.computeIfAbsent(api,
                key -> new RetryHandler(key, RetryPolicy.from(properties.policyFor(key))));
    }

    public Map<String, RateLimiterStatus> rateLimiterStatus() {
        Map<String, RateLimiterStatus> status = new ConcurrentHashMap<>();
        rateLimiters.forEach((api, limiter) -> status.put(api, limiter.getStatus()));
        return status;
    }
}
