package com.liquidity.backend.service.resilience;

import com.liquidity.backend.config.ResilienceProperties;
import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Exponential backoff shared by the retry handler and the work queue:
 * {@code delay(attempt) = min(initialDelay * backoffMultiplier^attempt, maxDelay)}, attempt counted from 0.
 */
public record RetryPolicy(int maxRetries, Duration initialDelay, Duration maxDelay, double backoffMultiplier) {

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
    }

    public static RetryPolicy from(ResilienceProperties.ApiPolicy policy) {
        return new RetryPolicy(
                policy.getMaxRetries(),
                Duration.ofMillis(policy.getInitialDelayMs()),
                Duration.ofMillis(policy.getMaxDelayMs()),
                policy.getBackoffMultiplier()
        );
    }

    public static RetryPolicy from(ResilienceProperties.Queue queue) {
        return new RetryPolicy(
                queue.getMaxRetries(),
                Duration.ofMillis(queue.getInitialDelayMs()),
                Duration.ofMillis(queue.getMaxDelayMs()),
                queue.getBackoffMultiplier()
        );
    }

    public Duration delayForAttempt(int attempt) {
        double millis = initialDelay.toMillis() * Math.pow(backoffMultiplier, Math.max(0, attempt));
        return Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
    }

    /**
     * resilience4j numbers retries from 1.
     */
    public IntervalFunction toIntervalFunction() {
        return numOfAttempts -> delayForAttempt(numOfAttempts - 1).toMillis();
    }
}
