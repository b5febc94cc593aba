package com.liquidity.backend.service.resilience;

import com.liquidity.backend.exception.IndicatorFetchException;
import com.liquidity.backend.exception.RetriesExhaustedException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retries transient failures of external calls with exponential backoff. Only errors carrying a
 * retryable status (429, 500, 502, 503, 504) or an explicit retryable flag are retried; anything
 * else propagates after the first attempt.
 */
@Slf4j
public class RetryHandler {

    private static final Set<Integer> RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    private final String name;
    private final RetryPolicy policy;
    private final Retry retry;

    public RetryHandler(String name, RetryPolicy policy) {
        this.name = name;
        this.policy = policy;
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(policy.maxRetries() + 1)
                .intervalFunction(policy.toIntervalFunction())
                .retryOnException(RetryHandler::isRetryable)
                .build();
        this.retry = Retry.of(name, config);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying api={} attempt={} wait={}ms error={}",
                        name, event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : null));
    }

    public <T> T execute(String context, Callable<T> operation) {
        AtomicInteger attempts = new AtomicInteger();
        Callable<T> counted = () -> {
            attempts.incrementAndGet();
            return operation.call();
        };
        try {
            return Retry.decorateCallable(retry, counted).call();
        } catch (RuntimeException e) {
            if (isRetryable(e)) {
                throw new RetriesExhaustedException(context, attempts.get(), e);
            }
            throw e;
        } catch (Exception e) {
            if (isRetryable(e)) {
                throw new RetriesExhaustedException(context, attempts.get(), e);
            }
            throw new IllegalStateException(context + " failed: " + e.getMessage(), e);
        }
    }

    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof IndicatorFetchException fetchError) {
                return fetchError.isRetryable() || RETRYABLE_STATUSES.contains(fetchError.getStatusCode());
            }
            current = current.getCause();
        }
        return false;
    }

    public String getName() {
        return name;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
