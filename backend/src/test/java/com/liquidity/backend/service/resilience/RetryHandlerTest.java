package com.liquidity.backend.service.resilience;

import com.liquidity.backend.exception.IndicatorFetchException;
import com.liquidity.backend.exception.RetriesExhaustedException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryHandlerTest {

    private final RetryHandler handler = new RetryHandler("fred",
            new RetryPolicy(2, Duration.ofMillis(1), Duration.ofMillis(5), 2.0));

    @Test
    void clientErrorIsAttemptedOnce() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> handler.execute("fred:WALCL", () -> {
            calls.incrementAndGet();
            throw new IndicatorFetchException("bad request", 400);
        })).isInstanceOf(IndicatorFetchException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void transientErrorIsRetriedUntilExhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> handler.execute("fred:WALCL", () -> {
            calls.incrementAndGet();
            throw new IndicatorFetchException("unavailable", 503);
        }))
                .isInstanceOf(RetriesExhaustedException.class)
                .satisfies(error -> assertThat(((RetriesExhaustedException) error).getAttempts()).isEqualTo(3))
                .hasCauseInstanceOf(IndicatorFetchException.class);

        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    void recoversAfterRateLimitResponse() {
        AtomicInteger calls = new AtomicInteger();

        String result = handler.execute("finnhub:VIX", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new IndicatorFetchException("too many requests", 429);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    void classifiesRetryableErrors() {
        assertThat(RetryHandler.isRetryable(new IndicatorFetchException("gateway", 502))).isTrue();
        assertThat(RetryHandler.isRetryable(new IndicatorFetchException("reset", true, null))).isTrue();
        assertThat(RetryHandler.isRetryable(new IllegalStateException("wrapped",
                new IndicatorFetchException("timeout", 504)))).isTrue();
        assertThat(RetryHandler.isRetryable(new IndicatorFetchException("not found", 404))).isFalse();
        assertThat(RetryHandler.isRetryable(new IllegalArgumentException("boom"))).isFalse();
    }

    @Test
    void checkedFailureIsWrapped() {
        assertThatThrownBy(() -> handler.execute("fred:WALCL", () -> {
            throw new IOException("disk");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
