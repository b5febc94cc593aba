package com.liquidity.backend.service.resilience;

import com.liquidity.backend.util.MutableClock;
import com.liquidity.backend.util.RecordingRateLimitPause;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenBucketRateLimiterTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    private final RecordingRateLimitPause pause = new RecordingRateLimitPause(clock);

    @Test
    void requestsWithinBurstAreNotDelayed() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("fred", 120, clock, pause);

        for (int i = 0; i < 120; i++) {
            limiter.waitForToken();
        }

        assertThat(pause.getDelays()).isEmpty();
        assertThat(limiter.getStatus().tokens()).isLessThan(1.0);
    }

    @Test
    void requestsBeyondBurstWaitForRefill() {
        int rate = 60;
        int requests = 65;
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("finnhub", rate, clock, pause);

        for (int i = 0; i < requests; i++) {
            limiter.waitForToken();
        }

        long minimumWait = (long) (requests - rate) * 60_000L / rate;
        assertThat(pause.totalDelayMillis()).isGreaterThanOrEqualTo(minimumWait);
        assertThat(pause.getDelays()).hasSize(requests - rate);
    }

    @Test
    void tokensRefillProportionallyAndCapAtBurst() {
        TokenBucketRateLimiter limiter = new TokenBucketRateLimiter("coingecko", 30, 10, clock, pause);
        for (int i = 0; i < 10; i++) {
            assertThat(limiter.tryAcquire()).isTrue();
        }
        assertThat(limiter.tryAcquire()).isFalse();

        clock.advance(Duration.ofSeconds(4));
        assertThat(limiter.getStatus().tokens()).isEqualTo(2.0);

        clock.advance(Duration.ofMinutes(5));
        RateLimiterStatus status = limiter.getStatus();
        assertThat(status.tokens()).isEqualTo(10.0);
        assertThat(status.burstSize()).isEqualTo(10);
        assertThat(status.requestsPerMinute()).isEqualTo(30);
    }

    @Test
    void rejectsNonPositiveRate() {
        assertThatThrownBy(() -> new TokenBucketRateLimiter("bad", 0, clock, pause))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
