package com.liquidity.backend.service.resilience;

import com.liquidity.backend.config.ResilienceProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryPolicyTest {

    @Test
    void delayGrowsExponentiallyUpToMax() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(1000), Duration.ofMillis(5000), 2.0);

        assertEquals(1000, policy.delayForAttempt(0).toMillis());
        assertEquals(2000, policy.delayForAttempt(1).toMillis());
        assertEquals(4000, policy.delayForAttempt(2).toMillis());
        assertEquals(5000, policy.delayForAttempt(3).toMillis());
        assertEquals(5000, policy.delayForAttempt(10).toMillis());
    }

    @Test
    void intervalFunctionCountsRetriesFromOne() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofMillis(1000), 3.0);

        assertEquals(100L, policy.toIntervalFunction().apply(1));
        assertEquals(300L, policy.toIntervalFunction().apply(2));
        assertEquals(900L, policy.toIntervalFunction().apply(3));
    }

    @Test
    void buildsFromApiPolicy() {
        ResilienceProperties properties = new ResilienceProperties();
        ResilienceProperties.ApiPolicy api = new ResilienceProperties.ApiPolicy();
        api.setMaxRetries(4);
        api.setInitialDelayMs(250L);
        properties.getApis().put("fred", api);

        RetryPolicy policy = RetryPolicy.from(properties.policyFor("fred"));

        assertEquals(4, policy.maxRetries());
        assertEquals(Duration.ofMillis(250), policy.initialDelay());
        assertEquals(Duration.ofMillis(30000), policy.maxDelay());
    }

    @Test
    void rejectsShrinkingBackoff() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(1), 0.5));
    }
}
