package com.liquidity.backend.service.resilience;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Releases the waiting caller from the shared task scheduler and records the wait per API as
 * {@code rate_limit_wait}.
 */
@Component
@RequiredArgsConstructor
public class ScheduledRateLimitPause implements RateLimitPause {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    @Override
    public void pause(String api, Duration wait) {
        if (wait == null || wait.isZero() || wait.isNegative()) {
            return;
        }
        meterRegistry.timer("rate_limit_wait", "api", api).record(wait);
        CompletableFuture<Void> released = new CompletableFuture<>();
        taskScheduler.schedule(() -> released.complete(null), clock.instant().plus(wait));
        released.join();
    }
}
