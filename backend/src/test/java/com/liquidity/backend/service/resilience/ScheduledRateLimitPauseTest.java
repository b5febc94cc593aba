package com.liquidity.backend.service.resilience;

import com.liquidity.backend.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class ScheduledRateLimitPauseTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final TaskScheduler taskScheduler = mock(TaskScheduler.class);

    @Test
    void releasesCallerAtScheduledInstantAndRecordsWait() {
        doAnswer(invocation -> {
            Runnable release = invocation.getArgument(0);
            release.run();
            return null;
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        ScheduledRateLimitPause pause = new ScheduledRateLimitPause(taskScheduler, clock, meterRegistry);

        pause.pause("fred", Duration.ofMillis(500));

        verify(taskScheduler).schedule(any(Runnable.class), eq(clock.instant().plusMillis(500)));
        assertThat(meterRegistry.get("rate_limit_wait").tag("api", "fred").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(500.0);
    }

    @Test
    void zeroWaitReturnsImmediately() {
        ScheduledRateLimitPause pause = new ScheduledRateLimitPause(taskScheduler, clock, meterRegistry);

        pause.pause("fred", Duration.ZERO);

        verifyNoInteractions(taskScheduler);
        assertThat(meterRegistry.find("rate_limit_wait").timer()).isNull();
    }
}
