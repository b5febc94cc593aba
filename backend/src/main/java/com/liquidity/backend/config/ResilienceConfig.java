package com.liquidity.backend.config;

import com.liquidity.backend.exception.InsufficientDataException;
import com.liquidity.backend.service.resilience.PriorityWorkQueue;
import com.liquidity.backend.service.resilience.RetryPolicy;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

@Configuration
public class ResilienceConfig {

    /**
     * Per-engine breakers: opens after {@code failureThreshold} consecutive failures and stays open for
     * {@code openSeconds}. Declining for lack of data is not a failure.
     */
    @Bean
    public CircuitBreakerRegistry engineCircuitBreakerRegistry(ResilienceProperties properties) {
        ResilienceProperties.EngineBreaker breaker = properties.getEngineBreaker();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(breaker.getFailureThreshold())
                .minimumNumberOfCalls(breaker.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(Duration.ofSeconds(breaker.getOpenSeconds()))
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreExceptions(InsufficientDataException.class)
                .build();
        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public PriorityWorkQueue priorityWorkQueue(ResilienceProperties properties,
                                               @Qualifier("feedExecutor") Executor feedExecutor,
                                               TaskScheduler taskScheduler,
                                               Clock clock,
                                               MeterRegistry meterRegistry) {
        PriorityWorkQueue queue = new PriorityWorkQueue(
                properties.getQueue().getConcurrentLimit(),
                RetryPolicy.from(properties.getQueue()),
                feedExecutor,
                taskScheduler,
                clock
        );
        Gauge.builder("work_queue_depth", queue, PriorityWorkQueue::getQueueDepth).register(meterRegistry);
        Gauge.builder("work_queue_active", queue, PriorityWorkQueue::getActiveRequests).register(meterRegistry);
        return queue;
    }
}
