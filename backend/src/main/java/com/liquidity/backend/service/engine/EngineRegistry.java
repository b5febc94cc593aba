package com.liquidity.backend.service.engine;

import com.liquidity.backend.event.EngineExecutionEvent;
import com.liquidity.backend.event.EventChannel;
import com.liquidity.backend.event.Subscription;
import com.liquidity.backend.exception.DuplicateEngineException;
import com.liquidity.backend.exception.EngineNotFoundException;
import com.liquidity.backend.exception.InsufficientDataException;
import com.liquidity.backend.model.EngineCategory;
import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.service.marketdata.MarketDataGateway;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Catalog of signal engines. Executing an engine pulls its indicators from the gateway, validates and
 * calculates, and announces the outcome on the execution channel.
 */
@Service
@Slf4j
public class EngineRegistry {

    private static final Comparator<EngineMetadata> PLAN_ORDER = Comparator
            .comparing(EngineMetadata::category)
            .thenComparing(EngineMetadata::priority, Comparator.reverseOrder())
            .thenComparing(EngineMetadata::id);

    private final MarketDataGateway marketDataGateway;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Map<String, RegisteredEngine> engines = new LinkedHashMap<>();
    private final Map<String, Set<String>> interestTable = new ConcurrentHashMap<>();
    private final Map<String, EngineReport> lastReports = new ConcurrentHashMap<>();
    private final EventChannel<EngineExecutionEvent> executionEvents = new EventChannel<>("engine-execution");

    public EngineRegistry(MarketDataGateway marketDataGateway, MeterRegistry meterRegistry, Clock clock) {
        this.marketDataGateway = marketDataGateway;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public void register(SignalEngine engine) {
        register(engine, engine.metadata());
    }

    public synchronized void register(SignalEngine engine, EngineMetadata metadata) {
        if (engines.containsKey(metadata.id())) {
            throw new DuplicateEngineException(metadata.id());
        }
        engines.put(metadata.id(), new RegisteredEngine(engine, metadata));
        for (String indicator : engine.requiredIndicators()) {
            interestTable.computeIfAbsent(indicator, key -> ConcurrentHashMap.newKeySet()).add(metadata.id());
        }
        log.info("Registered engine engineId={} category={} priority={} dependencies={}",
                metadata.id(), metadata.category(), metadata.priority(), metadata.dependencies());
    }

    public synchronized boolean unregister(String engineId) {
        RegisteredEngine removed = engines.remove(engineId);
        if (removed == null) {
            return false;
        }
        interestTable.values().forEach(ids -> ids.remove(engineId));
        interestTable.values().removeIf(Set::isEmpty);
        lastReports.remove(engineId);
        log.info("Unregistered engine engineId={}", engineId);
        return true;
    }

    public synchronized Optional<SignalEngine> getEngine(String engineId) {
        RegisteredEngine registered = engines.get(engineId);
        return registered == null ? Optional.empty() : Optional.of(registered.engine());
    }

    public synchronized Optional<EngineMetadata> getMetadata(String engineId) {
        RegisteredEngine registered = engines.get(engineId);
        return registered == null ? Optional.empty() : Optional.of(registered.metadata());
    }

    public synchronized List<EngineMetadata> getAllMetadata() {
        return engines.values().stream()
                .map(RegisteredEngine::metadata)
                .sorted(PLAN_ORDER)
                .toList();
    }

    public synchronized List<EngineMetadata> getEnginesByCategory(EngineCategory category) {
        return engines.values().stream()
                .map(RegisteredEngine::metadata)
                .filter(metadata -> metadata.category() == category)
                .sorted(PLAN_ORDER)
                .toList();
    }

    /**
     * Engines that declared {@code indicator} among their required indicators.
     */
    public Set<String> enginesInterestedIn(String indicator) {
        Set<String> ids = interestTable.get(indicator);
        return ids == null ? Set.of() : Set.copyOf(ids);
    }

    public Optional<EngineReport> getLastReport(String engineId) {
        return Optional.ofNullable(lastReports.get(engineId));
    }

    public Subscription onExecution(Consumer<? super EngineExecutionEvent> listener) {
        return executionEvents.subscribe(listener);
    }

    /**
     * Runs one calculation cycle.
     *
     * @throws EngineNotFoundException when no engine is registered under {@code engineId}
     * @throws InsufficientDataException when the engine declines the available indicators
     */
    public EngineReport executeEngine(String engineId) {
        RegisteredEngine registered;
        synchronized (this) {
            registered = engines.get(engineId);
        }
        if (registered == null) {
            throw new EngineNotFoundException(engineId);
        }
        SignalEngine engine = registered.engine();
        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "error";
        try {
            Map<String, IndicatorSample> samples =
                    marketDataGateway.fetch(engine.requiredIndicators(), registered.metadata().priority());
            if (!engine.validateData(samples)) {
                status = "skipped";
                throw new InsufficientDataException(engineId, samples.size(), engine.requiredIndicators().size());
            }
            EngineReport report = engine.calculate(samples);
            lastReports.put(engineId, report);
            status = "success";
            executionEvents.publish(EngineExecutionEvent.success(engineId, report, elapsedSince(startedAt), clock.instant()));
            return report;
        } catch (RuntimeException e) {
            if (e instanceof InsufficientDataException) {
                log.info("Engine declined cycle engineId={} reason={}", engineId, e.getMessage());
            } else {
                log.error("Engine execution failed engineId={}", engineId, e);
            }
            executionEvents.publish(EngineExecutionEvent.error(engineId, e, elapsedSince(startedAt), clock.instant()));
            throw e;
        } finally {
            sample.stop(Timer.builder("engine_execution_latency")
                    .tag("engine", engineId)
                    .tag("status", status)
                    .register(meterRegistry));
        }
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    private record RegisteredEngine(SignalEngine engine, EngineMetadata metadata) {}
}
