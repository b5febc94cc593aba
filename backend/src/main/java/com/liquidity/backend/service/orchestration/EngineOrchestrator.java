package com.liquidity.backend.service.orchestration;

import com.liquidity.backend.config.OrchestratorProperties;
import com.liquidity.backend.config.ResilienceProperties;
import com.liquidity.backend.event.EventChannel;
import com.liquidity.backend.event.PhaseEvent;
import com.liquidity.backend.event.Subscription;
import com.liquidity.backend.exception.CircularDependencyException;
import com.liquidity.backend.exception.InsufficientDataException;
import com.liquidity.backend.exception.PipelineAlreadyRunningException;
import com.liquidity.backend.model.EngineCategory;
import com.liquidity.backend.model.EngineExecution;
import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.service.engine.DataInjectable;
import com.liquidity.backend.service.engine.EngineRegistry;
import com.liquidity.backend.service.engine.SignalEngine;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Runs every registered engine once, phase by phase. Engines inside a phase run concurrently up to the
 * configured limit; a failed engine is recorded and never stops its phase-mates or later phases.
 */
@Service
@Slf4j
public class EngineOrchestrator {

    private static final String RUN_ID_KEY = "pipelineRunId";

    private final EngineRegistry registry;
    private final OrchestratorProperties properties;
    private final ResilienceProperties resilienceProperties;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final Executor engineExecutor;
    private final Clock clock;
    private final AtomicReference<OrchestratorState> state = new AtomicReference<>(OrchestratorState.IDLE);
    private final EventChannel<PhaseEvent> phaseEvents = new EventChannel<>("orchestrator-phase");
    private volatile int currentPhase;

    public EngineOrchestrator(EngineRegistry registry,
                              OrchestratorProperties properties,
                              ResilienceProperties resilienceProperties,
                              CircuitBreakerRegistry circuitBreakerRegistry,
                              @Qualifier("engineExecutor") Executor engineExecutor,
                              Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.resilienceProperties = resilienceProperties;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.engineExecutor = engineExecutor;
        this.clock = clock;
    }

    /**
     * Orders engines by category, then by declared dependencies inside a category. Dependencies on
     * unknown engines are ignored.
     *
     * @throws CircularDependencyException when engines of one category depend on each other in a cycle
     */
    public ExecutionPlan createExecutionPlan() {
        List<EngineMetadata> all = registry.getAllMetadata();
        Map<String, EngineCategory> categories = new LinkedHashMap<>();
        all.forEach(metadata -> categories.put(metadata.id(), metadata.category()));
        for (EngineMetadata metadata : all) {
            for (String dependency : metadata.dependencies()) {
                EngineCategory dependencyCategory = categories.get(dependency);
                if (dependencyCategory == null) {
                    log.warn("Ignoring unknown dependency engineId={} dependency={}", metadata.id(), dependency);
                } else if (dependencyCategory.compareTo(metadata.category()) > 0) {
                    log.warn("Dependency runs in a later phase engineId={} dependency={}", metadata.id(), dependency);
                }
            }
        }

        List<ExecutionPhase> phases = new ArrayList<>();
        for (EngineCategory category : EngineCategory.values()) {
            Map<String, EngineMetadata> members = new LinkedHashMap<>();
            all.stream()
                    .filter(metadata -> metadata.category() == category)
                    .forEach(metadata -> members.put(metadata.id(), metadata));
            Set<String> remaining = new LinkedHashSet<>(members.keySet());
            Set<String> placed = new HashSet<>();
            while (!remaining.isEmpty()) {
                List<String> layer = remaining.stream()
                        .filter(id -> members.get(id).dependencies().stream()
                                .filter(members::containsKey)
                                .allMatch(placed::contains))
                        .toList();
                if (layer.isEmpty()) {
                    throw new CircularDependencyException(remaining);
                }
                phases.add(new ExecutionPhase(phases.size() + 1, category, layer));
                placed.addAll(layer);
                layer.forEach(remaining::remove);
            }
        }
        return new ExecutionPlan(phases);
    }

    /**
     * Executes the full plan.
     *
     * @throws PipelineAlreadyRunningException when a run is already in progress
     */
    public OrchestrationResult executeAll() {
        beginRun();
        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        MDC.put(RUN_ID_KEY, runId);
        try {
            ExecutionPlan plan = createExecutionPlan();
            log.info("Starting engine run phases={} engines={}", plan.phases().size(), plan.engineCount());
            Map<String, EngineExecution> executions = new LinkedHashMap<>();
            List<PhaseResult> phaseResults = new ArrayList<>();
            for (ExecutionPhase phase : plan.phases()) {
                PhaseResult phaseResult = executePhase(phase, runId, executions);
                executions.putAll(phaseResult.executions());
                phaseResults.add(phaseResult);
            }
            Duration duration = Duration.between(startedAt, clock.instant());
            state.set(OrchestratorState.COMPLETED);
            log.info("Engine run completed engines={} duration={}ms", executions.size(), duration.toMillis());
            return new OrchestrationResult(runId, executions, phaseResults, duration);
        } catch (RuntimeException e) {
            state.set(OrchestratorState.FAILED);
            log.error("Engine run failed", e);
            throw e;
        } finally {
            currentPhase = 0;
            MDC.remove(RUN_ID_KEY);
        }
    }

    public OrchestratorState getState() {
        return state.get();
    }

    /**
     * @return number of the phase being executed, 0 when no run is in progress
     */
    public int getCurrentPhase() {
        return currentPhase;
    }

    public boolean isRunning() {
        return state.get() == OrchestratorState.RUNNING;
    }

    public Subscription onPhase(Consumer<? super PhaseEvent> listener) {
        return phaseEvents.subscribe(listener);
    }

    private void beginRun() {
        while (true) {
            OrchestratorState current = state.get();
            if (current == OrchestratorState.RUNNING) {
                throw new PipelineAlreadyRunningException();
            }
            if (state.compareAndSet(current, OrchestratorState.RUNNING)) {
                return;
            }
        }
    }

    private PhaseResult executePhase(ExecutionPhase phase, String runId, Map<String, EngineExecution> completed) {
        currentPhase = phase.number();
        log.info("Phase started phase={} category={} engines={}", phase.number(), phase.category(), phase.engineIds());
        phaseEvents.publish(new PhaseEvent(PhaseEvent.Type.STARTED, phase.number(), phase.engineIds(), Map.of()));

        Semaphore permits = new Semaphore(properties.getMaxConcurrentEngines());
        Map<String, CompletableFuture<EngineExecution>> futures = new LinkedHashMap<>();
        for (String engineId : phase.engineIds()) {
            permits.acquireUninterruptibly();
            Map<String, EngineReport> dependencyReports = dependencyReports(engineId, completed);
            try {
                CompletableFuture<EngineExecution> future = CompletableFuture
                        .supplyAsync(withRunId(runId, () -> runEngine(engineId, dependencyReports)), engineExecutor)
                        .whenComplete((execution, error) -> permits.release());
                futures.put(engineId, future);
            } catch (RejectedExecutionException e) {
                permits.release();
                log.error("Engine rejected by executor engineId={}", engineId, e);
                futures.put(engineId, CompletableFuture.completedFuture(
                        EngineExecution.failed(engineId, "Executor rejected engine: " + e.getMessage(), Duration.ZERO)));
            }
        }

        Map<String, EngineExecution> results = new LinkedHashMap<>();
        futures.forEach((engineId, future) -> results.put(engineId, future.join()));
        phaseEvents.publish(new PhaseEvent(PhaseEvent.Type.COMPLETED, phase.number(), phase.engineIds(), results));
        log.info("Phase completed phase={} succeeded={} of {}", phase.number(),
                results.values().stream().filter(EngineExecution::succeeded).count(), results.size());
        return new PhaseResult(phase, results);
    }

    private Map<String, EngineReport> dependencyReports(String engineId, Map<String, EngineExecution> completed) {
        Map<String, EngineReport> reports = new LinkedHashMap<>();
        registry.getMetadata(engineId).ifPresent(metadata -> {
            for (String dependency : metadata.dependencies()) {
                EngineExecution execution = completed.get(dependency);
                if (execution != null && execution.succeeded()) {
                    reports.put(dependency, execution.report());
                }
            }
        });
        return reports;
    }

    /**
     * Never throws: every outcome becomes an {@link EngineExecution}.
     */
    private EngineExecution runEngine(String engineId, Map<String, EngineReport> dependencyReports) {
        Instant startedAt = clock.instant();
        try {
            SignalEngine engine = registry.getEngine(engineId).orElse(null);
            if (engine instanceof DataInjectable injectable) {
                injectable.injectData(dependencyReports);
            }
            Supplier<EngineReport> call = () -> registry.executeEngine(engineId);
            if (resilienceProperties.getEngineBreaker().isEnabled()) {
                CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(engineId);
                call = CircuitBreaker.decorateSupplier(breaker, call);
            }
            EngineReport report = call.get();
            return EngineExecution.success(engineId, report, elapsedSince(startedAt));
        } catch (InsufficientDataException e) {
            return EngineExecution.skipped(engineId, e.getMessage(), elapsedSince(startedAt));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open, engine not invoked engineId={}", engineId);
            return EngineExecution.failed(engineId, "Circuit open: " + e.getMessage(), elapsedSince(startedAt));
        } catch (RuntimeException e) {
            log.error("Engine failed engineId={} error={}", engineId, e.getMessage());
            return EngineExecution.failed(engineId, e.getMessage(), elapsedSince(startedAt));
        }
    }

    private Duration elapsedSince(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    private static <T> Supplier<T> withRunId(String runId, Supplier<T> task) {
        return () -> {
            MDC.put(RUN_ID_KEY, runId);
            try {
                return task.get();
            } finally {
                MDC.remove(RUN_ID_KEY);
            }
        };
    }
}
