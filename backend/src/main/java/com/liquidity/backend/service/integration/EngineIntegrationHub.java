package com.liquidity.backend.service.integration;

import com.liquidity.backend.config.IntegrationProperties;
import com.liquidity.backend.event.DataIntegrationEvent;
import com.liquidity.backend.event.EventChannel;
import com.liquidity.backend.event.HealthEvent;
import com.liquidity.backend.event.PipelineEvent;
import com.liquidity.backend.event.Subscription;
import com.liquidity.backend.exception.InsufficientDataException;
import com.liquidity.backend.exception.PipelineAlreadyRunningException;
import com.liquidity.backend.model.EngineExecution;
import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.model.PerformanceMetrics;
import com.liquidity.backend.model.SystemHealthMetrics;
import com.liquidity.backend.service.ScheduledTaskGuard;
import com.liquidity.backend.service.bridge.EngineDataBridge;
import com.liquidity.backend.service.engine.EngineRegistry;
import com.liquidity.backend.service.engine.SignalEngine;
import com.liquidity.backend.service.marketdata.MarketDataGateway;
import com.liquidity.backend.service.orchestration.EngineOrchestrator;
import com.liquidity.backend.service.orchestration.OrchestrationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Front door of the signal pipeline: runs the orchestrator, keeps per-engine performance records,
 * admits pushed indicator samples and reports system health on a fixed interval.
 */
@Service
@Slf4j
public class EngineIntegrationHub implements SmartLifecycle {

    static final double SUCCESS_STEP = 1.0;
    static final double FAILURE_STEP = 5.0;
    static final double IMPROVING_ABOVE = 90.0;
    static final double DEGRADING_BELOW = 70.0;

    private final EngineRegistry registry;
    private final EngineOrchestrator orchestrator;
    private final EngineDataBridge dataBridge;
    private final MarketDataGateway marketDataGateway;
    private final DataQualityScorer qualityScorer;
    private final IntegrationProperties properties;
    private final TaskScheduler taskScheduler;
    private final ScheduledTaskGuard taskGuard;
    private final Executor engineExecutor;
    private final Clock clock;

    private final Map<String, PerformanceMetrics> metrics = new ConcurrentHashMap<>();
    private final AtomicLong pipelineRuns = new AtomicLong();
    private final AtomicLong pipelineFailures = new AtomicLong();
    private final EventChannel<PipelineEvent> pipelineEvents = new EventChannel<>("pipeline");
    private final EventChannel<HealthEvent> healthEvents = new EventChannel<>("system-health");
    private final EventChannel<DataIntegrationEvent> dataEvents = new EventChannel<>("data-integration");
    private volatile ScheduledFuture<?> healthCheckTask;

    public EngineIntegrationHub(EngineRegistry registry,
                                EngineOrchestrator orchestrator,
                                EngineDataBridge dataBridge,
                                MarketDataGateway marketDataGateway,
                                DataQualityScorer qualityScorer,
                                IntegrationProperties properties,
                                TaskScheduler taskScheduler,
                                ScheduledTaskGuard taskGuard,
                                @Qualifier("engineExecutor") Executor engineExecutor,
                                Clock clock) {
        this.registry = registry;
        this.orchestrator = orchestrator;
        this.dataBridge = dataBridge;
        this.marketDataGateway = marketDataGateway;
        this.qualityScorer = qualityScorer;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.taskGuard = taskGuard;
        this.engineExecutor = engineExecutor;
        this.clock = clock;
    }

    public void registerEngine(SignalEngine engine, EngineMetadata metadata) {
        registry.register(engine, metadata);
        metrics.put(metadata.id(), PerformanceMetrics.initial(metadata.id(), clock.instant()));
    }

    /**
     * Runs every engine once and folds the outcomes into the performance records.
     *
     * @return successful reports keyed by engine id
     * @throws PipelineAlreadyRunningException when a run is already in progress
     */
    public Map<String, EngineReport> executeIntegratedPipeline() {
        Instant startedAt = clock.instant();
        pipelineEvents.publish(PipelineEvent.started(startedAt));
        OrchestrationResult result;
        try {
            result = orchestrator.executeAll();
        } catch (PipelineAlreadyRunningException e) {
            pipelineEvents.publish(PipelineEvent.failed(e, clock.instant()));
            throw e;
        } catch (RuntimeException e) {
            pipelineRuns.incrementAndGet();
            pipelineFailures.incrementAndGet();
            log.error("❌ Integrated pipeline failed", e);
            pipelineEvents.publish(PipelineEvent.failed(e, clock.instant()));
            throw e;
        }
        pipelineRuns.incrementAndGet();
        result.executions().values().forEach(this::recordExecution);
        Map<String, EngineReport> reports = result.successfulReports();
        SystemHealthMetrics health = getSystemHealth();
        Duration executionTime = Duration.between(startedAt, clock.instant());
        log.info("Integrated pipeline completed reports={} of {} health={} duration={}ms",
                reports.size(), result.executions().size(), health.overallHealth(), executionTime.toMillis());
        pipelineEvents.publish(PipelineEvent.completed(reports, health, executionTime, clock.instant()));
        return reports;
    }

    /**
     * Admits a pushed sample. Samples scoring below the validation threshold are rejected with a quality
     * warning; accepted samples are handed to the gateway and, when cascading is on, re-run every engine
     * interested in the indicator.
     */
    public DataIntegrationEvent integrateRealtimeData(IndicatorSample sample) {
        double quality = qualityScorer.score(sample);
        if (quality < properties.getValidationThreshold()) {
            log.warn("Rejected indicator sample symbol={} quality={}", sample.symbol(), quality);
            DataIntegrationEvent warning = new DataIntegrationEvent(
                    DataIntegrationEvent.Type.QUALITY_WARNING, sample, quality, List.of());
            dataEvents.publish(warning);
            return warning;
        }
        marketDataGateway.publish(sample);
        List<String> affected = registry.enginesInterestedIn(sample.symbol()).stream().sorted().toList();
        DataIntegrationEvent integrated = new DataIntegrationEvent(
                DataIntegrationEvent.Type.INTEGRATED, sample, quality, affected);
        dataEvents.publish(integrated);
        if (properties.isEnableCascading()) {
            affected.forEach(this::cascade);
        }
        return integrated;
    }

    public SystemHealthMetrics getSystemHealth() {
        double engineHealth = metrics.values().stream()
                .mapToDouble(PerformanceMetrics::successRate)
                .average()
                .orElse(100.0) / 100.0;
        double dataFlowHealth = dataBridge.getStatistics().transformationSuccessRate();
        long runs = pipelineRuns.get();
        double integrationHealth = runs == 0 ? 1.0 : (double) (runs - pipelineFailures.get()) / runs;
        double overall = (engineHealth + dataFlowHealth + integrationHealth) / 3.0;

        List<String> unhealthy = new ArrayList<>();
        double threshold = properties.getWarningThreshold();
        if (engineHealth < threshold) {
            unhealthy.add("engines");
        }
        if (dataFlowHealth < threshold) {
            unhealthy.add("dataFlow");
        }
        if (integrationHealth < threshold) {
            unhealthy.add("integration");
        }
        new TreeMap<>(metrics).forEach((engineId, engineMetrics) -> {
            if (engineMetrics.successRate() < threshold * 100.0) {
                unhealthy.add("engine:" + engineId);
            }
        });
        return new SystemHealthMetrics(overall, engineHealth, dataFlowHealth, integrationHealth,
                clock.instant(), unhealthy);
    }

    public SystemHealthMetrics performHealthCheck() {
        SystemHealthMetrics health = getSystemHealth();
        healthEvents.publish(new HealthEvent(HealthEvent.Level.UPDATED, health));
        if (health.overallHealth() < properties.getCriticalThreshold()) {
            log.error("🚨 System health critical overall={} unhealthy={}", health.overallHealth(), health.unhealthyComponents());
            healthEvents.publish(new HealthEvent(HealthEvent.Level.CRITICAL, health));
        } else if (health.overallHealth() < properties.getWarningThreshold()) {
            log.warn("⚠️ System health degraded overall={} unhealthy={}", health.overallHealth(), health.unhealthyComponents());
            healthEvents.publish(new HealthEvent(HealthEvent.Level.WARNING, health));
        }
        return health;
    }

    public Map<String, PerformanceMetrics> getEnginePerformanceMetrics() {
        return Map.copyOf(metrics);
    }

    public void resetMetrics(String engineId) {
        metrics.computeIfPresent(engineId, (id, current) -> PerformanceMetrics.initial(id, clock.instant()));
        log.info("Performance metrics reset engineId={}", engineId);
    }

    public void resetMetrics() {
        metrics.replaceAll((id, current) -> PerformanceMetrics.initial(id, clock.instant()));
        pipelineRuns.set(0);
        pipelineFailures.set(0);
        log.info("All performance metrics reset");
    }

    public Subscription onPipeline(Consumer<? super PipelineEvent> listener) {
        return pipelineEvents.subscribe(listener);
    }

    public Subscription onHealth(Consumer<? super HealthEvent> listener) {
        return healthEvents.subscribe(listener);
    }

    public Subscription onDataIntegration(Consumer<? super DataIntegrationEvent> listener) {
        return dataEvents.subscribe(listener);
    }

    @Override
    public void start() {
        if (healthCheckTask != null) {
            return;
        }
        Duration interval = properties.getHealthCheckInterval();
        healthCheckTask = taskScheduler.scheduleAtFixedRate(
                () -> taskGuard.run("system-health-check", this::performHealthCheck),
                clock.instant().plus(interval),
                interval);
        log.info("System health check scheduled interval={}", interval);
    }

    @Override
    public void stop() {
        ScheduledFuture<?> task = healthCheckTask;
        if (task != null) {
            task.cancel(false);
            healthCheckTask = null;
        }
    }

    @Override
    public boolean isRunning() {
        return healthCheckTask != null;
    }

    void recordExecution(EngineExecution execution) {
        Instant now = clock.instant();
        metrics.compute(execution.engineId(), (id, current) -> {
            PerformanceMetrics base = current != null ? current : PerformanceMetrics.initial(id, now);
            return switch (execution.status()) {
                case SUCCESS -> {
                    double rate = Math.min(100.0, base.successRate() + SUCCESS_STEP);
                    yield new PerformanceMetrics(id, rate, execution.report().confidence(),
                            Math.max(0, base.errorCount() - 1), now, execution.duration(), trendFor(rate));
                }
                case FAILED -> {
                    double rate = Math.max(0.0, base.successRate() - FAILURE_STEP);
                    yield new PerformanceMetrics(id, rate, base.confidence(), base.errorCount() + 1, now,
                            execution.duration(), trendFor(rate));
                }
                case SKIPPED -> new PerformanceMetrics(id, base.successRate(), base.confidence(),
                        base.errorCount(), now, base.executionTime(), base.trend());
            };
        });
    }

    private void cascade(String engineId) {
        try {
            engineExecutor.execute(() -> {
                Instant startedAt = clock.instant();
                EngineExecution execution;
                try {
                    EngineReport report = registry.executeEngine(engineId);
                    execution = EngineExecution.success(engineId, report, Duration.between(startedAt, clock.instant()));
                } catch (InsufficientDataException e) {
                    execution = EngineExecution.skipped(engineId, e.getMessage(), Duration.between(startedAt, clock.instant()));
                } catch (RuntimeException e) {
                    execution = EngineExecution.failed(engineId, e.getMessage(), Duration.between(startedAt, clock.instant()));
                }
                recordExecution(execution);
            });
        } catch (RejectedExecutionException e) {
            log.warn("Cascade execution rejected engineId={} error={}", engineId, e.getMessage());
        }
    }

    private static PerformanceMetrics.Trend trendFor(double successRate) {
        if (successRate > IMPROVING_ABOVE) {
            return PerformanceMetrics.Trend.IMPROVING;
        }
        if (successRate < DEGRADING_BELOW) {
            return PerformanceMetrics.Trend.DEGRADING;
        }
        return PerformanceMetrics.Trend.STABLE;
    }
}
