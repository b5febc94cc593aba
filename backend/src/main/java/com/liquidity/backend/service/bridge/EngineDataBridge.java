package com.liquidity.backend.service.bridge;

import com.liquidity.backend.config.DataBridgeProperties;
import com.liquidity.backend.event.BridgeEvent;
import com.liquidity.backend.event.EngineExecutionEvent;
import com.liquidity.backend.event.EventChannel;
import com.liquidity.backend.event.Subscription;
import com.liquidity.backend.model.BridgeFormat;
import com.liquidity.backend.model.BridgedData;
import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.service.ScheduledTaskGuard;
import com.liquidity.backend.service.engine.ChartSeriesSource;
import com.liquidity.backend.service.engine.EngineRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Last-write-wins cache of presentation views, one entry per (engine, format). Every successful engine
 * execution replaces the engine's entries; expired entries are never served and are purged by a
 * periodic sweep, which also trims the cache to its maximum size oldest first.
 */
@Service
@Slf4j
public class EngineDataBridge implements SmartLifecycle {

    private final EngineRegistry registry;
    private final DataBridgeProperties properties;
    private final TaskScheduler taskScheduler;
    private final ScheduledTaskGuard taskGuard;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final ReadWriteLock cacheLock = new ReentrantReadWriteLock();
    // guarded by cacheLock
    // write order, so equal timestamps evict the earliest write first
    private final Map<BridgeKey, BridgedData> cache = new LinkedHashMap<>();
    private final Map<BridgeKey, EventChannel<BridgedData>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, DataTransformation> transformations = new ConcurrentHashMap<>();
    private final EventChannel<BridgeEvent> bridgeEvents = new EventChannel<>("data-bridge");
    private final AtomicLong transformationsApplied = new AtomicLong();
    private final AtomicLong transformationFailures = new AtomicLong();

    private Subscription registrySubscription;
    private volatile ScheduledFuture<?> sweepTask;

    public EngineDataBridge(EngineRegistry registry,
                            DataBridgeProperties properties,
                            TaskScheduler taskScheduler,
                            ScheduledTaskGuard taskGuard,
                            Clock clock,
                            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
        this.taskGuard = taskGuard;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void init() {
        registrySubscription = registry.onExecution(this::onEngineExecution);
        Gauge.builder("bridge_cache_size", this, EngineDataBridge::cacheSize).register(meterRegistry);
        log.info("Data bridge ready cacheTimeout={} maxCacheSize={} realtime={} transformations={}",
                properties.getCacheTimeout(), properties.getMaxCacheSize(),
                properties.isEnableRealtime(), properties.isEnableTransformations());
    }

    @PreDestroy
    public void destroy() {
        if (registrySubscription != null) {
            registrySubscription.unsubscribe();
        }
    }

    /**
     * @return the cached view, or empty when nothing was bridged or the entry has expired
     */
    public Optional<BridgedData> getBridgedData(String engineId, BridgeFormat format) {
        Instant now = clock.instant();
        cacheLock.readLock().lock();
        try {
            BridgedData data = cache.get(new BridgeKey(engineId, format));
            if (data == null || data.isExpired(now)) {
                return Optional.empty();
            }
            return Optional.of(data);
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    /**
     * Listener is invoked synchronously with every new entry for the key, in registration order.
     */
    public Subscription subscribe(String engineId, BridgeFormat format, Consumer<? super BridgedData> callback) {
        BridgeKey key = new BridgeKey(engineId, format);
        EventChannel<BridgedData> channel = subscribers.computeIfAbsent(key,
                k -> new EventChannel<>("bridge:" + k.engineId() + ":" + k.format().name().toLowerCase(Locale.ROOT)));
        return channel.subscribe(callback);
    }

    public Subscription onBridgeEvent(Consumer<? super BridgeEvent> listener) {
        return bridgeEvents.subscribe(listener);
    }

    public void registerTransformation(DataTransformation transformation) {
        transformations.put(transformation.id(), transformation);
        log.info("Registered transformation id={} source={} format={}",
                transformation.id(), transformation.sourceEngineId(), transformation.targetFormat());
    }

    public boolean unregisterTransformation(String transformationId) {
        return transformations.remove(transformationId) != null;
    }

    /**
     * Replaces the engine's cached views with ones derived from {@code report} and runs the engine's
     * transformations.
     */
    public List<BridgedData> bridgeReport(String engineId, EngineReport report) {
        Instant now = clock.instant();
        Instant expiresAt = now.plus(properties.getCacheTimeout());
        List<BridgedData> entries = new ArrayList<>();
        entries.add(new BridgedData(engineId, BridgeFormat.TILE, tile(engineId, report), now, expiresAt));
        entries.add(new BridgedData(engineId, BridgeFormat.INDICATOR, indicator(report), now, expiresAt));
        chart(engineId).ifPresent(payload ->
                entries.add(new BridgedData(engineId, BridgeFormat.CHART, payload, now, expiresAt)));

        entries.forEach(this::store);
        entries.stream().filter(this::isCached).forEach(this::notifySubscribers);
        bridgeEvents.publish(BridgeEvent.bridged(engineId, entries, now));

        if (properties.isEnableTransformations()) {
            applyTransformations(engineId, report, now, expiresAt);
        }
        return entries;
    }

    /**
     * Purges expired entries, then evicts oldest entries until the cache fits its maximum size.
     *
     * @return number of entries removed
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed;
        cacheLock.writeLock().lock();
        try {
            int before = cache.size();
            cache.values().removeIf(data -> data.isExpired(now));
            evictOverflow();
            removed = before - cache.size();
        } finally {
            cacheLock.writeLock().unlock();
        }
        if (removed > 0) {
            log.debug("Bridge cache sweep removed={} remaining={}", removed, cacheSize());
            bridgeEvents.publish(BridgeEvent.cleanup(removed, now));
        }
        return removed;
    }

    public void clearCache() {
        cacheLock.writeLock().lock();
        try {
            cache.clear();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    public int cacheSize() {
        cacheLock.readLock().lock();
        try {
            return cache.size();
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    public BridgeStatistics getStatistics() {
        int subscriptionCount = subscribers.values().stream().mapToInt(EventChannel::listenerCount).sum();
        return new BridgeStatistics(cacheSize(), transformations.size(), subscriptionCount,
                transformationsApplied.get(), transformationFailures.get());
    }

    @Override
    public void start() {
        if (sweepTask != null) {
            return;
        }
        sweepTask = taskScheduler.scheduleAtFixedRate(
                () -> taskGuard.run("bridge-cache-sweep", this::sweep),
                clock.instant().plus(properties.getCleanupInterval()),
                properties.getCleanupInterval());
        log.info("Bridge cache sweep scheduled interval={}", properties.getCleanupInterval());
    }

    @Override
    public void stop() {
        ScheduledFuture<?> task = sweepTask;
        if (task != null) {
            task.cancel(false);
            sweepTask = null;
        }
    }

    @Override
    public boolean isRunning() {
        return sweepTask != null;
    }

    private void onEngineExecution(EngineExecutionEvent event) {
        if (!properties.isEnableRealtime()) {
            return;
        }
        if (event.type() == EngineExecutionEvent.Type.SUCCESS) {
            bridgeReport(event.engineId(), event.report());
        } else {
            bridgeEvents.publish(BridgeEvent.engineError(event.engineId(), event.error(), clock.instant()));
        }
    }

    private void applyTransformations(String engineId, EngineReport report, Instant now, Instant expiresAt) {
        for (DataTransformation transformation : transformations.values()) {
            if (!transformation.sourceEngineId().equals(engineId)) {
                continue;
            }
            try {
                Object output = transformation.transform().apply(report);
                BridgedData data = new BridgedData(transformation.cacheId(), transformation.targetFormat(),
                        output, now, expiresAt);
                store(data);
                notifySubscribers(data);
                transformationsApplied.incrementAndGet();
                bridgeEvents.publish(BridgeEvent.transformationApplied(engineId, transformation.id(), data, now));
            } catch (RuntimeException e) {
                transformationFailures.incrementAndGet();
                log.warn("Transformation failed id={} engineId={} error={}", transformation.id(), engineId, e.getMessage());
                bridgeEvents.publish(BridgeEvent.transformationFailed(engineId, transformation.id(), e, now));
            }
        }
    }

    void store(BridgedData data) {
        cacheLock.writeLock().lock();
        try {
            BridgeKey key = new BridgeKey(data.engineId(), data.format());
            cache.remove(key);
            cache.put(key, data);
            evictOverflow();
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    private boolean isCached(BridgedData data) {
        cacheLock.readLock().lock();
        try {
            return cache.get(new BridgeKey(data.engineId(), data.format())) == data;
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    // caller holds the write lock
    private void evictOverflow() {
        int overflow = cache.size() - properties.getMaxCacheSize();
        if (overflow <= 0) {
            return;
        }
        List<Map.Entry<BridgeKey, BridgedData>> oldestFirst = new ArrayList<>(cache.entrySet());
        oldestFirst.sort(Comparator.comparing(entry -> entry.getValue().timestamp()));
        Iterator<Map.Entry<BridgeKey, BridgedData>> iterator = oldestFirst.iterator();
        while (overflow > 0 && iterator.hasNext()) {
            cache.remove(iterator.next().getKey());
            overflow--;
        }
    }

    private void notifySubscribers(BridgedData data) {
        EventChannel<BridgedData> channel = subscribers.get(new BridgeKey(data.engineId(), data.format()));
        if (channel != null) {
            channel.publish(data);
        }
    }

    private TilePayload tile(String engineId, EngineReport report) {
        String title = registry.getMetadata(engineId).map(EngineMetadata::name).orElse(engineId);
        String value = String.format(Locale.ROOT, "%.2f", report.primaryMetric().value());
        return switch (report.signal()) {
            case RISK_OFF -> new TilePayload(title, value, "critical", "Reduce risk exposure", report.signal(), report.confidence());
            case WARNING -> new TilePayload(title, value, "warning", "Monitor closely", report.signal(), report.confidence());
            case RISK_ON -> new TilePayload(title, value, "positive", "Consider adding exposure", report.signal(), report.confidence());
            case NEUTRAL -> new TilePayload(title, value, "normal", "Maintain positioning", report.signal(), report.confidence());
        };
    }

    private IndicatorPayload indicator(EngineReport report) {
        return new IndicatorPayload(report.primaryMetric().value(), report.primaryMetric().change(),
                report.primaryMetric().changePercent(), report.confidence(), report.generatedAt());
    }

    private Optional<ChartPayload> chart(String engineId) {
        return registry.getEngine(engineId)
                .filter(ChartSeriesSource.class::isInstance)
                .map(engine -> ((ChartSeriesSource) engine).chartSeries())
                .filter(series -> !series.isEmpty())
                .map(ChartPayload::new);
    }

    private record BridgeKey(String engineId, BridgeFormat format) {}
}
