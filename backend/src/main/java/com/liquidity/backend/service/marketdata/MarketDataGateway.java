package com.liquidity.backend.service.marketdata;

import com.liquidity.backend.config.FeedProperties;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.service.resilience.PriorityWorkQueue;
import com.liquidity.backend.service.resilience.ResilienceRegistry;
import com.liquidity.backend.service.resilience.RetryHandler;
import com.liquidity.backend.service.resilience.TokenBucketRateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single entry point for indicator values. Routed indicators are pulled from their external API through
 * the work queue, that API's rate limiter and its retry handler; everything else is served from the
 * latest sample pushed by the ingestion feed.
 */
@Service
@Slf4j
public class MarketDataGateway {

    private final FeedProperties feedProperties;
    private final ResilienceRegistry resilienceRegistry;
    private final PriorityWorkQueue workQueue;
    private final MeterRegistry meterRegistry;
    private final Map<String, IndicatorSource> sources = new HashMap<>();
    private final Map<String, IndicatorSample> latestSamples = new ConcurrentHashMap<>();

    @Autowired
    public MarketDataGateway(FeedProperties feedProperties,
                             ResilienceRegistry resilienceRegistry,
                             PriorityWorkQueue workQueue,
                             MeterRegistry meterRegistry,
                             ObjectProvider<IndicatorSource> sources) {
        this(feedProperties, resilienceRegistry, workQueue, meterRegistry, sources.orderedStream().toList());
    }

    public MarketDataGateway(FeedProperties feedProperties,
                             ResilienceRegistry resilienceRegistry,
                             PriorityWorkQueue workQueue,
                             MeterRegistry meterRegistry,
                             List<IndicatorSource> sources) {
        this.feedProperties = feedProperties;
        this.resilienceRegistry = resilienceRegistry;
        this.workQueue = workQueue;
        this.meterRegistry = meterRegistry;
        for (IndicatorSource source : sources) {
            this.sources.put(source.name(), source);
        }
        log.info("Market data gateway ready sources={} routes={}", this.sources.keySet(), feedProperties.getRoutes().size());
    }

    /**
     * Accepts a pushed sample. An older sample never replaces a newer one.
     */
    public void publish(IndicatorSample sample) {
        latestSamples.merge(sample.symbol(), sample,
                (current, incoming) -> incoming.timestamp().isBefore(current.timestamp()) ? current : incoming);
    }

    public Optional<IndicatorSample> latest(String indicator) {
        return Optional.ofNullable(latestSamples.get(indicator));
    }

    /**
     * Collects the latest sample of each indicator. Indicators whose fetch fails after retries are left out
     * of the result.
     */
    public Map<String, IndicatorSample> fetch(Set<String> indicators, int priority) {
        Map<String, IndicatorSample> result = new HashMap<>();
        Map<String, CompletableFuture<IndicatorSample>> inFlight = new LinkedHashMap<>();
        for (String indicator : indicators) {
            String api = feedProperties.getRoutes().get(indicator);
            IndicatorSource source = api == null ? null : sources.get(api);
            if (source == null) {
                if (api != null) {
                    log.warn("No indicator source registered api={} indicator={}", api, indicator);
                }
                latest(indicator).ifPresent(sample -> result.put(indicator, sample));
                continue;
            }
            inFlight.put(indicator, workQueue.enqueue(() -> fetchFromSource(source, indicator),
                    priority, api + ":" + indicator));
        }
        inFlight.forEach((indicator, future) -> {
            try {
                IndicatorSample sample = future.join();
                if (sample != null) {
                    publish(sample);
                    result.put(indicator, sample);
                }
            } catch (CompletionException e) {
                String api = feedProperties.getRoutes().get(indicator);
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Indicator fetch failed indicator={} api={} error={}", indicator, api, cause.getMessage());
                Counter.builder("indicator_fetch_failures_total")
                        .tag("source", api)
                        .register(meterRegistry)
                        .increment();
            }
        });
        return result;
    }

    private IndicatorSample fetchFromSource(IndicatorSource source, String indicator) {
        TokenBucketRateLimiter limiter = resilienceRegistry.rateLimiter(source.name());
        RetryHandler retryHandler = resilienceRegistry.retryHandler(source.name());
        return retryHandler.execute(source.name() + ":" + indicator, () -> {
            limiter.waitForToken();
            return source.fetchLatest(indicator);
        });
    }
}
