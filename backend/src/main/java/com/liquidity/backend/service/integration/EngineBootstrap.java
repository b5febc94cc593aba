package com.liquidity.backend.service.integration;

import com.liquidity.backend.service.engine.SignalEngine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Registers every engine bean with the hub at startup.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EngineBootstrap {

    private final ObjectProvider<SignalEngine> engines;
    private final EngineIntegrationHub hub;

    @PostConstruct
    public void registerEngines() {
        engines.orderedStream().forEach(engine -> hub.registerEngine(engine, engine.metadata()));
        log.info("✅ Signal engines registered count={}", hub.getEnginePerformanceMetrics().size());
    }
}
