package com.liquidity.backend;

import com.liquidity.backend.config.ResilienceProperties;
import com.liquidity.backend.service.engine.EngineRegistry;
import com.liquidity.backend.service.engine.NetLiquidityEngine;
import com.liquidity.backend.service.engine.ZScoreRegimeEngine;
import com.liquidity.backend.service.integration.EngineIntegrationHub;
import com.liquidity.backend.service.orchestration.EngineOrchestrator;
import com.liquidity.backend.service.orchestration.ExecutionPhase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class LiquidityBackendApplicationTest {

    @Autowired
    private EngineRegistry registry;

    @Autowired
    private EngineOrchestrator orchestrator;

    @Autowired
    private EngineIntegrationHub hub;

    @Autowired
    private ResilienceProperties resilienceProperties;

    @Test
    void wiresEnginesIntoThePipeline() {
        assertThat(registry.getEngine(ZScoreRegimeEngine.ENGINE_ID)).isPresent();
        assertThat(registry.getEngine(NetLiquidityEngine.ENGINE_ID)).isPresent();
        assertThat(hub.getEnginePerformanceMetrics()).containsKeys(ZScoreRegimeEngine.ENGINE_ID, NetLiquidityEngine.ENGINE_ID);
        assertThat(orchestrator.createExecutionPlan().phases()).extracting(ExecutionPhase::engineIds)
                .containsExactly(List.of(ZScoreRegimeEngine.ENGINE_ID), List.of(NetLiquidityEngine.ENGINE_ID));
    }

    @Test
    void bindsPerApiRateTable() {
        assertThat(resilienceProperties.policyFor("fred").getRequestsPerMinute()).isEqualTo(120);
        assertThat(resilienceProperties.policyFor("alphavantage").getRequestsPerMinute()).isEqualTo(25);
        assertThat(resilienceProperties.policyFor("unlisted").getRequestsPerMinute()).isEqualTo(60);
    }
}
