package com.liquidity.backend.service.integration;

import com.liquidity.backend.exception.PipelineAlreadyRunningException;
import com.liquidity.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "liquidity.integration.pipeline.enabled", havingValue = "true")
public class PipelineScheduler {

    private final EngineIntegrationHub hub;
    private final ScheduledTaskGuard taskGuard;

    @Scheduled(fixedDelayString = "${liquidity.integration.pipeline.interval-ms:60000}")
    public void runPipeline() {
        taskGuard.run("integrated-pipeline", () -> {
            try {
                hub.executeIntegratedPipeline();
            } catch (PipelineAlreadyRunningException e) {
                log.info("Skipping scheduled pipeline run, previous run still executing");
            }
        });
    }
}
