package com.liquidity.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "liquidity.orchestrator")
@Data
@Validated
public class OrchestratorProperties {

    @Positive
    private int maxConcurrentEngines = 8;
}
