package com.liquidity.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "liquidity.integration")
@Data
@Validated
public class IntegrationProperties {

    private Duration healthCheckInterval = Duration.ofSeconds(30);

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double warningThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double criticalThreshold = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double validationThreshold = 0.8;

    private boolean enableCascading = true;

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Data
    public static class Pipeline {
        private boolean enabled = false;
        private long intervalMs = 60000;
    }
}
