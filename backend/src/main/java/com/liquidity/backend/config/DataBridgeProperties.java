package com.liquidity.backend.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "liquidity.bridge")
@Data
@Validated
public class DataBridgeProperties {

    private boolean enableRealtime = true;
    private boolean enableTransformations = true;
    private Duration cacheTimeout = Duration.ofSeconds(30);
    private Duration cleanupInterval = Duration.ofMinutes(1);
    @Positive
    private int maxCacheSize = 1000;
}
