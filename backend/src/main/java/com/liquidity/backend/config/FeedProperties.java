package com.liquidity.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Explicit routing table from indicator id to the external API that serves it.
 */
@Configuration
@ConfigurationProperties(prefix = "liquidity.feed")
@Data
public class FeedProperties {

    private Map<String, String> routes = new LinkedHashMap<>();
}
