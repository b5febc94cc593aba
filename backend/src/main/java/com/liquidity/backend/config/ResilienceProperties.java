package com.liquidity.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "liquidity.resilience")
@Data
@Validated
public class ResilienceProperties {

    @Valid
    private ApiPolicy defaults = ApiPolicy.standard();

    @Valid
    private Map<String, ApiPolicy> apis = new LinkedHashMap<>();

    @Valid
    private Queue queue = new Queue();

    @Valid
    private EngineBreaker engineBreaker = new EngineBreaker();

    /**
     * Resolves the policy for an API. Fields the API entry leaves unset come from {@code defaults};
     * APIs without an entry get {@code defaults} as a whole.
     */
    public ApiPolicy policyFor(String api) {
        ApiPolicy base = defaults.withFallback(ApiPolicy.standard());
        ApiPolicy policy = apis.get(api);
        return policy == null ? base : policy.withFallback(base);
    }

    @Data
    public static class ApiPolicy {
        @Positive
        private Integer requestsPerMinute;
        // null means burst equals this policy's rate, it is not inherited
        private Integer burstSize;
        @Min(0)
        private Integer maxRetries;
        @Positive
        private Long initialDelayMs;
        @Positive
        private Long maxDelayMs;
        @DecimalMin("1.0")
        private Double backoffMultiplier;

        public static ApiPolicy standard() {
            ApiPolicy policy = new ApiPolicy();
            policy.setRequestsPerMinute(60);
            policy.setMaxRetries(3);
            policy.setInitialDelayMs(1000L);
            policy.setMaxDelayMs(30000L);
            policy.setBackoffMultiplier(2.0);
            return policy;
        }

        public ApiPolicy withFallback(ApiPolicy fallback) {
            ApiPolicy merged = new ApiPolicy();
            merged.setRequestsPerMinute(requestsPerMinute != null ? requestsPerMinute : fallback.getRequestsPerMinute());
            merged.setBurstSize(burstSize);
            merged.setMaxRetries(maxRetries != null ? maxRetries : fallback.getMaxRetries());
            merged.setInitialDelayMs(initialDelayMs != null ? initialDelayMs : fallback.getInitialDelayMs());
            merged.setMaxDelayMs(maxDelayMs != null ? maxDelayMs : fallback.getMaxDelayMs());
            merged.setBackoffMultiplier(backoffMultiplier != null ? backoffMultiplier : fallback.getBackoffMultiplier());
            return merged;
        }

        public int effectiveBurstSize() {
            return burstSize != null && burstSize > 0 ? burstSize : requestsPerMinute;
        }
    }

    @Data
    public static class Queue {
        @Positive
        private int concurrentLimit = 3;
        @Min(0)
        private int maxRetries = 0;
        @Positive
        private long initialDelayMs = 1000;
        @Positive
        private long maxDelayMs = 30000;
        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class EngineBreaker {
        private boolean enabled = true;
        @Positive
        private int failureThreshold = 3;
        @Positive
        private long openSeconds = 60;
    }
}
