package com.liquidity.backend.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResiliencePropertiesTest {

    @Test
    void apiEntryInheritsUnsetFieldsFromDefaults() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.getDefaults().setMaxRetries(7);
        properties.getDefaults().setMaxDelayMs(5000L);
        ResilienceProperties.ApiPolicy fred = new ResilienceProperties.ApiPolicy();
        fred.setRequestsPerMinute(120);
        properties.getApis().put("fred", fred);

        ResilienceProperties.ApiPolicy policy = properties.policyFor("fred");

        assertThat(policy.getRequestsPerMinute()).isEqualTo(120);
        assertThat(policy.getMaxRetries()).isEqualTo(7);
        assertThat(policy.getMaxDelayMs()).isEqualTo(5000L);
        assertThat(policy.getInitialDelayMs()).isEqualTo(1000L);
        assertThat(policy.effectiveBurstSize()).isEqualTo(120);
    }

    @Test
    void explicitApiFieldsOverrideDefaults() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.getDefaults().setMaxRetries(7);
        ResilienceProperties.ApiPolicy polygon = new ResilienceProperties.ApiPolicy();
        polygon.setMaxRetries(0);
        polygon.setBurstSize(10);
        properties.getApis().put("polygon", polygon);

        ResilienceProperties.ApiPolicy policy = properties.policyFor("polygon");

        assertThat(policy.getMaxRetries()).isZero();
        assertThat(policy.getRequestsPerMinute()).isEqualTo(60);
        assertThat(policy.effectiveBurstSize()).isEqualTo(10);
    }

    @Test
    void partiallyBoundDefaultsKeepStandardValues() {
        ResilienceProperties properties = new ResilienceProperties();
        properties.setDefaults(new ResilienceProperties.ApiPolicy());
        properties.getDefaults().setRequestsPerMinute(30);

        ResilienceProperties.ApiPolicy policy = properties.policyFor("unlisted");

        assertThat(policy.getRequestsPerMinute()).isEqualTo(30);
        assertThat(policy.getMaxRetries()).isEqualTo(3);
        assertThat(policy.getBackoffMultiplier()).isEqualTo(2.0);
    }
}
