package com.liquidity.backend.event;

import com.liquidity.backend.model.IndicatorSample;

import java.util.List;

public record DataIntegrationEvent(Type type, IndicatorSample sample, double qualityScore, List<String> affectedEngines) {

    public enum Type {
        INTEGRATED,
        QUALITY_WARNING
    }
}
