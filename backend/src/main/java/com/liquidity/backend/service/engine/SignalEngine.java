package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;

import java.util.Map;
import java.util.Set;

/**
 * A stateful signal computation. Implementations keep their own indicator history and are executed
 * by one thread at a time.
 */
public interface SignalEngine {

    EngineMetadata metadata();

    default String id() {
        return metadata().id();
    }

    /**
     * Indicator ids this engine reads. Also used to build the registry's interest table.
     */
    Set<String> requiredIndicators();

    /**
     * @return {@code false} when too few required indicators are present to produce a meaningful report
     */
    boolean validateData(Map<String, IndicatorSample> samples);

    EngineReport calculate(Map<String, IndicatorSample> samples);
}
