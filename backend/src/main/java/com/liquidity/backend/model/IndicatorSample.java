package com.liquidity.backend.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Latest observation of a single indicator as handed over by the ingestion layer.
 *
 * @param confidence source-reported confidence in [0, 1], {@code null} when the source does not provide one
 */
public record IndicatorSample(String symbol, Instant timestamp, double value, Double confidence) {

    public IndicatorSample {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static IndicatorSample of(String symbol, Instant timestamp, double value) {
        return new IndicatorSample(symbol, timestamp, value, null);
    }
}
