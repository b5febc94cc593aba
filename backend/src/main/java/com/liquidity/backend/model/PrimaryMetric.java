package com.liquidity.backend.model;

public record PrimaryMetric(double value, double change, double changePercent) {

    public static PrimaryMetric of(double value) {
        return new PrimaryMetric(value, 0.0, 0.0);
    }
}
