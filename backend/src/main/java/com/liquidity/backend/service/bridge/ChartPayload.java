package com.liquidity.backend.service.bridge;

import com.liquidity.backend.model.ChartPoint;

import java.util.List;

public record ChartPayload(List<ChartPoint> series) {

    public ChartPayload {
        series = List.copyOf(series);
    }
}
