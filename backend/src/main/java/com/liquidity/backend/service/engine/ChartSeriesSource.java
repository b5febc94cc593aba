package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.ChartPoint;

import java.util.List;

public interface ChartSeriesSource {

    /**
     * Recent values of the primary metric, oldest first.
     */
    List<ChartPoint> chartSeries();
}
