package com.liquidity.backend.model;

import java.time.Instant;

public record ChartPoint(Instant timestamp, double value) {}
