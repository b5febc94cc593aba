package com.liquidity.backend.service.bridge;

import java.time.Instant;

public record IndicatorPayload(double current, double change, double changePercent, double confidence,
                               Instant timestamp) {}
