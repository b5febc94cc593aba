package com.liquidity.backend.service.resilience;

public record RateLimiterStatus(double tokens, int requestsPerMinute, int burstSize) {}
