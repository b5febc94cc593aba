package com.liquidity.backend.service.resilience;

public record QueueStats(int queueSize, int activeRequests, boolean processing) {}
