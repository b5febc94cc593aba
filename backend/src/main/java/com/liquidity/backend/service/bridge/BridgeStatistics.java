package com.liquidity.backend.service.bridge;

public record BridgeStatistics(int cacheSize, int transformationCount, int subscriptionCount,
                               long transformationsApplied, long transformationFailures) {

    /**
     * Share of transformation runs that succeeded; 1.0 before any ran.
     */
    public double transformationSuccessRate() {
        long total = transformationsApplied + transformationFailures;
        return total == 0 ? 1.0 : (double) transformationsApplied / total;
    }
}
