package com.liquidity.backend.model;

/**
 * Stress tiers derived from the absolute composite z-score, mildest first.
 */
public enum MarketRegime {
    NORMAL(0.0),
    MILD(0.5),
    MODERATE(1.0),
    ELEVATED(1.5),
    STRESSED(2.0),
    EXTREME(2.5);

    private final double lowerBound;

    MarketRegime(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public int severity() {
        return ordinal();
    }

    /**
     * Bounds are exclusive: a composite of exactly 2.5 is STRESSED.
     */
    public static MarketRegime fromComposite(double composite) {
        double magnitude = Math.abs(composite);
        MarketRegime[] tiers = values();
        for (int i = tiers.length - 1; i > 0; i--) {
            if (magnitude > tiers[i].lowerBound) {
                return tiers[i];
            }
        }
        return NORMAL;
    }
}
