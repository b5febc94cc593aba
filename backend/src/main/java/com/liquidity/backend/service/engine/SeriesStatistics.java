package com.liquidity.backend.service.engine;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;

public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0.0);
    }

    /**
     * Sample standard deviation (n - 1 divisor). Zero for fewer than two values.
     */
    public static double sampleStdDev(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = mean(values);
        double sumSquares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / (values.length - 1));
    }

    /**
     * Drops values outside [Q1 - 1.5 IQR, Q3 + 1.5 IQR]. Quartiles are taken at the floor of the 25th and
     * 75th percentile positions of the sorted series. Input order is preserved.
     */
    public static double[] removeOutliersIqr(double[] values) {
        if (values.length < 4) {
            return values.clone();
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double q1 = sorted[(int) Math.floor(sorted.length * 0.25)];
        double q3 = sorted[(int) Math.floor(sorted.length * 0.75)];
        double iqr = q3 - q1;
        double lower = q1 - 1.5 * iqr;
        double upper = q3 + 1.5 * iqr;
        return Arrays.stream(values)
                .filter(value -> value >= lower && value <= upper)
                .toArray();
    }

    /**
     * Standard score of {@code current} against the series; 0 when the series has no dispersion.
     */
    public static double zScore(double current, double[] series) {
        double stdDev = sampleStdDev(series);
        if (stdDev == 0.0) {
            return 0.0;
        }
        return round((current - mean(series)) / stdDev, 6);
    }

    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
