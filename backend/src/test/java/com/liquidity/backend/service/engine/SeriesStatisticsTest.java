package com.liquidity.backend.service.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesStatisticsTest {

    @Test
    void usesBesselCorrectedStandardDeviation() {
        double[] series = {2, 4, 4, 4, 5, 5, 7, 9};

        assertThat(SeriesStatistics.mean(series)).isEqualTo(5.0);
        assertThat(SeriesStatistics.sampleStdDev(series)).isCloseTo(Math.sqrt(32.0 / 7.0), within(1e-12));
    }

    @Test
    void flatSeriesScoresExactlyZero() {
        double[] flat = {3.5, 3.5, 3.5, 3.5, 3.5, 3.5};

        assertThat(SeriesStatistics.zScore(3.5, flat)).isEqualTo(0.0);
        assertThat(SeriesStatistics.zScore(100.0, flat)).isEqualTo(0.0);
    }

    @Test
    void iqrFilterDropsFarOutliers() {
        double[] series = {10, 11, 10, 12, 11, 10, 11, 12, 10, 95};

        double[] cleaned = SeriesStatistics.removeOutliersIqr(series);

        assertThat(cleaned).hasSize(9).doesNotContain(95.0);
    }

    @Test
    void roundsToSixDecimals() {
        assertThat(SeriesStatistics.round(1.23456789, 6)).isEqualTo(1.234568);
        assertThat(SeriesStatistics.zScore(11, new double[]{1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11})).isEqualTo(1.507557);
    }
}
