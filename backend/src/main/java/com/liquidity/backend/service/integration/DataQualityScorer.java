package com.liquidity.backend.service.integration;

import com.liquidity.backend.model.IndicatorSample;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Scores a pushed sample in [0, 1] from its freshness and plausibility.
 */
@Component
@RequiredArgsConstructor
public class DataQualityScorer {

    static final Duration STALE_AFTER = Duration.ofMinutes(1);
    static final Duration VERY_STALE_AFTER = Duration.ofMinutes(5);
    static final double IMPLAUSIBLE_MAGNITUDE = 1e10;

    private final Clock clock;

    public double score(IndicatorSample sample) {
        double score = 1.0;
        Duration age = Duration.between(sample.timestamp(), clock.instant());
        if (age.compareTo(STALE_AFTER) > 0) {
            score -= 0.2;
        }
        if (age.compareTo(VERY_STALE_AFTER) > 0) {
            score -= 0.3;
        }
        double value = sample.value();
        if (!Double.isFinite(value)) {
            score -= 0.4;
        } else if (Math.abs(value) > IMPLAUSIBLE_MAGNITUDE) {
            score -= 0.2;
        } else if (value == 0.0) {
            score -= 0.1;
        }
        return Math.max(0.0, Math.round(score * 100.0) / 100.0);
    }
}
