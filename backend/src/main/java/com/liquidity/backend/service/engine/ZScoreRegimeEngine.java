package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.Alert;
import com.liquidity.backend.model.ChartPoint;
import com.liquidity.backend.model.EngineCategory;
import com.liquidity.backend.model.EngineMetadata;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.model.MarketRegime;
import com.liquidity.backend.model.PrimaryMetric;
import com.liquidity.backend.model.Signal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Cross-asset stress gauge. Each indicator's latest value is scored against its own rolling history
 * (IQR-cleaned, sample standard deviation) and the weighted composite is mapped to a regime tier and
 * a risk signal.
 */
@Slf4j
@Component
public class ZScoreRegimeEngine implements SignalEngine, ChartSeriesSource {

    public static final String ENGINE_ID = "zscore-foundation";
    public static final List<String> DEFAULT_INDICATORS = List.of("VIX", "SPX", "DXY", "TNX");

    static final int WINDOW_SIZE = 84;
    static final int MIN_HISTORY = 10;
    static final int MIN_CLEAN_POINTS = 5;
    static final double OUTLIER_SCORE = 3.0;
    static final double AGREEMENT_BAND = 0.5;

    private static final Map<String, Double> WEIGHTS = Map.of(
            "VIX", 0.4,
            "SPX", 0.3,
            "DXY", 0.2,
            "TNX", 0.1
    );
    private static final double DEFAULT_WEIGHT = 0.1;
    private static final double OUTLIER_PENALTY = 0.1;
    private static final double MAX_OUTLIER_PENALTY = 0.5;

    private final Clock clock;
    private final Set<String> indicators;
    private final EngineMetadata metadata;
    private final Map<String, HistoricalWindow> windows = new HashMap<>();
    private final Deque<ChartPoint> compositeHistory = new ArrayDeque<>();
    private Double previousComposite;

    @Autowired
    public ZScoreRegimeEngine(Clock clock) {
        this(clock, DEFAULT_INDICATORS);
    }

    public ZScoreRegimeEngine(Clock clock, List<String> indicators) {
        this.clock = clock;
        this.indicators = Collections.unmodifiableSet(new LinkedHashSet<>(indicators));
        this.metadata = new EngineMetadata(ENGINE_ID, "Z-Score Regime", 1, 95, EngineCategory.FOUNDATION, Set.of());
        for (String indicator : indicators) {
            windows.put(indicator, new HistoricalWindow(WINDOW_SIZE));
        }
    }

    @Override
    public EngineMetadata metadata() {
        return metadata;
    }

    @Override
    public Set<String> requiredIndicators() {
        return indicators;
    }

    @Override
    public boolean validateData(Map<String, IndicatorSample> samples) {
        return countPresent(samples) >= minimumPresent();
    }

    @Override
    public synchronized EngineReport calculate(Map<String, IndicatorSample> samples) {
        Instant now = clock.instant();
        Map<String, Double> scores = new LinkedHashMap<>();
        int present = 0;
        for (String indicator : indicators) {
            IndicatorSample sample = samples.get(indicator);
            if (sample == null || !Double.isFinite(sample.value())) {
                continue;
            }
            present++;
            HistoricalWindow window = windows.get(indicator);
            window.append(sample.value());
            scores.put(indicator, scoreIndicator(sample.value(), window));
        }

        double composite = composite(scores);
        int outliers = (int) scores.values().stream().filter(score -> Math.abs(score) > OUTLIER_SCORE).count();
        double completeness = indicators.isEmpty() ? 0.0 : (double) present / indicators.size();
        MarketRegime regime = MarketRegime.fromComposite(composite);
        double confidence = confidence(completeness, outliers, scores);
        Signal signal = classify(composite);

        PrimaryMetric primary = primaryMetric(composite);
        previousComposite = composite;
        recordComposite(now, composite);

        Map<String, Object> subMetrics = new LinkedHashMap<>();
        subMetrics.put("regime", regime.name());
        subMetrics.put("outliers", outliers);
        subMetrics.put("individualScores", Map.copyOf(scores));
        subMetrics.put("dataQuality", dataQuality());

        List<Alert> alerts = new ArrayList<>();
        if (Math.abs(composite) > MarketRegime.EXTREME.lowerBound()) {
            alerts.add(new Alert(Alert.Level.CRITICAL,
                    "Extreme market stress: composite z-score " + format(composite), now));
        }
        if (outliers > 2) {
            alerts.add(new Alert(Alert.Level.WARNING, outliers + " indicators beyond 3 standard deviations", now));
        }

        log.debug("Z-score cycle composite={} regime={} confidence={} present={}/{}",
                composite, regime, confidence, present, indicators.size());
        return new EngineReport(primary, signal, confidence, analysis(composite, regime, outliers, present),
                subMetrics, alerts, now);
    }

    @Override
    public synchronized List<ChartPoint> chartSeries() {
        return List.copyOf(compositeHistory);
    }

    static Signal classify(double composite) {
        if (composite > 2.0) {
            return Signal.RISK_OFF;
        }
        if (composite > 1.0) {
            return Signal.WARNING;
        }
        if (composite < -2.0) {
            return Signal.RISK_ON;
        }
        return Signal.NEUTRAL;
    }

    private double dataQuality() {
        double total = 0.0;
        int filled = 0;
        for (HistoricalWindow window : windows.values()) {
            if (window.size() == 0) {
                continue;
            }
            total += Math.min(window.size() / (double) WINDOW_SIZE, 1.0);
            filled++;
        }
        return filled == 0 ? 0.0 : SeriesStatistics.round(total / filled * 100.0, 2);
    }

    int historySize(String indicator) {
        HistoricalWindow window = windows.get(indicator);
        return window == null ? 0 : window.size();
    }

    private double scoreIndicator(double current, HistoricalWindow window) {
        if (window.size() < MIN_HISTORY) {
            return 0.0;
        }
        double[] cleaned = SeriesStatistics.removeOutliersIqr(window.toArray());
        if (cleaned.length < MIN_CLEAN_POINTS) {
            return 0.0;
        }
        return SeriesStatistics.zScore(current, cleaned);
    }

    private double composite(Map<String, Double> scores) {
        double weightedSum = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<String, Double> entry : scores.entrySet()) {
            double weight = WEIGHTS.getOrDefault(entry.getKey(), DEFAULT_WEIGHT);
            weightedSum += entry.getValue() * weight;
            totalWeight += weight;
        }
        if (totalWeight == 0.0) {
            return 0.0;
        }
        return SeriesStatistics.round(weightedSum / totalWeight, 6);
    }

    private double confidence(double completeness, int outliers, Map<String, Double> scores) {
        double confidence = 100.0 * completeness;
        if (outliers > 0) {
            confidence *= 1.0 - Math.min(MAX_OUTLIER_PENALTY, outliers * OUTLIER_PENALTY);
        }
        if (scores.size() >= 2) {
            int positive = 0;
            int negative = 0;
            int neutral = 0;
            for (double score : scores.values()) {
                if (score > AGREEMENT_BAND) {
                    positive++;
                } else if (score < -AGREEMENT_BAND) {
                    negative++;
                } else {
                    neutral++;
                }
            }
            int majority = Math.max(positive, Math.max(negative, neutral));
            confidence *= (double) majority / scores.size();
        }
        return SeriesStatistics.round(confidence, 2);
    }

    private PrimaryMetric primaryMetric(double composite) {
        if (previousComposite == null) {
            return PrimaryMetric.of(composite);
        }
        double change = SeriesStatistics.round(composite - previousComposite, 6);
        double changePercent = previousComposite == 0.0
                ? 0.0
                : SeriesStatistics.round(change / Math.abs(previousComposite) * 100.0, 4);
        return new PrimaryMetric(composite, change, changePercent);
    }

    private void recordComposite(Instant now, double composite) {
        if (compositeHistory.size() == WINDOW_SIZE) {
            compositeHistory.removeFirst();
        }
        compositeHistory.addLast(new ChartPoint(now, composite));
    }

    private String analysis(double composite, MarketRegime regime, int outliers, int present) {
        StringBuilder text = new StringBuilder();
        text.append("Composite z-score ").append(format(composite))
                .append(" places markets in the ").append(regime.name().toLowerCase(Locale.ROOT))
                .append(" regime");
        if (composite > AGREEMENT_BAND) {
            text.append(", with stress indicators above their recent norms");
        } else if (composite < -AGREEMENT_BAND) {
            text.append(", with stress indicators below their recent norms");
        }
        text.append(". ").append(present).append('/').append(indicators.size()).append(" indicators reporting");
        if (outliers > 0) {
            text.append("; ").append(outliers).append(" extreme reading").append(outliers == 1 ? "" : "s");
        }
        return text.append('.').toString();
    }

    private int countPresent(Map<String, IndicatorSample> samples) {
        int present = 0;
        for (String indicator : indicators) {
            IndicatorSample sample = samples.get(indicator);
            if (sample != null && Double.isFinite(sample.value())) {
                present++;
            }
        }
        return present;
    }

    private int minimumPresent() {
        return (int) Math.ceil(indicators.size() * 0.5);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
