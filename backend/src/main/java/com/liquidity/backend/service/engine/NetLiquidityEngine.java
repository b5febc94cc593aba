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
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Fed net liquidity: balance sheet (WALCL) minus the Treasury General Account (WTREGEN) minus
 * overnight reverse repo (RRPONTSYD). The raw series is smoothed with a fixed-gain filter and the
 * signal follows the cycle-over-cycle change of the smoothed value.
 */
@Slf4j
@Component
public class NetLiquidityEngine implements SignalEngine, DataInjectable, ChartSeriesSource {

    public static final String ENGINE_ID = "net-liquidity";
    public static final String BALANCE_SHEET = "WALCL";
    public static final String TREASURY_ACCOUNT = "WTREGEN";
    public static final String REVERSE_REPO = "RRPONTSYD";

    static final double SMOOTHING_GAIN = 0.3;
    static final double EXPANSION_PCT = 0.5;
    static final double WARNING_PCT = -0.5;
    static final double CONTRACTION_PCT = -1.0;
    static final double STRESS_CONFIDENCE_FACTOR = 0.8;
    private static final int HISTORY_SIZE = 84;
    private static final double MISSING_COMPONENT_FACTOR = 0.85;

    private final Clock clock;
    private final EngineMetadata metadata = new EngineMetadata(ENGINE_ID, "Net Liquidity", 1, 90,
            EngineCategory.CORE, Set.of(ZScoreRegimeEngine.ENGINE_ID));
    private final Map<String, Double> lastComponents = new HashMap<>();
    private final Deque<ChartPoint> history = new ArrayDeque<>();
    private Map<String, EngineReport> dependencyReports = Map.of();
    private Double smoothed;

    public NetLiquidityEngine(Clock clock) {
        this.clock = clock;
    }

    @Override
    public EngineMetadata metadata() {
        return metadata;
    }

    @Override
    public Set<String> requiredIndicators() {
        return Set.of(BALANCE_SHEET, TREASURY_ACCOUNT, REVERSE_REPO);
    }

    /**
     * The balance sheet is mandatory; one of the two drains may be carried over from the last cycle.
     */
    @Override
    public synchronized boolean validateData(Map<String, IndicatorSample> samples) {
        if (!isPresent(samples, BALANCE_SHEET)) {
            return false;
        }
        int present = 0;
        for (String indicator : requiredIndicators()) {
            if (isPresent(samples, indicator) || lastComponents.containsKey(indicator)) {
                present++;
            }
        }
        return present >= 2;
    }

    @Override
    public synchronized void injectData(Map<String, EngineReport> dependencyReports) {
        this.dependencyReports = dependencyReports == null ? Map.of() : Map.copyOf(dependencyReports);
    }

    @Override
    public synchronized EngineReport calculate(Map<String, IndicatorSample> samples) {
        Instant now = clock.instant();
        int carried = 0;
        for (String indicator : requiredIndicators()) {
            if (isPresent(samples, indicator)) {
                lastComponents.put(indicator, samples.get(indicator).value());
            } else {
                carried++;
            }
        }
        double raw = lastComponents.getOrDefault(BALANCE_SHEET, 0.0)
                - lastComponents.getOrDefault(TREASURY_ACCOUNT, 0.0)
                - lastComponents.getOrDefault(REVERSE_REPO, 0.0);

        Double previous = smoothed;
        smoothed = previous == null ? raw : previous + SMOOTHING_GAIN * (raw - previous);
        double value = SeriesStatistics.round(smoothed, 2);
        double change = previous == null ? 0.0 : SeriesStatistics.round(smoothed - previous, 2);
        double changePercent = previous == null || previous == 0.0
                ? 0.0
                : SeriesStatistics.round((smoothed - previous) / Math.abs(previous) * 100.0, 4);
        record(now, value);

        Signal signal = classify(changePercent);
        MarketRegime regime = injectedRegime();
        double confidence = 100.0;
        for (int i = 0; i < carried; i++) {
            confidence *= MISSING_COMPONENT_FACTOR;
        }
        if (regime != null && regime.severity() >= MarketRegime.STRESSED.severity()) {
            confidence *= STRESS_CONFIDENCE_FACTOR;
        }

        Map<String, Object> subMetrics = new LinkedHashMap<>();
        subMetrics.put("rawNetLiquidity", SeriesStatistics.round(raw, 2));
        subMetrics.put("balanceSheet", lastComponents.getOrDefault(BALANCE_SHEET, 0.0));
        subMetrics.put("treasuryAccount", lastComponents.getOrDefault(TREASURY_ACCOUNT, 0.0));
        subMetrics.put("reverseRepo", lastComponents.getOrDefault(REVERSE_REPO, 0.0));
        subMetrics.put("carriedComponents", carried);
        if (regime != null) {
            subMetrics.put("marketRegime", regime.name());
        }

        List<Alert> alerts = new ArrayList<>();
        if (changePercent <= CONTRACTION_PCT) {
            alerts.add(new Alert(Alert.Level.WARNING,
                    "Net liquidity contracting " + format(changePercent) + "% cycle over cycle", now));
        }

        log.debug("Net liquidity cycle raw={} smoothed={} changePercent={}", raw, value, changePercent);
        return new EngineReport(new PrimaryMetric(value, change, changePercent), signal,
                SeriesStatistics.round(confidence, 2), analysis(value, changePercent, regime),
                subMetrics, alerts, now);
    }

    @Override
    public synchronized List<ChartPoint> chartSeries() {
        return List.copyOf(history);
    }

    static Signal classify(double changePercent) {
        if (changePercent >= EXPANSION_PCT) {
            return Signal.RISK_ON;
        }
        if (changePercent <= CONTRACTION_PCT) {
            return Signal.RISK_OFF;
        }
        if (changePercent <= WARNING_PCT) {
            return Signal.WARNING;
        }
        return Signal.NEUTRAL;
    }

    private MarketRegime injectedRegime() {
        EngineReport zScore = dependencyReports.get(ZScoreRegimeEngine.ENGINE_ID);
        if (zScore == null) {
            return null;
        }
        Object regime = zScore.subMetrics().get("regime");
        if (regime == null) {
            return null;
        }
        try {
            return MarketRegime.valueOf(regime.toString());
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring unknown regime={} from engineId={}", regime, ZScoreRegimeEngine.ENGINE_ID);
            return null;
        }
    }

    private void record(Instant now, double value) {
        if (history.size() == HISTORY_SIZE) {
            history.removeFirst();
        }
        history.addLast(new ChartPoint(now, value));
    }

    private String analysis(double value, double changePercent, MarketRegime regime) {
        String direction = changePercent > 0 ? "expanding" : changePercent < 0 ? "contracting" : "flat";
        String text = "Net liquidity at " + format(value) + " is " + direction
                + " (" + format(changePercent) + "% cycle over cycle)";
        if (regime != null) {
            text += " in a " + regime.name().toLowerCase(Locale.ROOT) + " market regime";
        }
        return text + ".";
    }

    private static boolean isPresent(Map<String, IndicatorSample> samples, String indicator) {
        IndicatorSample sample = samples.get(indicator);
        return sample != null && Double.isFinite(sample.value());
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
