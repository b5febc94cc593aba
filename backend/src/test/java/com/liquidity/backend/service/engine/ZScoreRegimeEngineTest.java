package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.Alert;
import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.model.MarketRegime;
import com.liquidity.backend.model.Signal;
import com.liquidity.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ZScoreRegimeEngineTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");

    @Test
    void flatHistoryGivesNeutralZeroComposite() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        EngineReport report = null;
        for (int i = 0; i < 15; i++) {
            report = engine.calculate(samples(20.0, 5000.0, 104.0, 4.2));
        }

        assertThat(report.primaryMetric().value()).isEqualTo(0.0);
        assertThat(report.signal()).isEqualTo(Signal.NEUTRAL);
        assertThat(report.subMetrics().get("regime")).isEqualTo("NORMAL");
        assertThat(report.confidence()).isEqualTo(100.0);
        assertThat(report.alerts()).isEmpty();
    }

    @Test
    void shortHistoryContributesNeutralScore() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        EngineReport report = null;
        for (int i = 1; i <= 9; i++) {
            report = engine.calculate(samples(i * 10.0, 5000.0, 104.0, 4.2));
        }

        @SuppressWarnings("unchecked")
        Map<String, Double> scores = (Map<String, Double>) report.subMetrics().get("individualScores");
        assertThat(scores).containsEntry("VIX", 0.0);
        assertThat(report.primaryMetric().value()).isEqualTo(0.0);
    }

    @Test
    void weightsIndicatorScoresIntoComposite() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        EngineReport report = null;
        for (int i = 1; i <= 11; i++) {
            report = engine.calculate(samples(i, 5000.0, 104.0, 4.2));
        }

        @SuppressWarnings("unchecked")
        Map<String, Double> scores = (Map<String, Double>) report.subMetrics().get("individualScores");
        assertThat(scores.get("VIX")).isEqualTo(1.507557);
        assertThat(report.primaryMetric().value()).isEqualTo(0.603023);
        assertThat(report.primaryMetric().change()).isPositive();
        assertThat(report.subMetrics().get("regime")).isEqualTo(MarketRegime.MILD.name());
        assertThat(report.signal()).isEqualTo(Signal.NEUTRAL);
        // one positive bucket against three neutral ones
        assertThat(report.confidence()).isCloseTo(75.0, within(1e-9));
    }

    @Test
    void extremeReadingRaisesCriticalAlertAndRiskOff() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock, List.of("VIX"));
        for (int i = 0; i < 10; i++) {
            engine.calculate(Map.of("VIX", sample("VIX", i % 2 == 0 ? 10.0 : 10.1)));
        }

        EngineReport report = engine.calculate(Map.of("VIX", sample("VIX", 20.0)));

        assertThat(report.signal()).isEqualTo(Signal.RISK_OFF);
        assertThat(report.subMetrics().get("regime")).isEqualTo("EXTREME");
        assertThat(report.subMetrics().get("outliers")).isEqualTo(1);
        assertThat(report.confidence()).isCloseTo(90.0, within(1e-9));
        assertThat(report.hasCriticalAlert()).isTrue();
    }

    @Test
    void manyOutliersRaiseWarningAndPenaliseConfidence() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock, List.of("A", "B", "C"));
        for (int i = 0; i < 10; i++) {
            double value = i % 2 == 0 ? 10.0 : 10.1;
            engine.calculate(Map.of("A", sample("A", value), "B", sample("B", value), "C", sample("C", value)));
        }

        EngineReport report = engine.calculate(Map.of("A", sample("A", 20.0), "B", sample("B", 20.0),
                "C", sample("C", 20.0)));

        assertThat(report.alerts()).extracting(Alert::level).contains(Alert.Level.WARNING, Alert.Level.CRITICAL);
        assertThat(report.confidence()).isCloseTo(70.0, within(1e-9));
    }

    @Test
    void missingIndicatorsReduceConfidenceAndValidation() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        Map<String, IndicatorSample> half = Map.of("VIX", sample("VIX", 20.0), "SPX", sample("SPX", 5000.0));
        Map<String, IndicatorSample> one = Map.of("VIX", sample("VIX", 20.0));
        Map<String, IndicatorSample> notFinite = Map.of("VIX", sample("VIX", 20.0), "SPX", sample("SPX", Double.NaN));

        assertThat(engine.validateData(half)).isTrue();
        assertThat(engine.validateData(one)).isFalse();
        assertThat(engine.validateData(notFinite)).isFalse();
        assertThat(engine.calculate(half).confidence()).isEqualTo(50.0);
    }

    @Test
    void historyNeverExceedsWindowSize() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        for (int i = 0; i < 100; i++) {
            engine.calculate(samples(20.0 + i % 3, 5000.0, 104.0, 4.2));
        }

        assertThat(engine.historySize("VIX")).isEqualTo(ZScoreRegimeEngine.WINDOW_SIZE);
        assertThat(engine.chartSeries()).hasSize(ZScoreRegimeEngine.WINDOW_SIZE);
    }

    @Test
    void regimeTiersAreMonotonicInMagnitude() {
        MarketRegime previous = MarketRegime.NORMAL;
        for (int step = 0; step <= 40; step++) {
            double composite = step / 10.0;
            MarketRegime regime = MarketRegime.fromComposite(composite);
            assertThat(regime.severity()).isGreaterThanOrEqualTo(previous.severity());
            assertThat(MarketRegime.fromComposite(-composite)).isEqualTo(regime);
            previous = regime;
        }
        assertThat(MarketRegime.fromComposite(0.5)).isEqualTo(MarketRegime.NORMAL);
        assertThat(MarketRegime.fromComposite(2.6)).isEqualTo(MarketRegime.EXTREME);
    }

    @Test
    void dataQualityTracksHowFullTheWindowsAre() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);

        EngineReport first = engine.calculate(samples(20.0, 5000.0, 104.0, 4.2));
        assertThat(first.subMetrics().get("dataQuality")).isEqualTo(1.19);

        EngineReport report = null;
        for (int i = 0; i < 100; i++) {
            report = engine.calculate(samples(20.0, 5000.0, 104.0, 4.2));
        }
        assertThat(report.subMetrics().get("dataQuality")).isEqualTo(100.0);
    }

    @Test
    void dataQualityIgnoresIndicatorsThatNeverReported() {
        ZScoreRegimeEngine engine = new ZScoreRegimeEngine(clock);
        engine.calculate(Map.of("VIX", sample("VIX", 20.0)));

        EngineReport report = engine.calculate(Map.of("VIX", sample("VIX", 21.0)));

        assertThat(report.subMetrics().get("dataQuality")).isEqualTo(2.38);
    }

    @Test
    void signalFollowsSignedComposite() {
        assertThat(ZScoreRegimeEngine.classify(2.1)).isEqualTo(Signal.RISK_OFF);
        assertThat(ZScoreRegimeEngine.classify(1.5)).isEqualTo(Signal.WARNING);
        assertThat(ZScoreRegimeEngine.classify(1.0)).isEqualTo(Signal.NEUTRAL);
        assertThat(ZScoreRegimeEngine.classify(-1.5)).isEqualTo(Signal.NEUTRAL);
        assertThat(ZScoreRegimeEngine.classify(-2.1)).isEqualTo(Signal.RISK_ON);
    }

    private Map<String, IndicatorSample> samples(double vix, double spx, double dxy, double tnx) {
        Map<String, IndicatorSample> samples = new HashMap<>();
        samples.put("VIX", sample("VIX", vix));
        samples.put("SPX", sample("SPX", spx));
        samples.put("DXY", sample("DXY", dxy));
        samples.put("TNX", sample("TNX", tnx));
        return samples;
    }

    private IndicatorSample sample(String symbol, double value) {
        Instant now = clock.instant();
        return IndicatorSample.of(symbol, now, value);
    }
}
