package com.liquidity.backend.service.engine;

import com.liquidity.backend.model.EngineReport;
import com.liquidity.backend.model.IndicatorSample;
import com.liquidity.backend.model.PrimaryMetric;
import com.liquidity.backend.model.Signal;
import com.liquidity.backend.util.MutableClock;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NetLiquidityEngineTest {

    private final MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
    private final NetLiquidityEngine engine = new NetLiquidityEngine(clock);

    @Test
    void firstCycleReportsRawNetLiquidity() {
        EngineReport report = engine.calculate(inputs(7800.0, 700.0, 100.0));

        assertThat(report.primaryMetric().value()).isEqualTo(7000.0);
        assertThat(report.primaryMetric().change()).isEqualTo(0.0);
        assertThat(report.signal()).isEqualTo(Signal.NEUTRAL);
        assertThat(report.confidence()).isEqualTo(100.0);
    }

    @Test
    void expansionIsRiskOn() {
        engine.calculate(inputs(7800.0, 700.0, 100.0));

        EngineReport report = engine.calculate(inputs(8000.0, 700.0, 100.0));

        // smoothed 7000 + 0.3 * 200
        assertThat(report.primaryMetric().value()).isEqualTo(7060.0);
        assertThat(report.primaryMetric().changePercent()).isEqualTo(0.8571);
        assertThat(report.signal()).isEqualTo(Signal.RISK_ON);
    }

    @Test
    void sharpContractionIsRiskOffWithAlert() {
        engine.calculate(inputs(7800.0, 700.0, 100.0));

        EngineReport report = engine.calculate(inputs(7500.0, 700.0, 100.0));

        assertThat(report.primaryMetric().value()).isEqualTo(6910.0);
        assertThat(report.signal()).isEqualTo(Signal.RISK_OFF);
        assertThat(report.alerts()).hasSize(1);
    }

    @Test
    void stressedRegimeLowersConfidence() {
        engine.injectData(Map.of(ZScoreRegimeEngine.ENGINE_ID, new EngineReport(PrimaryMetric.of(2.2), Signal.RISK_OFF,
                90.0, "stress", Map.of("regime", "STRESSED"), List.of(), clock.instant())));

        EngineReport report = engine.calculate(inputs(7800.0, 700.0, 100.0));

        assertThat(report.confidence()).isEqualTo(80.0);
        assertThat(report.subMetrics()).containsEntry("marketRegime", "STRESSED");
    }

    @Test
    void balanceSheetIsMandatoryAndDrainsCarryOver() {
        assertThat(engine.validateData(Map.of("WTREGEN", sample("WTREGEN", 700.0)))).isFalse();
        assertThat(engine.validateData(Map.of("WALCL", sample("WALCL", 7800.0)))).isFalse();

        engine.calculate(inputs(7800.0, 700.0, 100.0));
        Map<String, IndicatorSample> partial = Map.of("WALCL", sample("WALCL", 7900.0));

        assertThat(engine.validateData(partial)).isTrue();
        EngineReport report = engine.calculate(partial);
        assertThat(report.subMetrics()).containsEntry("carriedComponents", 2);
        assertThat(report.confidence()).isLessThan(100.0);
        assertThat(engine.chartSeries()).hasSize(2);
    }

    private Map<String, IndicatorSample> inputs(double walcl, double tga, double rrp) {
        return Map.of(
                "WALCL", sample("WALCL", walcl),
                "WTREGEN", sample("WTREGEN", tga),
                "RRPONTSYD", sample("RRPONTSYD", rrp)
        );
    }

    private IndicatorSample sample(String symbol, double value) {
        return IndicatorSample.of(symbol, clock.instant(), value);
    }
}
