package com.makemytrade.backtester.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.TestBars;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.exception.InvalidDataException;
import java.util.List;
import org.junit.jupiter.api.Test;

class IndicatorEngineTest {

    private static final double NaN = Double.NaN;

    private final IndicatorEngine engine = new IndicatorEngine();

    @Test
    void compute_partialSmaIsDefinedFromFirstBar() {
        List<Bar> bars = TestBars.fromCloses(10, 11, 12, 9, 8);

        DerivedSeries sma = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.sma("sma", "close", 3).withPartialWindow())).get("sma");

        assertThat(sma.getValues()).containsExactly(new double[]{10, 10.5, 11, 32.0 / 3, 29.0 / 3}, within(1e-9));
    }

    @Test
    void compute_fullWindowSmaLeavesWarmUpUndefined() {
        List<Bar> bars = TestBars.fromCloses(10, 11, 12);

        DerivedSeries sma = engine.compute(bars, IndicatorSpec.of(IndicatorDefinition.sma("sma", "close", 3))).get("sma");

        assertThat(sma.isDefined(0)).isFalse();
        assertThat(sma.isDefined(1)).isFalse();
        assertThat(sma.get(2)).isEqualTo(11);
        assertThat(sma.get(3)).isNaN();
    }

    @Test
    void compute_trueRangeUsesPreviousCloseAfterFirstBar() {
        List<Bar> bars = List.of(TestBars.bar(0, 12, 9, 10), TestBars.bar(1, 15, 11, 14));

        DerivedSeriesSet derived = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.trueRange("tr"),
                IndicatorDefinition.atr("atr", 2),
                IndicatorDefinition.range("range")));

        assertThat(derived.get("tr").getValues()).containsExactly(3, 5);
        assertThat(derived.get("atr").getValues()).containsExactly(NaN, 4);
        assertThat(derived.get("range").getValues()).containsExactly(3, 4);
    }

    @Test
    void compute_shiftedDonchianOnlySeesPriorBars() {
        List<Bar> bars = List.of(TestBars.bar(0, 5, 1, 3), TestBars.bar(1, 7, 2, 4), TestBars.bar(2, 6, 3, 5));

        DerivedSeriesSet derived = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.donchianHigh("high_full", 2).shiftedBy(1),
                IndicatorDefinition.donchianHigh("high_partial", 2).withPartialWindow().shiftedBy(1),
                IndicatorDefinition.donchianLow("low", 2).withPartialWindow(),
                IndicatorDefinition.channelWidth("width", 2)));

        assertThat(derived.get("high_full").getValues()).containsExactly(NaN, NaN, 7);
        assertThat(derived.get("high_partial").getValues()).containsExactly(NaN, 5, 7);
        assertThat(derived.get("low").getValues()).containsExactly(1, 1, 2);
        assertThat(derived.get("width").getValues()).containsExactly(NaN, 6, 5);
    }

    @Test
    void compute_emaIsSeededWithFirstObservation() {
        List<Bar> bars = TestBars.fromCloses(10, 20, 20);

        DerivedSeries ema = engine.compute(bars, IndicatorSpec.of(IndicatorDefinition.ema("ema", "close", 3))).get("ema");

        assertThat(ema.getValues()).containsExactly(10, 15, 17.5);
    }

    @Test
    void compute_macdAndSignalLineChainOnEarlierSeries() {
        List<Bar> bars = TestBars.fromCloses(10, 20);

        DerivedSeriesSet derived = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.macd("macd", "close", 1, 3),
                IndicatorDefinition.ema("signal", "macd", 3)));

        assertThat(derived.get("macd").getValues()).containsExactly(0, 5);
        assertThat(derived.get("signal").getValues()).containsExactly(0, 2.5);
    }

    @Test
    void compute_rollingMedianOfDerivedSeries() {
        List<Bar> bars = TestBars.fromCloses(5, 1, 3);

        DerivedSeriesSet derived = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.sma("close_copy", "close", 1),
                IndicatorDefinition.median("median", "close_copy", 2).withPartialWindow()));

        assertThat(derived.get("median").getValues()).containsExactly(5, 3, 2);
    }

    @Test
    void compute_outputHasOneValuePerBar() {
        List<Bar> bars = TestBars.fromCloses(1, 2, 3, 4, 5, 6);

        DerivedSeriesSet derived = engine.compute(bars, IndicatorSpec.of(
                IndicatorDefinition.atr("atr", 14),
                IndicatorDefinition.sma("sma", "close", 50).withPartialWindow()));

        assertThat(derived.asMap().values()).allMatch(series -> series.size() == bars.size());
    }

    @Test
    void compute_failsOnUnknownSource() {
        List<Bar> bars = TestBars.fromCloses(1, 2, 3);

        assertThatThrownBy(() -> engine.compute(bars, IndicatorSpec.of(IndicatorDefinition.sma("sma", "vwap", 2))))
                .isInstanceOf(InvalidDataException.class)
                .hasMessageContaining("vwap");
    }

    @Test
    void compute_failsOnNonFiniteColumnValue() {
        List<Bar> bars = List.of(TestBars.bar(0, 2, 1, 1.5), TestBars.bar(1, Double.POSITIVE_INFINITY, 1, 1.5));

        assertThatThrownBy(() -> engine.compute(bars, IndicatorSpec.of(IndicatorDefinition.trueRange("tr"))))
                .isInstanceOf(InvalidDataException.class);
    }

    @Test
    void spec_rejectsInvalidDefinitions() {
        assertThatThrownBy(() -> IndicatorSpec.of(IndicatorDefinition.sma("sma", "close", 0)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> IndicatorSpec.of(IndicatorDefinition.sma("sma", "close", 3).shiftedBy(-1)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> IndicatorSpec.of(
                IndicatorDefinition.sma("sma", "close", 3), IndicatorDefinition.ema("sma", "close", 3)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }
}
