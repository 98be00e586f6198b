package com.makemytrade.backtester.strategy.concrete;

import static org.assertj.core.api.Assertions.assertThat;

import com.makemytrade.backtester.backtesting.Backtester;
import com.makemytrade.backtester.backtesting.MetricsCalculator;
import com.makemytrade.backtester.backtesting.PositionManager;
import com.makemytrade.backtester.backtesting.SimulationLoop;
import com.makemytrade.backtester.backtesting.model.BacktestResult;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.TestBars;
import com.makemytrade.backtester.broker.PaperBroker;
import com.makemytrade.backtester.config.BacktesterProperties;
import com.makemytrade.backtester.indicator.IndicatorEngine;
import com.makemytrade.backtester.strategy.StrategiesFactory;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class FilteredDonchianStrategyTest {

    private final Backtester backtester = new Backtester(
            new SimulationLoop(new IndicatorEngine(), new PositionManager(new PaperBroker())),
            new MetricsCalculator(0.02),
            new BacktesterProperties());

    @Test
    void backtest_coversEveryBarAndKeepsCapitalFinite() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 400; i++) {
            double close = 100 + 20 * Math.sin(i / 15.0) + i * 0.05;
            double range = 1 + (i % 7);
            bars.add(TestBars.bar(i, close + range, close - range, close));
        }

        BacktestResult result = backtester.run(StrategiesFactory.getStrategy("FILTERED_DONCHIAN"), "BTC", bars);

        assertThat(result.getEquityCurve()).hasSize(bars.size());
        assertThat(result.getMetrics().getFinalCapital()).isFinite();
        assertThat(result.getMetrics().getMaxDrawdown()).isLessThanOrEqualTo(0.0);
        assertThat(result.getTrades()).allSatisfy(trade -> assertThat(trade.getPrice()).isPositive());
    }

    @Test
    void backtest_shorterThanWarmupNeverTrades() {
        BacktestResult result = backtester.run(
                StrategiesFactory.getStrategy("FILTERED_DONCHIAN"), "BTC", TestBars.fromCloses(10, 11, 12, 13));

        assertThat(result.getTrades()).isEmpty();
        assertThat(result.getEquityCurve()).hasSize(4);
        assertThat(result.getMetrics().getFinalCapital()).isEqualTo(10_000);
    }
}
