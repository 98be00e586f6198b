package com.makemytrade.backtester.strategy.concrete;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.makemytrade.backtester.backtesting.Backtester;
import com.makemytrade.backtester.backtesting.MetricsCalculator;
import com.makemytrade.backtester.backtesting.PositionManager;
import com.makemytrade.backtester.backtesting.SimulationLoop;
import com.makemytrade.backtester.backtesting.model.BacktestResult;
import com.makemytrade.backtester.backtesting.model.ExitReason;
import com.makemytrade.backtester.backtesting.model.Trade;
import com.makemytrade.backtester.backtesting.model.TradeType;
import com.makemytrade.backtester.bar.TestBars;
import com.makemytrade.backtester.broker.PaperBroker;
import com.makemytrade.backtester.config.BacktesterProperties;
import com.makemytrade.backtester.indicator.IndicatorEngine;
import com.makemytrade.backtester.strategy.StrategiesFactory;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SmaProfitStrategyTest {

    private final Backtester backtester = new Backtester(
            new SimulationLoop(new IndicatorEngine(), new PositionManager(new PaperBroker())),
            new MetricsCalculator(0.02),
            new BacktesterProperties());

    @Test
    void backtest_configuredAtrStopClosesTheLong() {
        BacktestResult result = backtester.run(
                StrategiesFactory.getStrategy("SMA_PROFIT",
                        Map.of("short_window", 2, "long_window", 3, "stop_atr_multiple", 2)),
                "BTC",
                TestBars.fromCloses(10, 10, 12, 14, 5, 3, 2, 1));

        List<Trade> trades = result.getTrades();
        assertThat(trades).extracting(Trade::getType).containsExactly(TradeType.BUY, TradeType.EXIT);
        assertThat(trades.get(0).getStopPrice()).isCloseTo(12 - 2 * 7.0 / 3, within(1e-9));

        Trade stop = trades.get(1);
        assertThat(stop.getExitReason()).isEqualTo(ExitReason.STOP);
        assertThat(stop.getTimestamp()).isEqualTo(TestBars.START.plusSeconds(4 * 86_400L));
        assertThat(stop.getPrice()).isCloseTo(12 - 2 * 7.0 / 3, within(1e-9));
        assertThat(result.getOpenPositionCount()).isZero();
    }

    @Test
    void backtest_withoutStopKeepsLosingLongOpen() {
        BacktestResult result = backtester.run(
                StrategiesFactory.getStrategy("SMA_PROFIT", Map.of("short_window", 2, "long_window", 3)),
                "BTC",
                TestBars.fromCloses(10, 10, 12, 14, 5, 3, 2, 1));

        assertThat(result.getTrades()).extracting(Trade::getType).containsExactly(TradeType.BUY);
        assertThat(result.getOpenPositionCount()).isEqualTo(1);
    }
}
