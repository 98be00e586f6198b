package com.makemytrade.backtester.strategy;

import com.makemytrade.backtester.backtesting.RunContext;
import com.makemytrade.backtester.backtesting.SimulationLoop;
import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.SignalGenerator;

import java.util.List;

public interface TradingStrategy {

    enum RunMode {
        // Replayed by the shared simulation loop
        GENERIC,
        // Replayed by the strategy's own backtest method
        CUSTOM
    }

    /**
     * Get strategy name for reporting
     */
    String getName();

    IndicatorSpec getIndicatorSpec();

    SignalGenerator getSignalGenerator();

    RiskParameters getRiskParameters();

    /**
     * Name of the derived series used for stop distances and ATR sizing
     */
    default String getAtrSeriesName() {
        return "atr";
    }

    default RunMode getRunMode() {
        return RunMode.GENERIC;
    }

    /**
     * Own run path of CUSTOM strategies, must fill the context with one equity point per bar.
     */
    default void backtest(List<Bar> bars, RunContext context, SimulationLoop simulationLoop) {
        simulationLoop.run(this, bars, context);
    }
}
