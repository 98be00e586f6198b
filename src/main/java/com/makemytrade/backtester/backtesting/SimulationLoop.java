package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.exception.BacktestException;
import com.makemytrade.backtester.exception.ExecutionFailureException;
import com.makemytrade.backtester.indicator.DerivedSeries;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.IndicatorEngine;
import com.makemytrade.backtester.signal.SignalSeries;
import com.makemytrade.backtester.strategy.TradingStrategy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Replays bars in order: stops, exits and entries of the bar, then one equity point at the bar's close.
 * Positions still open after the last bar stay open and are marked at the last close.
 */
@Component
@Slf4j
@Getter
public class SimulationLoop {

    private final IndicatorEngine indicatorEngine;
    private final PositionManager positionManager;

    public SimulationLoop(@Autowired IndicatorEngine indicatorEngine,
                          @Autowired PositionManager positionManager) {
        this.indicatorEngine = indicatorEngine;
        this.positionManager = positionManager;
    }

    public void run(TradingStrategy strategy, List<Bar> bars, RunContext context) {
        DerivedSeriesSet derived = indicatorEngine.compute(bars, strategy.getIndicatorSpec());
        SignalSeries signals = strategy.getSignalGenerator().generate(bars, derived);
        DerivedSeries atr = derived.find(strategy.getAtrSeriesName()).orElse(null);

        log.debug("Replaying {} bars of {} with {} buy and {} sell signals", bars.size(), context.getInstrument(),
                signals.countBuys(), signals.countSells());

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            try {
                double atrValue = atr != null ? atr.get(i) : Double.NaN;
                positionManager.onBar(i, bar, signals.isBuy(i), signals.isSell(i), atrValue, context);
                context.recordEquity(bar.getTimestamp(), bar.getClose());
            } catch (BacktestException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExecutionFailureException(context.getInstrument(), i, bar.getTimestamp(), e);
            }
        }
    }
}
