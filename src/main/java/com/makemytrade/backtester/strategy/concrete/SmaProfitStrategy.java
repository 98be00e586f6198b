package com.makemytrade.backtester.strategy.concrete;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.indicator.IndicatorDefinition;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.Conditions;
import com.makemytrade.backtester.signal.SignalGenerator;
import com.makemytrade.backtester.strategy.BaseStrategy;
import com.makemytrade.backtester.strategy.StrategyParameters;
import com.makemytrade.backtester.strategy.StrategyType;

/**
 * Short/long SMA crossover trading a fixed quantity. The long is only sold at a profit.
 */
public class SmaProfitStrategy extends BaseStrategy {

    private final int shortWindow;
    private final int longWindow;
    private final double units;
    private final boolean debitOnEntry;

    public SmaProfitStrategy(StrategyParameters parameters) {
        super(StrategyType.SMA_PROFIT);
        this.shortWindow = parameters.getPositiveInt("short_window", 5);
        this.longWindow = parameters.getPositiveInt("long_window", 20);
        if (shortWindow >= longWindow) {
            throw new InvalidConfigurationException("short_window (" + shortWindow
                    + ") must be lower than long_window (" + longWindow + ")");
        }
        this.units = parameters.getNonNegativeDouble("units", 1.0);
        this.debitOnEntry = parameters.getBoolean("debit_on_entry", true);
        initialize(parameters);
    }

    @Override
    protected IndicatorSpec buildIndicatorSpec() {
        return IndicatorSpec.of(
                IndicatorDefinition.sma("short_ma", "close", shortWindow),
                IndicatorDefinition.sma("long_ma", "close", longWindow));
    }

    @Override
    protected SignalGenerator buildSignalGenerator() {
        return new SignalGenerator(
                Conditions.crossing(Conditions.greaterThan("short_ma", "long_ma")),
                Conditions.crossing(Conditions.lessThan("short_ma", "long_ma")));
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.FIXED_UNITS)
                .fixedUnits(units)
                .entryAccounting(debitOnEntry
                        ? RiskParameters.EntryAccounting.DEBIT_NOTIONAL
                        : RiskParameters.EntryAccounting.TRACK_EXPOSURE)
                .sellAction(RiskParameters.SellAction.EXIT_LONG)
                .profitGatedExit(true)
                .stopAtrMultiple(0)
                .build();
    }
}
