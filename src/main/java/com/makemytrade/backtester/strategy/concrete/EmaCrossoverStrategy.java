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
 * Buy when the short EMA crosses above the long EMA, which shows an uptrend.
 * Sell when it crosses back below, only if the trade is in profit.
 */
public class EmaCrossoverStrategy extends BaseStrategy {

    private final int shortEma;
    private final int longEma;
    private final int atrPeriod;

    public EmaCrossoverStrategy(StrategyParameters parameters) {
        super(StrategyType.EMA_CROSSOVER);
        this.shortEma = parameters.getPositiveInt("short_ema", 8);
        this.longEma = parameters.getPositiveInt("long_ema", 21);
        if (shortEma >= longEma) {
            throw new InvalidConfigurationException("short_ema (" + shortEma
                    + ") must be lower than long_ema (" + longEma + ")");
        }
        this.atrPeriod = parameters.getPositiveInt("atr_period", 14);
        initialize(parameters);
    }

    @Override
    protected IndicatorSpec buildIndicatorSpec() {
        return IndicatorSpec.of(
                IndicatorDefinition.ema("ema_short", "close", shortEma),
                IndicatorDefinition.ema("ema_long", "close", longEma),
                IndicatorDefinition.atr("atr", atrPeriod));
    }

    @Override
    protected SignalGenerator buildSignalGenerator() {
        return new SignalGenerator(
                Conditions.crossing(Conditions.greaterThan("ema_short", "ema_long")),
                Conditions.crossing(Conditions.lessThan("ema_short", "ema_long")));
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.ATR_RISK)
                .sellAction(RiskParameters.SellAction.EXIT_LONG)
                .profitGatedExit(true)
                .build();
    }
}
