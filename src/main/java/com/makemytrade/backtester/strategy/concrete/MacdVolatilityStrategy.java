package com.makemytrade.backtester.strategy.concrete;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.indicator.IndicatorDefinition;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.Conditions;
import com.makemytrade.backtester.signal.Operand;
import com.makemytrade.backtester.signal.SignalGenerator;
import com.makemytrade.backtester.strategy.BaseStrategy;
import com.makemytrade.backtester.strategy.StrategyParameters;
import com.makemytrade.backtester.strategy.StrategyType;

/**
 * MACD above its signal line in a rising SMA20/SMA50 trend, only when the channel width is above its median.
 */
public class MacdVolatilityStrategy extends BaseStrategy {

    private final int fastSpan;
    private final int slowSpan;
    private final int signalSpan;
    private final int channelWindow;
    private final int medianWindow;
    private final int fastSma;
    private final int slowSma;
    private final int atrPeriod;

    public MacdVolatilityStrategy(StrategyParameters parameters) {
        super(StrategyType.MACD_VOLATILITY);
        this.fastSpan = parameters.getPositiveInt("macd_fast", 12);
        this.slowSpan = parameters.getPositiveInt("macd_slow", 26);
        this.signalSpan = parameters.getPositiveInt("macd_signal", 9);
        if (fastSpan >= slowSpan) {
            throw new InvalidConfigurationException("macd_fast (" + fastSpan + ") must be lower than macd_slow ("
                    + slowSpan + ")");
        }
        this.channelWindow = parameters.getPositiveInt("channel_window", 14);
        this.medianWindow = parameters.getPositiveInt("median_window", 50);
        this.fastSma = parameters.getPositiveInt("sma_fast", 20);
        this.slowSma = parameters.getPositiveInt("sma_slow", 50);
        this.atrPeriod = parameters.getPositiveInt("atr_period", 14);
        initialize(parameters);
    }

    @Override
    protected IndicatorSpec buildIndicatorSpec() {
        return IndicatorSpec.of(
                IndicatorDefinition.macd("macd", "close", fastSpan, slowSpan),
                IndicatorDefinition.ema("macd_signal", "macd", signalSpan),
                IndicatorDefinition.channelWidth("channel_width", channelWindow),
                IndicatorDefinition.median("channel_width_median", "channel_width", medianWindow),
                IndicatorDefinition.sma("sma_fast", "close", fastSma),
                IndicatorDefinition.sma("sma_slow", "close", slowSma),
                IndicatorDefinition.atr("atr", atrPeriod));
    }

    @Override
    protected SignalGenerator buildSignalGenerator() {
        return new SignalGenerator(
                Conditions.and(
                        Conditions.greaterThan("macd", "macd_signal"),
                        Conditions.greaterThan("close", "sma_fast"),
                        Conditions.greaterThan("sma_fast", "sma_slow"),
                        Conditions.greaterThan("channel_width", "channel_width_median")),
                Conditions.and(
                        Conditions.atMost(Operand.of("macd"), Operand.of("macd_signal")),
                        Conditions.lessThan("close", "sma_fast"),
                        Conditions.lessThan("sma_fast", "sma_slow"),
                        Conditions.greaterThan("channel_width", "channel_width_median")));
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.ATR_RISK)
                .sellAction(RiskParameters.SellAction.EXIT_LONG)
                .build();
    }
}
