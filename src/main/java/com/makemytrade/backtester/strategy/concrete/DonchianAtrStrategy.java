package com.makemytrade.backtester.strategy.concrete;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.indicator.IndicatorDefinition;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.Condition;
import com.makemytrade.backtester.signal.Conditions;
import com.makemytrade.backtester.signal.Operand;
import com.makemytrade.backtester.signal.SignalGenerator;
import com.makemytrade.backtester.strategy.BaseStrategy;
import com.makemytrade.backtester.strategy.StrategyParameters;
import com.makemytrade.backtester.strategy.StrategyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Donchian breakout with volatility, trend and momentum filters.
 * <ul>
 *     <li>Enter long when the close breaks the slow channel high, today's range beats
 *     {@code atr_mult_entry} times the 50 bar median ATR, the close is above the trend SMA and above the
 *     momentum SMA.</li>
 *     <li>Exit when the close breaks the fast channel low, or at the ATR stop.</li>
 * </ul>
 * A {@code sma_trend} of 0 disables the trend filter.
 */
public class DonchianAtrStrategy extends BaseStrategy {

    static final int ATR_MEDIAN_WINDOW = 50;

    protected final int donchianEntryWindow;
    protected final int donchianExitWindow;
    protected final int atrPeriod;
    protected final double atrMultEntry;
    protected final int smaTrend;
    protected final int smaMomentum;
    protected final int channelShift;

    public DonchianAtrStrategy(StrategyParameters parameters) {
        this(StrategyType.DONCHIAN_ATR, parameters, Defaults.DONCHIAN_ATR);
    }

    protected DonchianAtrStrategy(StrategyType type, StrategyParameters parameters, Defaults defaults) {
        super(type);
        this.donchianEntryWindow = parameters.getPositiveInt("donchian_entry_window", defaults.entryWindow);
        this.donchianExitWindow = parameters.getPositiveInt("donchian_exit_window", defaults.exitWindow);
        this.atrPeriod = parameters.getPositiveInt("atr_period", defaults.atrPeriod);
        this.atrMultEntry = parameters.getNonNegativeDouble("atr_mult_entry", defaults.atrMultEntry);
        this.smaTrend = parameters.getNonNegativeInt("sma_trend", defaults.smaTrend);
        this.smaMomentum = parameters.getPositiveInt("sma_mom", defaults.smaMomentum);
        this.channelShift = parameters.getNonNegativeInt("channel_shift", defaults.channelShift);
        initialize(parameters);
    }

    /**
     * Channels computed over full windows, when false the first bars use whatever history exists.
     */
    protected boolean fullChannelWindows() {
        return false;
    }

    @Override
    protected IndicatorSpec buildIndicatorSpec() {
        List<IndicatorDefinition> definitions = new ArrayList<>();

        IndicatorDefinition entryChannel = IndicatorDefinition.donchianHigh("donchian_high_entry", donchianEntryWindow)
                .shiftedBy(channelShift);
        IndicatorDefinition exitChannel = IndicatorDefinition.donchianLow("donchian_low_exit", donchianExitWindow)
                .shiftedBy(channelShift);
        definitions.add(fullChannelWindows() ? entryChannel : entryChannel.withPartialWindow());
        definitions.add(fullChannelWindows() ? exitChannel : exitChannel.withPartialWindow());

        definitions.add(IndicatorDefinition.atr("atr", atrPeriod).withPartialWindow());
        definitions.add(IndicatorDefinition.range("today_range"));
        definitions.add(IndicatorDefinition.median("atr_median", "atr", ATR_MEDIAN_WINDOW).withPartialWindow());
        if (smaTrend > 0) {
            definitions.add(IndicatorDefinition.sma("sma_trend", "close", smaTrend).withPartialWindow());
        }
        definitions.add(IndicatorDefinition.sma("sma_mom", "close", smaMomentum).withPartialWindow());

        return IndicatorSpec.of(definitions);
    }

    @Override
    protected SignalGenerator buildSignalGenerator() {
        List<Condition> entryRules = new ArrayList<>();
        entryRules.add(Conditions.greaterThan("close", "donchian_high_entry"));
        entryRules.add(Conditions.greaterThan(Operand.of("today_range"), Operand.of("atr_median").times(atrMultEntry)));
        if (smaTrend > 0) {
            entryRules.add(Conditions.greaterThan("close", "sma_trend"));
        }
        entryRules.add(Conditions.greaterThan("close", "sma_mom"));

        return new SignalGenerator(
                Conditions.and(entryRules.toArray(new Condition[0])),
                Conditions.lessThan("close", "donchian_low_exit"));
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.ATR_RISK)
                .entryAccounting(RiskParameters.EntryAccounting.TRACK_EXPOSURE)
                .sellAction(RiskParameters.SellAction.EXIT_LONG)
                .build();
    }

    protected static final class Defaults {
        static final Defaults DONCHIAN_ATR = new Defaults(55, 20, 21, 1.0, 200, 10, 0);
        static final Defaults FILTERED_DONCHIAN = new Defaults(20, 10, 14, 1.5, 200, 50, 1);

        private final int entryWindow;
        private final int exitWindow;
        private final int atrPeriod;
        private final double atrMultEntry;
        private final int smaTrend;
        private final int smaMomentum;
        private final int channelShift;

        private Defaults(int entryWindow, int exitWindow, int atrPeriod, double atrMultEntry, int smaTrend,
                         int smaMomentum, int channelShift) {
            this.entryWindow = entryWindow;
            this.exitWindow = exitWindow;
            this.atrPeriod = atrPeriod;
            this.atrMultEntry = atrMultEntry;
            this.smaTrend = smaTrend;
            this.smaMomentum = smaMomentum;
            this.channelShift = channelShift;
        }
    }
}
