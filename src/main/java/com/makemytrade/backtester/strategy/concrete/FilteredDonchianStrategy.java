package com.makemytrade.backtester.strategy.concrete;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.strategy.StrategyParameters;
import com.makemytrade.backtester.strategy.StrategyType;

/**
 * Donchian breakout trading both sides: channels only see prior bars, a break of the channel low opens a short.
 * Sized by ATR risk with a notional cap and floor. Only one position per direction at a time.
 */
public class FilteredDonchianStrategy extends DonchianAtrStrategy {

    public FilteredDonchianStrategy(StrategyParameters parameters) {
        super(StrategyType.FILTERED_DONCHIAN, parameters, Defaults.FILTERED_DONCHIAN);
    }

    @Override
    protected boolean fullChannelWindows() {
        return true;
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.ATR_RISK)
                .entryAccounting(RiskParameters.EntryAccounting.TRACK_EXPOSURE)
                .sellAction(RiskParameters.SellAction.OPEN_SHORT)
                .riskPerTradeFraction(0.005)
                .stopAtrMultiple(2.0)
                .maxNotionalFraction(0.10)
                .minNotional(10.0)
                .build();
    }
}
