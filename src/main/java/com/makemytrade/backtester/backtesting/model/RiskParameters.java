package com.makemytrade.backtester.backtesting.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * How a strategy variant turns signals into positions.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class RiskParameters {

    public enum SizingModel {
        // Risk a fraction of cash over an ATR based stop distance
        ATR_RISK,
        // Invest a fraction of cash
        BALANCE_FRACTION,
        // Always trade the same quantity
        FIXED_UNITS
    }

    public enum EntryAccounting {
        // Cash pays the notional on entry and receives notional plus profit on exit
        DEBIT_NOTIONAL,
        // Cash only moves by realized profit
        TRACK_EXPOSURE
    }

    public enum SellAction {
        OPEN_SHORT,
        EXIT_LONG
    }

    @Builder.Default
    private final SizingModel sizingModel = SizingModel.ATR_RISK;
    @Builder.Default
    private final EntryAccounting entryAccounting = EntryAccounting.TRACK_EXPOSURE;
    @Builder.Default
    private final SellAction sellAction = SellAction.OPEN_SHORT;

    @Builder.Default
    private final double riskPerTradeFraction = 0.01;
    @Builder.Default
    private final double stopAtrMultiple = 2.0;
    // Zero disables take-profit exits
    @Builder.Default
    private final double takeProfitAtrMultiple = 0.0;
    @Builder.Default
    private final double maxNotionalFraction = 0.10;
    @Builder.Default
    private final double minNotional = 0.0;

    @Builder.Default
    private final double investmentFraction = 1.0;
    @Builder.Default
    private final double fixedUnits = 1.0;

    @Builder.Default
    private final boolean profitGatedExit = false;
    @Builder.Default
    private final double profitThreshold = 0.0;
}
