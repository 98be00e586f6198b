package com.makemytrade.backtester.signal;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Maps derived series to per-bar trading intent with a buy rule and a sell rule.
 */
@Getter
@AllArgsConstructor
public class SignalGenerator {
    private final Condition buyCondition;
    private final Condition sellCondition;

    public SignalSeries generate(List<Bar> bars, DerivedSeriesSet derived) {
        boolean[] buy = buyCondition.evaluate(bars, derived);
        boolean[] sell = sellCondition.evaluate(bars, derived);
        if (buy.length != bars.size() || sell.length != bars.size()) {
            throw new IllegalStateException("Signal rules must produce one flag per bar, got "
                    + buy.length + "/" + sell.length + " for " + bars.size() + " bars");
        }
        return new SignalSeries(buy, sell);
    }
}
