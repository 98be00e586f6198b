package com.makemytrade.backtester.indicator.volatility;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.RollingWindow;
import lombok.AllArgsConstructor;

import java.util.List;

// The ATR measures the average range between the high and low prices of an asset over a given period.
// A higher ATR indicates more volatility, while a lower ATR indicates less volatility.
@AllArgsConstructor
public class ATR implements Indicator {
    private final int period;
    private final boolean partialWindow;

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        return RollingWindow.mean(new TrueRange().calculate(bars, computed), period, partialWindow);
    }
}
