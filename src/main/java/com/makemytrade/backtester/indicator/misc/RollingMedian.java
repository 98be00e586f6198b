package com.makemytrade.backtester.indicator.misc;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.RollingWindow;
import lombok.AllArgsConstructor;

import java.util.List;

@AllArgsConstructor
public class RollingMedian implements Indicator {
    private final String source;
    private final int window;
    private final boolean partialWindow;

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        return RollingWindow.median(computed.resolve(source, bars), window, partialWindow);
    }
}
