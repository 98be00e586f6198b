package com.makemytrade.backtester.indicator.volatility;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.PriceColumn;

import java.util.List;

/**
 * High minus low of each bar.
 */
public class BarRange implements Indicator {

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        double[] high = PriceColumn.HIGH.extract(bars);
        double[] low = PriceColumn.LOW.extract(bars);
        double[] range = new double[bars.size()];
        for (int i = 0; i < range.length; i++) {
            range[i] = high[i] - low[i];
        }
        return range;
    }
}
