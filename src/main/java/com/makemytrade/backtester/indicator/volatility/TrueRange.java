package com.makemytrade.backtester.indicator.volatility;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.PriceColumn;

import java.util.List;

public class TrueRange implements Indicator {

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        double[] high = PriceColumn.HIGH.extract(bars);
        double[] low = PriceColumn.LOW.extract(bars);
        double[] close = PriceColumn.CLOSE.extract(bars);
        double[] trueRange = new double[bars.size()];

        for (int i = 0; i < bars.size(); i++) {
            double highLow = high[i] - low[i];
            // No previous close on the first bar
            if (i == 0) {
                trueRange[i] = highLow;
                continue;
            }
            double highClose = Math.abs(high[i] - close[i - 1]);
            double lowClose = Math.abs(low[i] - close[i - 1]);
            trueRange[i] = Math.max(highLow, Math.max(highClose, lowClose));
        }

        return trueRange;
    }
}
