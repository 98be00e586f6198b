package com.makemytrade.backtester.indicator.misc;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.baseline.EMA;

import java.util.List;

/**
 * MACD line: fast EMA minus slow EMA of the source. The signal line is an EMA defined over this series.
 */
public class MACD implements Indicator {
    private final String source;
    private final int fastLength;
    private final int slowLength;

    /**
     * @param source     the column or series the EMAs are computed on
     * @param fastLength the span of the fast EMA
     * @param slowLength the span of the slow EMA
     */
    public MACD(String source, int fastLength, int slowLength) {
        this.source = source;
        this.fastLength = fastLength;
        this.slowLength = slowLength;
    }

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        double[] values = computed.resolve(source, bars);
        double[] fastEma = EMA.calculate(values, fastLength);
        double[] slowEma = EMA.calculate(values, slowLength);

        double[] macdLine = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            macdLine[i] = fastEma[i] - slowEma[i];
        }
        return macdLine;
    }
}
