package com.makemytrade.backtester.indicator;

import com.makemytrade.backtester.bar.Bar;

import java.util.List;

public interface Indicator {
    double[] calculate(List<Bar> bars, DerivedSeriesSet computed);
}
