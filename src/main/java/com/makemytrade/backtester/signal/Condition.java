package com.makemytrade.backtester.signal;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;

import java.util.List;

@FunctionalInterface
public interface Condition {

    /**
     * @return one flag per bar; a bar whose operands are undefined evaluates to false
     */
    boolean[] evaluate(List<Bar> bars, DerivedSeriesSet derived);
}
