package com.makemytrade.backtester.indicator;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * A named column aligned one-to-one with the bars. NaN marks a value that is not defined yet.
 */
@Getter
@AllArgsConstructor
public class DerivedSeries {
    private final String name;
    private final double[] values;

    public double get(int index) {
        if (index < 0 || index >= values.length) {
            return Double.NaN;
        }
        return values[index];
    }

    public boolean isDefined(int index) {
        return Double.isFinite(get(index));
    }

    public int size() {
        return values.length;
    }
}
