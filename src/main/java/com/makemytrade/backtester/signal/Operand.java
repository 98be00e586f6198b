package com.makemytrade.backtester.signal;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.RollingWindow;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * A price column or derived series, optionally read one bar back and scaled.
 */
@Getter
@AllArgsConstructor
public class Operand {
    private final String source;
    private final int lag;
    private final double multiplier;

    public static Operand of(String source) {
        return new Operand(source, 0, 1.0);
    }

    public Operand previous() {
        return new Operand(source, lag + 1, multiplier);
    }

    public Operand times(double factor) {
        return new Operand(source, lag, multiplier * factor);
    }

    public double[] resolve(List<Bar> bars, DerivedSeriesSet derived) {
        double[] values = derived.resolve(source, bars);
        double[] resolved = lag > 0 ? RollingWindow.shift(values, lag) : values.clone();
        if (multiplier != 1.0) {
            for (int i = 0; i < resolved.length; i++) {
                resolved[i] *= multiplier;
            }
        }
        return resolved;
    }

    @Override
    public String toString() {
        String text = lag > 0 ? source + "[t-" + lag + "]" : source;
        return multiplier != 1.0 ? multiplier + "*" + text : text;
    }
}
