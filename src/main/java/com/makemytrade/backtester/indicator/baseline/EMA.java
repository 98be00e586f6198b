package com.makemytrade.backtester.indicator.baseline;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

@Getter
@AllArgsConstructor
public class EMA implements Indicator {
    private final String source;
    private final int span;

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        return calculate(computed.resolve(source, bars), span);
    }

    /**
     * Recursive EMA with smoothing factor 2 / (span + 1), seeded with the first defined value.
     * Undefined inputs keep the previous average.
     */
    public static double[] calculate(double[] values, int span) {
        double[] ema = new double[values.length];
        Arrays.fill(ema, Double.NaN);

        double multiplier = 2.0 / (span + 1);
        double previous = Double.NaN;

        for (int i = 0; i < values.length; i++) {
            double value = values[i];
            if (!Double.isFinite(value)) {
                ema[i] = previous;
                continue;
            }
            previous = Double.isNaN(previous) ? value : value * multiplier + previous * (1 - multiplier);
            ema[i] = previous;
        }

        return ema;
    }
}
