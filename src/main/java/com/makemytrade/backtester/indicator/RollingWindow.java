package com.makemytrade.backtester.indicator;

import java.util.Arrays;
import java.util.function.ToDoubleFunction;

/**
 * Rolling aggregates over a trailing window. Undefined inputs inside the window are skipped; a value is produced
 * once the window holds at least one defined input (partial window) or a full window of them.
 */
public final class RollingWindow {

    private RollingWindow() {
    }

    public static double[] mean(double[] input, int window, boolean partialWindow) {
        return aggregate(input, window, partialWindow, values -> Arrays.stream(values).average().orElse(Double.NaN));
    }

    public static double[] max(double[] input, int window, boolean partialWindow) {
        return aggregate(input, window, partialWindow, values -> Arrays.stream(values).max().orElse(Double.NaN));
    }

    public static double[] min(double[] input, int window, boolean partialWindow) {
        return aggregate(input, window, partialWindow, values -> Arrays.stream(values).min().orElse(Double.NaN));
    }

    public static double[] median(double[] input, int window, boolean partialWindow) {
        return aggregate(input, window, partialWindow, values -> {
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            int middle = sorted.length / 2;
            return sorted.length % 2 == 1 ? sorted[middle] : (sorted[middle - 1] + sorted[middle]) / 2;
        });
    }

    /**
     * Moves every value forward by the given number of bars, leaving the head undefined.
     */
    public static double[] shift(double[] input, int bars) {
        double[] shifted = new double[input.length];
        Arrays.fill(shifted, Double.NaN);
        for (int i = bars; i < input.length; i++) {
            shifted[i] = input[i - bars];
        }
        return shifted;
    }

    private static double[] aggregate(double[] input, int window, boolean partialWindow,
                                      ToDoubleFunction<double[]> aggregator) {
        int minPeriods = partialWindow ? 1 : window;
        double[] output = new double[input.length];
        double[] buffer = new double[window];

        for (int i = 0; i < input.length; i++) {
            int count = 0;
            for (int j = Math.max(0, i - window + 1); j <= i; j++) {
                if (Double.isFinite(input[j])) {
                    buffer[count++] = input[j];
                }
            }
            output[i] = count >= minPeriods ? aggregator.applyAsDouble(Arrays.copyOf(buffer, count)) : Double.NaN;
        }

        return output;
    }
}
