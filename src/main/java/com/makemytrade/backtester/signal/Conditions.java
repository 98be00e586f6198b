package com.makemytrade.backtester.signal;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;

import java.util.Arrays;
import java.util.List;

/**
 * Building blocks of signal rules. Comparisons against NaN are false, so warm-up bars never signal.
 */
public final class Conditions {

    private Conditions() {
    }

    public static Condition greaterThan(Operand left, Operand right) {
        return compare(left, right, (a, b) -> a > b);
    }

    public static Condition lessThan(Operand left, Operand right) {
        return compare(left, right, (a, b) -> a < b);
    }

    public static Condition atMost(Operand left, Operand right) {
        return compare(left, right, (a, b) -> a <= b);
    }

    public static Condition greaterThan(String left, String right) {
        return greaterThan(Operand.of(left), Operand.of(right));
    }

    public static Condition lessThan(String left, String right) {
        return lessThan(Operand.of(left), Operand.of(right));
    }

    public static Condition and(Condition... conditions) {
        return (bars, derived) -> {
            boolean[] result = new boolean[bars.size()];
            Arrays.fill(result, true);
            for (Condition condition : conditions) {
                boolean[] flags = condition.evaluate(bars, derived);
                for (int i = 0; i < result.length; i++) {
                    result[i] &= flags[i];
                }
            }
            return result;
        };
    }

    /**
     * True only on the bar where the condition becomes true: c(t) and not c(t-1).
     */
    public static Condition crossing(Condition condition) {
        return (bars, derived) -> {
            boolean[] flags = condition.evaluate(bars, derived);
            boolean[] result = new boolean[flags.length];
            for (int i = 0; i < flags.length; i++) {
                boolean previous = i > 0 && flags[i - 1];
                result[i] = flags[i] && !previous;
            }
            return result;
        };
    }

    public static Condition always() {
        return (bars, derived) -> {
            boolean[] result = new boolean[bars.size()];
            Arrays.fill(result, true);
            return result;
        };
    }

    public static Condition never() {
        return (bars, derived) -> new boolean[bars.size()];
    }

    private static Condition compare(Operand left, Operand right, Comparison comparison) {
        return new Condition() {
            @Override
            public boolean[] evaluate(List<Bar> bars, DerivedSeriesSet derived) {
                double[] a = left.resolve(bars, derived);
                double[] b = right.resolve(bars, derived);
                boolean[] result = new boolean[bars.size()];
                for (int i = 0; i < result.length; i++) {
                    result[i] = comparison.test(a[i], b[i]);
                }
                return result;
            }

            @Override
            public String toString() {
                return left + " vs " + right;
            }
        };
    }

    @FunctionalInterface
    private interface Comparison {
        boolean test(double left, double right);
    }
}
