package com.makemytrade.backtester.bar;

import com.makemytrade.backtester.exception.InvalidDataException;

import java.util.List;

/**
 * Checks the input contract of a run: every bar carries a timestamp and finite OHLCV values.
 * Ordering, gaps and duplicates are the data source's responsibility.
 */
public final class BarValidator {

    private BarValidator() {
    }

    public static void validate(String instrument, List<Bar> bars) {
        if (bars == null) {
            throw new InvalidDataException("No bar sequence supplied for " + instrument);
        }

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null) {
                throw new InvalidDataException("Bar #" + i + " of " + instrument + " is missing");
            }
            if (bar.getTimestamp() == null) {
                throw new InvalidDataException("Bar #" + i + " of " + instrument + " has no timestamp");
            }
            requireFinite(instrument, i, "open", bar.getOpen());
            requireFinite(instrument, i, "high", bar.getHigh());
            requireFinite(instrument, i, "low", bar.getLow());
            requireFinite(instrument, i, "close", bar.getClose());
            requireFinite(instrument, i, "volume", bar.getVolume());
        }
    }

    private static void requireFinite(String instrument, int index, String column, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidDataException(
                    String.format("Column %s of bar #%d of %s is not numeric: %s", column, index, instrument, value));
        }
    }
}
