package com.makemytrade.backtester.bar;

import com.makemytrade.backtester.exception.InvalidDataException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Builder
@Getter
@ToString
public class Bar {
    private String symbol;
    private Timeframe timeframe;
    private Instant timestamp;
    private double open;
    private double high;
    private double low;
    private double close;
    private double volume;

    /**
     * Builds a bar from a raw kline row: [startTime, open, high, low, close, volume, ...].
     *
     * @throws InvalidDataException if a field is missing or not numeric
     */
    public static Bar from(List<String> row, String symbol, Timeframe timeframe) {
        if (row == null || row.size() < 6) {
            throw new InvalidDataException("Kline row for " + symbol + " must hold timestamp, open, high, low, close, volume: " + row);
        }

        return Bar.builder()
                .timestamp(Instant.ofEpochMilli((long) parse(row, 0, "timestamp", symbol)))
                .open(parse(row, 1, "open", symbol))
                .high(parse(row, 2, "high", symbol))
                .low(parse(row, 3, "low", symbol))
                .close(parse(row, 4, "close", symbol))
                .volume(parse(row, 5, "volume", symbol))
                .symbol(symbol)
                .timeframe(timeframe)
                .build();
    }

    private static double parse(List<String> row, int index, String column, String symbol) {
        String value = row.get(index);
        if (value == null) {
            throw new InvalidDataException("Missing " + column + " in kline row for " + symbol);
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDataException("Column " + column + " is not numeric for " + symbol + ": '" + value + "'", e);
        }
    }
}
