package com.makemytrade.backtester.indicator;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.exception.InvalidDataException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

@Getter
@AllArgsConstructor
public enum PriceColumn {
    OPEN("open", Bar::getOpen),
    HIGH("high", Bar::getHigh),
    LOW("low", Bar::getLow),
    CLOSE("close", Bar::getClose),
    VOLUME("volume", Bar::getVolume);

    private final String key;
    private final ToDoubleFunction<Bar> accessor;

    public static Optional<PriceColumn> fromKey(String key) {
        return Arrays.stream(values()).filter(column -> column.key.equals(key)).findFirst();
    }

    /**
     * @throws InvalidDataException if a bar holds a non-finite value in this column
     */
    public double[] extract(List<Bar> bars) {
        double[] values = new double[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            double value = accessor.applyAsDouble(bars.get(i));
            if (!Double.isFinite(value)) {
                throw new InvalidDataException("Column " + key + " is not numeric at bar #" + i + ": " + value);
            }
            values[i] = value;
        }
        return values;
    }
}
