package com.makemytrade.backtester.strategy;

import com.makemytrade.backtester.exception.InvalidConfigurationException;

import java.util.Arrays;
import java.util.Locale;

public enum StrategyType {
    SMA,
    SMA_PROFIT,
    EMA_CROSSOVER,
    DONCHIAN_ATR,
    FILTERED_DONCHIAN,
    MACD_VOLATILITY;

    /**
     * Case-insensitive, dashes and underscores are interchangeable.
     */
    public static StrategyType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidConfigurationException("No strategy name configured");
        }
        String normalized = name.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.name().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new InvalidConfigurationException("Unknown strategy name: " + name
                        + ", expected one of " + Arrays.toString(values())));
    }
}
