package com.makemytrade.backtester.strategy;

import com.makemytrade.backtester.exception.InvalidConfigurationException;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named strategy parameters with typed, validated access. Every key read by a strategy is remembered so that
 * leftover keys can be reported as unknown.
 */
public class StrategyParameters {

    private final Map<String, Object> values;
    private final Set<String> consumed = new HashSet<>();

    public StrategyParameters(Map<String, ?> values) {
        this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
    }

    public static StrategyParameters empty() {
        return new StrategyParameters(Collections.emptyMap());
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int getInt(String key, int defaultValue) {
        Object value = read(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number number) {
            if (number.doubleValue() != Math.rint(number.doubleValue())) {
                throw malformed(key, value, "an integer");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw malformed(key, value, "an integer");
        }
    }

    public int getPositiveInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value < 1) {
            throw new InvalidConfigurationException("Parameter '" + key + "' must be at least 1, got " + value);
        }
        return value;
    }

    public int getNonNegativeInt(String key, int defaultValue) {
        int value = getInt(key, defaultValue);
        if (value < 0) {
            throw new InvalidConfigurationException("Parameter '" + key + "' must not be negative, got " + value);
        }
        return value;
    }

    public double getDouble(String key, double defaultValue) {
        Object value = read(key);
        if (value == null) {
            return defaultValue;
        }
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw malformed(key, value, "a number");
            }
        }
        if (!Double.isFinite(parsed)) {
            throw malformed(key, value, "a finite number");
        }
        return parsed;
    }

    public double getNonNegativeDouble(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (value < 0) {
            throw new InvalidConfigurationException("Parameter '" + key + "' must not be negative, got " + value);
        }
        return value;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = read(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim();
        if (text.equalsIgnoreCase("true")) {
            return true;
        }
        if (text.equalsIgnoreCase("false")) {
            return false;
        }
        throw malformed(key, value, "true or false");
    }

    /**
     * @throws InvalidConfigurationException if a supplied key was never read
     */
    public void requireAllConsumed(String strategyName) {
        Set<String> unknown = new TreeSet<>(values.keySet());
        unknown.removeAll(consumed);
        if (!unknown.isEmpty()) {
            throw new InvalidConfigurationException("Unknown parameters for strategy " + strategyName + ": " + unknown);
        }
    }

    private Object read(String key) {
        consumed.add(key);
        return values.get(key);
    }

    private static InvalidConfigurationException malformed(String key, Object value, String expected) {
        return new InvalidConfigurationException("Parameter '" + key + "' must be " + expected + ", got '" + value + "'");
    }
}
