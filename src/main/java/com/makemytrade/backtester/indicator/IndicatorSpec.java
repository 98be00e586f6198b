package com.makemytrade.backtester.indicator;

import com.makemytrade.backtester.exception.InvalidConfigurationException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered derivations of a strategy. A definition may use any series defined before it as its source.
 */
@Getter
public class IndicatorSpec {
    private final List<IndicatorDefinition> definitions;

    private IndicatorSpec(List<IndicatorDefinition> definitions) {
        this.definitions = List.copyOf(definitions);
    }

    public static IndicatorSpec of(IndicatorDefinition... definitions) {
        return of(List.of(definitions));
    }

    public static IndicatorSpec of(List<IndicatorDefinition> definitions) {
        Set<String> names = new HashSet<>();
        for (IndicatorDefinition definition : definitions) {
            validate(definition);
            if (!names.add(definition.getName())) {
                throw new InvalidConfigurationException("Duplicate indicator name: " + definition.getName());
            }
        }
        return new IndicatorSpec(new ArrayList<>(definitions));
    }

    private static void validate(IndicatorDefinition definition) {
        if (definition.getName() == null || definition.getName().isBlank()) {
            throw new InvalidConfigurationException("Indicator name is required: " + definition);
        }
        if (definition.getType() == null) {
            throw new InvalidConfigurationException("Indicator type is required: " + definition);
        }
        if (definition.getWindow() < 1) {
            throw new InvalidConfigurationException("Window of " + definition.getName() + " must be at least 1, got "
                    + definition.getWindow());
        }
        if (definition.getType() == IndicatorType.MACD && definition.getSecondaryWindow() < 1) {
            throw new InvalidConfigurationException("Slow span of " + definition.getName() + " must be at least 1");
        }
        if (definition.getShift() < 0) {
            throw new InvalidConfigurationException("Shift of " + definition.getName() + " cannot be negative");
        }
    }
}
