package com.makemytrade.backtester.indicator;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.exception.InvalidDataException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class DerivedSeriesSet {
    private final Map<String, DerivedSeries> series = new LinkedHashMap<>();

    public void put(DerivedSeries derivedSeries) {
        series.put(derivedSeries.getName(), derivedSeries);
    }

    public boolean contains(String name) {
        return series.containsKey(name);
    }

    /**
     * @throws InvalidDataException if no series with this name was computed
     */
    public DerivedSeries get(String name) {
        DerivedSeries derivedSeries = series.get(name);
        if (derivedSeries == null) {
            throw new InvalidDataException("Derived series '" + name + "' is not available, computed: " + series.keySet());
        }
        return derivedSeries;
    }

    public Optional<DerivedSeries> find(String name) {
        return Optional.ofNullable(series.get(name));
    }

    /**
     * Values of a price column or of a previously computed series.
     */
    public double[] resolve(String source, List<Bar> bars) {
        Optional<PriceColumn> column = PriceColumn.fromKey(source);
        if (column.isPresent()) {
            return column.get().extract(bars);
        }
        return get(source).getValues();
    }

    public Map<String, DerivedSeries> asMap() {
        return Collections.unmodifiableMap(series);
    }
}
