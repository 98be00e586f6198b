package com.makemytrade.backtester.indicator.volatility;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.PriceColumn;
import com.makemytrade.backtester.indicator.RollingWindow;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class DonchianChannel implements Indicator {

    public enum Band {
        UPPER, LOWER, WIDTH
    }

    private final Band band;
    private final int window;
    private final boolean partialWindow;

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        return switch (band) {
            case UPPER -> upper(bars);
            case LOWER -> lower(bars);
            case WIDTH -> {
                double[] upper = upper(bars);
                double[] lower = lower(bars);
                double[] width = new double[upper.length];
                for (int i = 0; i < width.length; i++) {
                    width[i] = upper[i] - lower[i];
                }
                yield width;
            }
        };
    }

    private double[] upper(List<Bar> bars) {
        return RollingWindow.max(PriceColumn.HIGH.extract(bars), window, partialWindow);
    }

    private double[] lower(List<Bar> bars) {
        return RollingWindow.min(PriceColumn.LOW.extract(bars), window, partialWindow);
    }
}
