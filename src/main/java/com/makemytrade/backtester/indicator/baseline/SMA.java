package com.makemytrade.backtester.indicator.baseline;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.Indicator;
import com.makemytrade.backtester.indicator.RollingWindow;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

@Getter
@AllArgsConstructor
public class SMA implements Indicator {
    private final String source;
    private final int period;
    private final boolean partialWindow;

    @Override
    public double[] calculate(List<Bar> bars, DerivedSeriesSet computed) {
        return RollingWindow.mean(computed.resolve(source, bars), period, partialWindow);
    }
}
