package com.makemytrade.backtester.indicator;

import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.indicator.baseline.EMA;
import com.makemytrade.backtester.indicator.baseline.SMA;
import com.makemytrade.backtester.indicator.misc.MACD;
import com.makemytrade.backtester.indicator.misc.RollingMedian;
import com.makemytrade.backtester.indicator.volatility.ATR;
import com.makemytrade.backtester.indicator.volatility.BarRange;
import com.makemytrade.backtester.indicator.volatility.DonchianChannel;
import com.makemytrade.backtester.indicator.volatility.TrueRange;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes the derived series of an {@link IndicatorSpec} in definition order. Pure function of the bars: bar t only ever reads
 * bars up to t.
 */
@Component
@Slf4j
public class IndicatorEngine {

    public DerivedSeriesSet compute(List<Bar> bars, IndicatorSpec spec) {
        DerivedSeriesSet computed = new DerivedSeriesSet();

        for (IndicatorDefinition definition : spec.getDefinitions()) {
            double[] values = create(definition).calculate(bars, computed);
            if (definition.getShift() > 0) {
                values = RollingWindow.shift(values, definition.getShift());
            }
            computed.put(new DerivedSeries(definition.getName(), values));
        }

        log.debug("Computed {} derived series over {} bars", spec.getDefinitions().size(), bars.size());
        return computed;
    }

    private static Indicator create(IndicatorDefinition definition) {
        boolean partial = definition.isPartialWindow();
        int window = definition.getWindow();

        return switch (definition.getType()) {
            case SMA -> new SMA(definition.getSource(), window, partial);
            case EMA -> new EMA(definition.getSource(), window);
            case TRUE_RANGE -> new TrueRange();
            case ATR -> new ATR(window, partial);
            case RANGE -> new BarRange();
            case DONCHIAN_HIGH -> new DonchianChannel(DonchianChannel.Band.UPPER, window, partial);
            case DONCHIAN_LOW -> new DonchianChannel(DonchianChannel.Band.LOWER, window, partial);
            case CHANNEL_WIDTH -> new DonchianChannel(DonchianChannel.Band.WIDTH, window, partial);
            case MACD -> new MACD(definition.getSource(), window, definition.getSecondaryWindow());
            case ROLLING_MEDIAN -> new RollingMedian(definition.getSource(), window, partial);
        };
    }
}
