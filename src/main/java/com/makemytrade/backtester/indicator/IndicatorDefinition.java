package com.makemytrade.backtester.indicator;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * One derived series to compute: its output name, the derivation, its source column or series and its windows.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class IndicatorDefinition {
    private final String name;
    private final IndicatorType type;
    @Builder.Default
    private final String source = PriceColumn.CLOSE.getKey();
    private final int window;
    // Slow span of MACD
    private final int secondaryWindow;
    // Bars the output is moved back so that bar t only sees values up to t - shift
    private final int shift;
    private final boolean partialWindow;

    public static IndicatorDefinition sma(String name, String source, int window) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.SMA).source(source).window(window).build();
    }

    public static IndicatorDefinition ema(String name, String source, int span) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.EMA).source(source).window(span).build();
    }

    public static IndicatorDefinition trueRange(String name) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.TRUE_RANGE).window(1).build();
    }

    public static IndicatorDefinition atr(String name, int period) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.ATR).window(period).build();
    }

    public static IndicatorDefinition range(String name) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.RANGE).window(1).build();
    }

    public static IndicatorDefinition donchianHigh(String name, int window) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.DONCHIAN_HIGH)
                .source(PriceColumn.HIGH.getKey()).window(window).build();
    }

    public static IndicatorDefinition donchianLow(String name, int window) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.DONCHIAN_LOW)
                .source(PriceColumn.LOW.getKey()).window(window).build();
    }

    public static IndicatorDefinition channelWidth(String name, int window) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.CHANNEL_WIDTH).window(window).build();
    }

    public static IndicatorDefinition macd(String name, String source, int fastSpan, int slowSpan) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.MACD).source(source)
                .window(fastSpan).secondaryWindow(slowSpan).build();
    }

    public static IndicatorDefinition median(String name, String source, int window) {
        return IndicatorDefinition.builder().name(name).type(IndicatorType.ROLLING_MEDIAN).source(source)
                .window(window).build();
    }

    public IndicatorDefinition withPartialWindow() {
        return toBuilder().partialWindow(true).build();
    }

    public IndicatorDefinition shiftedBy(int bars) {
        return toBuilder().shift(bars).build();
    }
}
