package com.makemytrade.backtester.indicator;

public enum IndicatorType {
    SMA,
    EMA,
    TRUE_RANGE,
    ATR,
    RANGE,
    DONCHIAN_HIGH,
    DONCHIAN_LOW,
    CHANNEL_WIDTH,
    MACD,
    ROLLING_MEDIAN
}
