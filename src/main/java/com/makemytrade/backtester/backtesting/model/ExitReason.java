package com.makemytrade.backtester.backtesting.model;

public enum ExitReason {
    SIGNAL, STOP, TAKE_PROFIT
}
