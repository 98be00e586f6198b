package com.makemytrade.backtester.signal;

public enum Signal {
    BUY, SELL, HOLD
}
