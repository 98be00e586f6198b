package com.makemytrade.backtester.broker;

public enum OrderSide {
    BUY, SELL
}
