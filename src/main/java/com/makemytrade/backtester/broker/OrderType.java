package com.makemytrade.backtester.broker;

public enum OrderType {
    MARKET, LIMIT, STOP
}
