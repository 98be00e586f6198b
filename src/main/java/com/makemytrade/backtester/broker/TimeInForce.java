package com.makemytrade.backtester.broker;

public enum TimeInForce {
    GTC, IOC, FOK
}
