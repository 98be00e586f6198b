package com.makemytrade.backtester.backtesting.model;

public enum Side {
    LONG, SHORT
}
