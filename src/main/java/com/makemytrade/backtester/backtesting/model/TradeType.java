package com.makemytrade.backtester.backtesting.model;

/**
 * BUY/SELL are recorded by long-only strategies whose sell signal closes the long,
 * ENTRY/EXIT by strategies trading both sides and for every stop or take-profit exit.
 */
public enum TradeType {
    BUY, SELL, ENTRY, EXIT
}
