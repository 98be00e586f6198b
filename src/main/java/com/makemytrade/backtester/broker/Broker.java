package com.makemytrade.backtester.broker;

/**
 * Places the orders produced by the position manager.
 */
public interface Broker {

    OrderConfirmation placeOrder(String instrument, double quantity, OrderSide side, double price,
                                 OrderType orderType, TimeInForce timeInForce);
}
