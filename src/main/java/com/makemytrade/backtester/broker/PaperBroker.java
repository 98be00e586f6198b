package com.makemytrade.backtester.broker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated broker filling every order immediately at the requested price.
 * No slippage, fees or partial fills.
 */
@Slf4j
@Component
public class PaperBroker implements Broker {

    private final AtomicLong orderIdSequence = new AtomicLong(1);

    @Override
    public OrderConfirmation placeOrder(String instrument, double quantity, OrderSide side, double price,
                                        OrderType orderType, TimeInForce timeInForce) {
        if (!(quantity > 0) || !Double.isFinite(quantity)) {
            throw new IllegalArgumentException("Order quantity must be positive, got " + quantity);
        }
        if (!(price > 0) || !Double.isFinite(price)) {
            throw new IllegalArgumentException("Order price must be positive, got " + price);
        }

        String orderId = "paper-" + orderIdSequence.getAndIncrement();
        log.debug("Paper {} {} {} {} @ {} (order {})", orderType, side, String.format("%.6f", quantity),
                instrument, String.format("%.4f", price), orderId);

        return OrderConfirmation.builder()
                .orderId(orderId)
                .instrument(instrument)
                .side(side)
                .orderType(orderType)
                .timeInForce(timeInForce)
                .quantity(quantity)
                .filledPrice(price)
                .status(OrderConfirmation.Status.FILLED)
                .build();
    }
}
