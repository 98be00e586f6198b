package com.makemytrade.backtester.broker;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class OrderConfirmation {

    public enum Status {
        FILLED, REJECTED
    }

    private final String orderId;
    private final String instrument;
    private final OrderSide side;
    private final OrderType orderType;
    private final TimeInForce timeInForce;
    private final double quantity;
    private final double filledPrice;
    private final Status status;

    public boolean isFilled() {
        return status == Status.FILLED;
    }
}
