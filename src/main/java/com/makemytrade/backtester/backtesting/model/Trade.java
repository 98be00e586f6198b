package com.makemytrade.backtester.backtesting.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@Builder
@ToString
public class Trade {
    private final Instant timestamp;
    private final TradeType type;
    private final Side side;
    private final double price;
    private final double size;
    // Cash balance right after this trade
    private final double balance;
    // Only set on exits
    private final Double realizedProfit;
    private final ExitReason exitReason;
    private final double stopPrice;

    public boolean isExit() {
        return realizedProfit != null;
    }
}
