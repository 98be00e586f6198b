package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.backtesting.model.ExitReason;
import com.makemytrade.backtester.backtesting.model.Side;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
public class Position {

    public enum State {
        OPEN, CLOSED
    }

    private final Side side;
    private final double entryPrice;
    private final double size;
    private final double stopPrice;
    private final double takeProfitPrice;
    private final Instant entryTime;
    private final int entryIndex;
    // Cash taken out of the balance when the position was opened, zero when only exposure is tracked
    private final double entryNotional;

    private State state = State.OPEN;
    private double exitPrice = Double.NaN;
    private Instant exitTime;
    private double realizedProfit;
    private ExitReason exitReason;

    @Builder
    public Position(Side side, double entryPrice, double size, double stopPrice, double takeProfitPrice,
                    Instant entryTime, int entryIndex, double entryNotional) {
        this.side = side;
        this.entryPrice = entryPrice;
        this.size = size;
        this.stopPrice = stopPrice;
        this.takeProfitPrice = takeProfitPrice;
        this.entryTime = entryTime;
        this.entryIndex = entryIndex;
        this.entryNotional = entryNotional;
    }

    public boolean isLong() {
        return side == Side.LONG;
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public boolean hasStop() {
        return Double.isFinite(stopPrice);
    }

    public boolean hasTakeProfit() {
        return Double.isFinite(takeProfitPrice);
    }

    public double profitAt(double price) {
        return isLong() ? (price - entryPrice) * size : (entryPrice - price) * size;
    }

    /**
     * Contribution of the open position to equity at the given price.
     */
    public double markValue(double price) {
        return entryNotional + profitAt(price);
    }

    /**
     * Closes the position. A closed position never changes again.
     *
     * @return the realized profit
     */
    double close(double price, Instant time, ExitReason reason) {
        if (state == State.CLOSED) {
            throw new IllegalStateException("Position opened at " + entryTime + " is already closed");
        }
        this.exitPrice = price;
        this.exitTime = time;
        this.exitReason = reason;
        this.realizedProfit = profitAt(price);
        this.state = State.CLOSED;
        return realizedProfit;
    }
}
