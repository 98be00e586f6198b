package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.backtesting.model.EquityPoint;
import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.backtesting.model.Side;
import com.makemytrade.backtester.backtesting.model.Trade;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single backtest run. Never shared between runs.
 * Cash only changes through the {@link PositionManager}.
 */
public class RunContext {

    @Getter
    private final String instrument;
    @Getter
    private final double initialCapital;
    @Getter
    private final RiskParameters riskParameters;
    @Getter
    private double cash;

    private final Map<Side, Position> openPositions = new EnumMap<>(Side.class);
    private final List<Position> positions = new ArrayList<>();
    private final List<Trade> trades = new ArrayList<>();
    private final List<EquityPoint> equityCurve = new ArrayList<>();

    public RunContext(String instrument, double initialCapital, RiskParameters riskParameters) {
        this.instrument = instrument;
        this.initialCapital = initialCapital;
        this.riskParameters = riskParameters;
        this.cash = initialCapital;
    }

    public boolean hasOpenPosition(Side side) {
        return openPositions.containsKey(side);
    }

    public Position getOpenPosition(Side side) {
        return openPositions.get(side);
    }

    public Collection<Position> getOpenPositions() {
        return Collections.unmodifiableCollection(openPositions.values());
    }

    public List<Position> getPositions() {
        return Collections.unmodifiableList(positions);
    }

    public List<Trade> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<EquityPoint> getEquityCurve() {
        return Collections.unmodifiableList(equityCurve);
    }

    public double markToMarket(double price) {
        double equity = cash;
        for (Position position : openPositions.values()) {
            equity += position.markValue(price);
        }
        return equity;
    }

    public void recordEquity(Instant timestamp, double price) {
        equityCurve.add(new EquityPoint(timestamp, markToMarket(price)));
    }

    void open(Position position) {
        if (openPositions.containsKey(position.getSide())) {
            throw new IllegalStateException("A " + position.getSide() + " position is already open on " + instrument);
        }
        openPositions.put(position.getSide(), position);
        positions.add(position);
    }

    void release(Position position) {
        openPositions.remove(position.getSide(), position);
    }

    void adjustCash(double amount) {
        cash += amount;
    }

    void record(Trade trade) {
        trades.add(trade);
    }
}
