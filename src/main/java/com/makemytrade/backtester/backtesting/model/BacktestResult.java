package com.makemytrade.backtester.backtesting.model;

import com.makemytrade.backtester.backtesting.Position;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

@Getter
@Builder
public class BacktestResult {
    private final String instrument;
    private final String strategyName;
    private final double initialCapital;
    private final List<Trade> trades;
    private final List<EquityPoint> equityCurve;
    private final List<Position> positions;
    private final PerformanceMetrics metrics;

    public long getOpenPositionCount() {
        return positions.stream().filter(Position::isOpen).count();
    }
}
