package com.makemytrade.backtester.backtesting.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
@ToString
@AllArgsConstructor
public class PerformanceMetrics {
    private final double finalCapital;
    private final double cagr;
    private final double sharpe;
    private final double maxDrawdown;
    private final double avgTradesPerDay;
    private final double avgTradesPerMonth;

    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(initialCapital, 0, 0, 0, 0, 0);
    }

    public Map<String, Double> asMap() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("final_capital", finalCapital);
        metrics.put("cagr", cagr);
        metrics.put("sharpe", sharpe);
        metrics.put("max_drawdown", maxDrawdown);
        metrics.put("avg_trades_per_day", avgTradesPerDay);
        metrics.put("avg_trades_per_month", avgTradesPerMonth);
        return metrics;
    }
}
