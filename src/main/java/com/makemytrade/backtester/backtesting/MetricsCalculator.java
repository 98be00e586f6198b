package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.backtesting.model.EquityPoint;
import com.makemytrade.backtester.backtesting.model.PerformanceMetrics;
import com.makemytrade.backtester.backtesting.model.Trade;
import com.makemytrade.backtester.config.BacktesterProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary statistics of a finished run. Never throws, every reported value is finite.
 */
@Component
@Slf4j
public class MetricsCalculator {

    static final double EPSILON = 1e-10;
    static final int TRADING_DAYS_PER_YEAR = 252;
    static final double DAYS_PER_YEAR = 365.25;
    static final double DAYS_PER_MONTH = 30.44;

    private final double riskFreeRate;

    @Autowired
    public MetricsCalculator(BacktesterProperties properties) {
        this(properties.getRiskFreeRate());
    }

    public MetricsCalculator(double riskFreeRate) {
        this.riskFreeRate = riskFreeRate;
    }

    public PerformanceMetrics calculate(List<Trade> trades, List<EquityPoint> equityCurve,
                                        double initialCapital, double finalCapital) {
        if (trades.isEmpty()) {
            return PerformanceMetrics.empty(initialCapital);
        }

        long days = Duration.between(trades.get(0).getTimestamp(), trades.get(trades.size() - 1).getTimestamp())
                .toDays();

        return PerformanceMetrics.builder()
                .finalCapital(finalCapital)
                .cagr(finite(cagr(initialCapital, finalCapital, days)))
                .sharpe(finite(sharpe(equityCurve)))
                .maxDrawdown(finite(maxDrawdown(equityCurve, initialCapital)))
                .avgTradesPerDay(days > 0 ? (double) trades.size() / days : 0)
                .avgTradesPerMonth(days > 0 ? trades.size() / (days / DAYS_PER_MONTH) : 0)
                .build();
    }

    double cagr(double initialCapital, double finalCapital, long days) {
        double years = days / DAYS_PER_YEAR;
        if (years <= 0 || initialCapital <= 0) {
            return 0;
        }
        double ratio = finalCapital / initialCapital;
        if (ratio <= 0) {
            return -1;
        }
        return Math.pow(ratio, 1 / years) - 1;
    }

    double sharpe(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).getEquity();
            double current = equityCurve.get(i).getEquity();
            double periodReturn = (current - previous) / previous;
            if (Double.isFinite(periodReturn)) {
                returns.add(periodReturn);
            }
        }
        if (returns.isEmpty()) {
            return 0;
        }

        double mean = returns.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double variance = returns.stream().mapToDouble(r -> (r - mean) * (r - mean)).average().orElse(0);
        double excessReturn = mean - riskFreeRate / TRADING_DAYS_PER_YEAR;
        return excessReturn / (Math.sqrt(variance) + EPSILON) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Largest fall from a running peak of the capital, as a fraction. Zero or negative.
     */
    double maxDrawdown(List<EquityPoint> equityCurve, double initialCapital) {
        double peak = initialCapital;
        double maxDrawdown = 0;
        for (EquityPoint point : equityCurve) {
            double equity = point.getEquity();
            peak = Math.max(peak, equity);
            if (peak > 0) {
                maxDrawdown = Math.min(maxDrawdown, (equity - peak) / peak);
            }
        }
        return maxDrawdown;
    }

    private static double finite(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
