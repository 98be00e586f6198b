package com.makemytrade.backtester.backtesting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.makemytrade.backtester.backtesting.model.EquityPoint;
import com.makemytrade.backtester.backtesting.model.PerformanceMetrics;
import com.makemytrade.backtester.backtesting.model.Trade;
import com.makemytrade.backtester.backtesting.model.TradeType;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsCalculatorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private final MetricsCalculator calculator = new MetricsCalculator(0.02);

    @Test
    void calculate_emptyLedgerReportsExactZeros() {
        PerformanceMetrics metrics = calculator.calculate(List.of(), equity(10_000, 9_000, 11_000), 10_000, 10_000);

        assertThat(metrics.getFinalCapital()).isEqualTo(10_000);
        assertThat(metrics.getCagr()).isZero();
        assertThat(metrics.getSharpe()).isZero();
        assertThat(metrics.getMaxDrawdown()).isZero();
        assertThat(metrics.getAvgTradesPerDay()).isZero();
        assertThat(metrics.getAvgTradesPerMonth()).isZero();
        assertThat(metrics.asMap()).containsOnlyKeys("final_capital", "cagr", "sharpe", "max_drawdown",
                "avg_trades_per_day", "avg_trades_per_month");
    }

    @Test
    void calculate_compoundsGrowthOverElapsedYears() {
        List<Trade> trades = List.of(trade(0), trade(365));

        PerformanceMetrics metrics = calculator.calculate(trades, equity(10_000, 20_000), 10_000, 20_000);

        assertThat(metrics.getCagr()).isCloseTo(Math.pow(2, 365.25 / 365) - 1, within(1e-12));
        assertThat(metrics.getFinalCapital()).isEqualTo(20_000);
        assertThat(metrics.getAvgTradesPerDay()).isCloseTo(2.0 / 365, within(1e-12));
        assertThat(metrics.getAvgTradesPerMonth()).isCloseTo(2 / (365 / 30.44), within(1e-12));
    }

    @Test
    void calculate_lostCapitalReportsCagrOfMinusOne() {
        List<Trade> trades = List.of(trade(0), trade(100));

        PerformanceMetrics metrics = calculator.calculate(trades, equity(10_000, -500), 10_000, -500);

        assertThat(metrics.getCagr()).isEqualTo(-1);
    }

    @Test
    void calculate_tradesOnSameDayHaveNoRateMetrics() {
        List<Trade> trades = List.of(trade(0), trade(0));

        PerformanceMetrics metrics = calculator.calculate(trades, equity(10_000, 10_100), 10_000, 10_100);

        assertThat(metrics.getCagr()).isZero();
        assertThat(metrics.getAvgTradesPerDay()).isZero();
        assertThat(metrics.getAvgTradesPerMonth()).isZero();
    }

    @Test
    void maxDrawdown_isLargestFallFromRunningPeak() {
        assertThat(calculator.maxDrawdown(equity(100, 120, 90, 130, 117), 100)).isCloseTo(-0.25, within(1e-12));
    }

    @Test
    void maxDrawdown_isZeroForNonDecreasingCapital() {
        assertThat(calculator.maxDrawdown(equity(100, 100, 105, 150), 100)).isZero();
    }

    @Test
    void sharpe_usesPopulationStdDevOfBarReturns() {
        // returns +10% and -10%: mean 0, population std 0.1
        double expected = (0 - 0.02 / 252) / (0.1 + 1e-10) * Math.sqrt(252);

        assertThat(calculator.sharpe(equity(100, 110, 99))).isCloseTo(expected, within(1e-9));
    }

    @Test
    void calculate_reportsFiniteValuesForFlatEquity() {
        List<Trade> trades = List.of(trade(0), trade(10));

        PerformanceMetrics metrics = calculator.calculate(trades, equity(100, 100, 100), 100, 100);

        assertThat(metrics.asMap().values()).allMatch(Double::isFinite);
        assertThat(metrics.getMaxDrawdown()).isZero();
    }

    private static Trade trade(int day) {
        return Trade.builder()
                .timestamp(START.plus(Duration.ofDays(day)))
                .type(TradeType.ENTRY)
                .price(100)
                .size(1)
                .build();
    }

    private static List<EquityPoint> equity(double... values) {
        List<EquityPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(new EquityPoint(START.plus(Duration.ofDays(i)), values[i]));
        }
        return points;
    }
}
