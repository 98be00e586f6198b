package com.makemytrade.backtester;

import com.makemytrade.backtester.backtesting.Backtester;
import com.makemytrade.backtester.backtesting.model.BacktestResult;
import com.makemytrade.backtester.backtesting.model.PerformanceMetrics;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.HistoricalDataFetcher;
import com.makemytrade.backtester.bar.Timeframe;
import com.makemytrade.backtester.config.BacktesterProperties;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.strategy.StrategiesFactory;
import com.makemytrade.backtester.strategy.TradingStrategy;
import com.makemytrade.backtester.visualization.XChartVisualizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


@Service
@Slf4j
public class MainBacktester implements ApplicationRunner {

    private final HistoricalDataFetcher dataFetcher;
    private final Backtester backtester;
    private final XChartVisualizer visualizer;
    private final BacktesterProperties properties;

    public MainBacktester(@Autowired HistoricalDataFetcher dataFetcher,
                          @Autowired Backtester backtester,
                          @Autowired XChartVisualizer visualizer,
                          @Autowired BacktesterProperties properties) {
        this.dataFetcher = dataFetcher;
        this.backtester = backtester;
        this.visualizer = visualizer;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("Backtesting on startup is disabled");
            return;
        }

        // Configuration problems must surface before any data is fetched
        Timeframe timeframe = Timeframe.fromCode(properties.getTimeframe());
        String strategyName = properties.getStrategy();
        Map<String, Object> strategyParameters = properties.getStrategyParameters();
        TradingStrategy strategy = StrategiesFactory.getStrategy(strategyName, strategyParameters);
        if (!properties.getStart().isBefore(properties.getEnd())) {
            throw new InvalidConfigurationException("Backtest start " + properties.getStart()
                    + " must be before end " + properties.getEnd());
        }

        log.info("Starting backtesting of {} on {} ({}) from {} to {}", strategy.getName(),
                properties.getInstruments(), timeframe.getCode(), properties.getStart(), properties.getEnd());

        Map<String, List<Bar>> barsByInstrument = new LinkedHashMap<>();
        for (String instrument : properties.getInstruments()) {
            try {
                List<Bar> bars = dataFetcher
                        .fetchHistory(properties.getStart(), properties.getEnd(), instrument, timeframe)
                        .collectList()
                        .block();
                log.info("Retrieved {} bars for {}", bars.size(), instrument);
                barsByInstrument.put(instrument, bars);
            } catch (RuntimeException e) {
                if (properties.isFailFast()) {
                    throw e;
                }
                log.error("Could not retrieve bars for {}, skipping it", instrument, e);
            }
        }

        List<BacktestResult> results = backtester.runAll(
                        () -> StrategiesFactory.getStrategy(strategyName, strategyParameters),
                        barsByInstrument,
                        properties.isFailFast())
                .doOnNext(this::report)
                .collectList()
                .block();

        log.info("Backtesting completed! {} of {} instruments succeeded", results.size(), barsByInstrument.size());
    }

    private void report(BacktestResult result) {
        PerformanceMetrics metrics = result.getMetrics();

        log.info("==== {} on {} ====", result.getStrategyName(), result.getInstrument());
        log.info("Final Portfolio Value: ${}", String.format("%.2f", metrics.getFinalCapital()));
        log.info("CAGR: {}%", String.format("%.2f", metrics.getCagr() * 100));
        log.info("Sharpe Ratio: {}", String.format("%.2f", metrics.getSharpe()));
        log.info("Max Drawdown: {}%", String.format("%.2f", metrics.getMaxDrawdown() * 100));
        log.info("Avg Trades / Day: {}", String.format("%.2f", metrics.getAvgTradesPerDay()));
        log.info("Avg Trades / Month: {}", String.format("%.2f", metrics.getAvgTradesPerMonth()));
        log.info("Trades: {}, positions still open: {}", result.getTrades().size(), result.getOpenPositionCount());

        if (properties.isChartsEnabled()) {
            visualizer.generateEquityCurve(result, properties.getChartDirectory());
        }
    }
}
