package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.backtesting.model.BacktestResult;
import com.makemytrade.backtester.backtesting.model.PerformanceMetrics;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.BarValidator;
import com.makemytrade.backtester.config.BacktesterProperties;
import com.makemytrade.backtester.exception.BacktestException;
import com.makemytrade.backtester.exception.ExecutionFailureException;
import com.makemytrade.backtester.strategy.TradingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Service
@Slf4j
public class Backtester {

    private final SimulationLoop simulationLoop;
    private final MetricsCalculator metricsCalculator;
    private final double defaultInitialCapital;

    public Backtester(@Autowired SimulationLoop simulationLoop,
                      @Autowired MetricsCalculator metricsCalculator,
                      @Autowired BacktesterProperties properties) {
        this.simulationLoop = simulationLoop;
        this.metricsCalculator = metricsCalculator;
        this.defaultInitialCapital = properties.getInitialCapital();
    }

    public BacktestResult run(TradingStrategy strategy, String instrument, List<Bar> bars) {
        return run(strategy, instrument, bars, defaultInitialCapital);
    }

    public BacktestResult run(TradingStrategy strategy, String instrument, List<Bar> bars, double initialCapital) {
        try {
            BarValidator.validate(instrument, bars);
            log.info("Backtesting {} on {} with {} bars ({} run path)", strategy.getName(), instrument, bars.size(),
                    strategy.getRunMode());

            RunContext context = new RunContext(instrument, initialCapital, strategy.getRiskParameters());
            if (strategy.getRunMode() == TradingStrategy.RunMode.CUSTOM) {
                strategy.backtest(bars, context, simulationLoop);
            } else {
                simulationLoop.run(strategy, bars, context);
            }

            double finalCapital = context.getCash();
            PerformanceMetrics metrics = metricsCalculator.calculate(context.getTrades(), context.getEquityCurve(),
                    initialCapital, finalCapital);

            log.info("{} on {} done: {} trades, final capital {}", strategy.getName(), instrument,
                    context.getTrades().size(), String.format("%.2f", finalCapital));

            return BacktestResult.builder()
                    .instrument(instrument)
                    .strategyName(strategy.getName())
                    .initialCapital(initialCapital)
                    .trades(context.getTrades())
                    .equityCurve(context.getEquityCurve())
                    .positions(context.getPositions())
                    .metrics(metrics)
                    .build();
        } catch (BacktestException e) {
            log.error("Backtest of {} on {} failed: {}", strategy.getName(), instrument, e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Backtest of {} on {} failed unexpectedly", strategy.getName(), instrument, e);
            throw new ExecutionFailureException(instrument, "Backtest of " + instrument + " failed: " + e.getMessage(), e);
        }
    }

    public Mono<BacktestResult> runAsync(TradingStrategy strategy, String instrument, List<Bar> bars) {
        return Mono.fromCallable(() -> run(strategy, instrument, bars))
                .subscribeOn(Schedulers.parallel());
    }

    /**
     * Runs every instrument independently, each with a fresh strategy from the supplier.
     * Without failFast a failed instrument is logged and skipped.
     */
    public Flux<BacktestResult> runAll(Supplier<TradingStrategy> strategySupplier,
                                       Map<String, List<Bar>> barsByInstrument,
                                       boolean failFast) {
        return Flux.fromIterable(barsByInstrument.entrySet())
                .flatMap(entry -> runAsync(strategySupplier.get(), entry.getKey(), entry.getValue())
                        .onErrorResume(e -> {
                            if (failFast) {
                                return Mono.error(e);
                            }
                            log.warn("Skipping {} after failed backtest: {}", entry.getKey(), e.getMessage());
                            return Mono.empty();
                        }));
    }
}
