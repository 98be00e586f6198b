package com.makemytrade.backtester.strategy;

import com.makemytrade.backtester.strategy.concrete.DonchianAtrStrategy;
import com.makemytrade.backtester.strategy.concrete.EmaCrossoverStrategy;
import com.makemytrade.backtester.strategy.concrete.FilteredDonchianStrategy;
import com.makemytrade.backtester.strategy.concrete.MacdVolatilityStrategy;
import com.makemytrade.backtester.strategy.concrete.SmaProfitStrategy;
import com.makemytrade.backtester.strategy.concrete.SmaStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@Slf4j
public class StrategiesFactory {

    /**
     * Builds a fresh strategy, so runs never share one.
     * Unknown names, unknown parameters and malformed values raise an InvalidConfigurationException.
     */
    public static TradingStrategy getStrategy(String strategyName, Map<String, ?> strategyParameters) {
        StrategyType type = StrategyType.fromName(strategyName);
        StrategyParameters parameters = new StrategyParameters(strategyParameters);

        TradingStrategy strategy = switch (type) {
            case SMA -> new SmaStrategy(parameters);
            case SMA_PROFIT -> new SmaProfitStrategy(parameters);
            case EMA_CROSSOVER -> new EmaCrossoverStrategy(parameters);
            case DONCHIAN_ATR -> new DonchianAtrStrategy(parameters);
            case FILTERED_DONCHIAN -> new FilteredDonchianStrategy(parameters);
            case MACD_VOLATILITY -> new MacdVolatilityStrategy(parameters);
        };
        parameters.requireAllConsumed(type.name());

        log.debug("Built strategy {} with risk parameters {}", type, strategy.getRiskParameters());
        return strategy;
    }

    public static TradingStrategy getStrategy(String strategyName) {
        return getStrategy(strategyName, Map.of());
    }
}
