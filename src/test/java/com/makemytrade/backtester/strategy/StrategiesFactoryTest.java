package com.makemytrade.backtester.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.exception.BacktestException;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class StrategiesFactoryTest {

    @ParameterizedTest
    @EnumSource(StrategyType.class)
    void getStrategy_buildsEveryVariantWithDefaults(StrategyType type) {
        TradingStrategy strategy = StrategiesFactory.getStrategy(type.name());

        assertThat(strategy.getName()).isEqualTo(type.name());
        assertThat(strategy.getIndicatorSpec().getDefinitions()).isNotEmpty();
        assertThat(strategy.getSignalGenerator()).isNotNull();
        assertThat(strategy.getRiskParameters()).isNotNull();
    }

    @Test
    void getStrategy_acceptsDashedLowerCaseNames() {
        assertThat(StrategiesFactory.getStrategy("sma-profit").getName()).isEqualTo("SMA_PROFIT");
    }

    @Test
    void getStrategy_rejectsUnknownName() {
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("Martingale"))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("Martingale")
                .satisfies(e -> assertThat(((BacktestException) e).getErrorCode())
                        .isEqualTo(BacktestException.ErrorCode.CONFIG_ERROR));
    }

    @Test
    void getStrategy_rejectsUnknownParameter() {
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("EMA_CROSSOVER", Map.of("sma_period", 10)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("sma_period");
    }

    @Test
    void getStrategy_rejectsMalformedValue() {
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA", Map.of("sma_period", "ten")))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA", Map.of("sma_period", 0)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA_PROFIT",
                Map.of("short_window", 20, "long_window", 5)))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("FILTERED_DONCHIAN",
                Map.of("risk_per_trade_fraction", 1.5)))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    void getStrategy_parsesStringValuesFromConfiguration() {
        TradingStrategy strategy = StrategiesFactory.getStrategy("FILTERED_DONCHIAN",
                Map.of("stop_atr_multiple", "3.5", "min_notional", "25", "donchian_entry_window", "30"));

        assertThat(strategy.getRiskParameters().getStopAtrMultiple()).isEqualTo(3.5);
        assertThat(strategy.getRiskParameters().getMinNotional()).isEqualTo(25);
    }

    @Test
    void getStrategy_filteredDonchianOpensShortsWithAtrRisk() {
        RiskParameters risk = StrategiesFactory.getStrategy("FILTERED_DONCHIAN").getRiskParameters();

        assertThat(risk.getSizingModel()).isEqualTo(RiskParameters.SizingModel.ATR_RISK);
        assertThat(risk.getSellAction()).isEqualTo(RiskParameters.SellAction.OPEN_SHORT);
        assertThat(risk.getEntryAccounting()).isEqualTo(RiskParameters.EntryAccounting.TRACK_EXPOSURE);
        assertThat(risk.getRiskPerTradeFraction()).isEqualTo(0.005);
        assertThat(risk.getMinNotional()).isEqualTo(10);
    }

    @Test
    void getStrategy_smaUsesItsOwnRunPath() {
        TradingStrategy sma = StrategiesFactory.getStrategy("SMA");

        assertThat(sma.getRunMode()).isEqualTo(TradingStrategy.RunMode.CUSTOM);
        assertThat(sma.getRiskParameters().getInvestmentFraction()).isEqualTo(0.8);
        assertThat(StrategiesFactory.getStrategy("MACD_VOLATILITY").getRunMode())
                .isEqualTo(TradingStrategy.RunMode.GENERIC);
    }

    @Test
    void getStrategy_debitOnEntrySelectsAccounting() {
        RiskParameters debit = StrategiesFactory.getStrategy("SMA_PROFIT").getRiskParameters();
        RiskParameters track = StrategiesFactory.getStrategy("SMA_PROFIT", Map.of("debit_on_entry", "false"))
                .getRiskParameters();

        assertThat(debit.getEntryAccounting()).isEqualTo(RiskParameters.EntryAccounting.DEBIT_NOTIONAL);
        assertThat(track.getEntryAccounting()).isEqualTo(RiskParameters.EntryAccounting.TRACK_EXPOSURE);
        assertThat(track.getSizingModel()).isEqualTo(RiskParameters.SizingModel.FIXED_UNITS);
    }

    @Test
    void getStrategy_addsAtrSeriesWhenStopIsConfiguredOnMovingAverageVariants() {
        TradingStrategy withStop = StrategiesFactory.getStrategy("SMA_PROFIT",
                Map.of("stop_atr_multiple", 2, "atr_period", 5));
        TradingStrategy withoutStop = StrategiesFactory.getStrategy("SMA_PROFIT");

        assertThat(withStop.getIndicatorSpec().getDefinitions())
                .anySatisfy(definition -> assertThat(definition.getName()).isEqualTo("atr"));
        assertThat(withoutStop.getIndicatorSpec().getDefinitions())
                .noneSatisfy(definition -> assertThat(definition.getName()).isEqualTo("atr"));
        assertThat(StrategiesFactory.getStrategy("SMA", Map.of("take_profit_atr_multiple", 3))
                .getIndicatorSpec().getDefinitions())
                .anySatisfy(definition -> assertThat(definition.getName()).isEqualTo("atr"));
    }

    @Test
    void getStrategy_rejectsAtrRiskKeysOnOtherSizingModels() {
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA_PROFIT", Map.of("risk_per_trade_fraction", 0.02)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("risk_per_trade_fraction");
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA", Map.of("max_notional_fraction", 0.5)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("max_notional_fraction");
        assertThatThrownBy(() -> StrategiesFactory.getStrategy("SMA_PROFIT", Map.of("atr_period", 5)))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("atr_period");
    }

    @Test
    void getStrategy_returnsNewInstanceEachTime() {
        assertThat(StrategiesFactory.getStrategy("SMA")).isNotSameAs(StrategiesFactory.getStrategy("SMA"));
    }
}
