package com.makemytrade.backtester.strategy.concrete;

import com.makemytrade.backtester.backtesting.PositionManager;
import com.makemytrade.backtester.backtesting.RunContext;
import com.makemytrade.backtester.backtesting.SimulationLoop;
import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.backtesting.model.Side;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.exception.BacktestException;
import com.makemytrade.backtester.exception.ExecutionFailureException;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.indicator.DerivedSeries;
import com.makemytrade.backtester.indicator.DerivedSeriesSet;
import com.makemytrade.backtester.indicator.IndicatorDefinition;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.Conditions;
import com.makemytrade.backtester.signal.Operand;
import com.makemytrade.backtester.signal.SignalGenerator;
import com.makemytrade.backtester.signal.SignalSeries;
import com.makemytrade.backtester.strategy.BaseStrategy;
import com.makemytrade.backtester.strategy.StrategyParameters;
import com.makemytrade.backtester.strategy.StrategyType;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Buys when the low comes back above the SMA and sells once the high falls under it, but only with enough profit.
 * Equity is sampled at each bar before the bar's orders, so it has its own run path.
 */
@Slf4j
public class SmaStrategy extends BaseStrategy {

    private final int smaPeriod;
    private final double balanceInvestmentFraction;
    private final double profitThreshold;

    public SmaStrategy(StrategyParameters parameters) {
        super(StrategyType.SMA);
        this.smaPeriod = parameters.getPositiveInt("sma_period", 200);
        double investmentPct = parameters.getNonNegativeDouble("balance_investment_pct", 80);
        if (investmentPct <= 0 || investmentPct > 100) {
            throw new InvalidConfigurationException("balance_investment_pct must be in (0, 100], got " + investmentPct);
        }
        this.balanceInvestmentFraction = investmentPct / 100;
        this.profitThreshold = parameters.getNonNegativeDouble("profit_threshold", 0.20);
        initialize(parameters);
    }

    @Override
    protected IndicatorSpec buildIndicatorSpec() {
        return IndicatorSpec.of(IndicatorDefinition.sma("sma", "close", smaPeriod).withPartialWindow());
    }

    @Override
    protected SignalGenerator buildSignalGenerator() {
        return new SignalGenerator(
                Conditions.and(
                        Conditions.greaterThan("low", "sma"),
                        Conditions.lessThan(Operand.of("low").previous(), Operand.of("sma").previous())),
                Conditions.lessThan("high", "sma"));
    }

    @Override
    protected RiskParameters defaultRiskParameters() {
        return RiskParameters.builder()
                .sizingModel(RiskParameters.SizingModel.BALANCE_FRACTION)
                .investmentFraction(balanceInvestmentFraction)
                .entryAccounting(RiskParameters.EntryAccounting.DEBIT_NOTIONAL)
                .sellAction(RiskParameters.SellAction.EXIT_LONG)
                .profitGatedExit(true)
                .profitThreshold(profitThreshold)
                .stopAtrMultiple(0)
                .build();
    }

    @Override
    public RunMode getRunMode() {
        return RunMode.CUSTOM;
    }

    @Override
    public void backtest(List<Bar> bars, RunContext context, SimulationLoop simulationLoop) {
        PositionManager positionManager = simulationLoop.getPositionManager();
        DerivedSeriesSet derived = simulationLoop.getIndicatorEngine().compute(bars, getIndicatorSpec());
        SignalSeries signals = getSignalGenerator().generate(bars, derived);
        DerivedSeries atr = derived.find(getAtrSeriesName()).orElse(null);

        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            try {
                context.recordEquity(bar.getTimestamp(), bar.getClose());
                positionManager.evaluateStops(bar, context);

                if (signals.isBuy(i) && !context.hasOpenPosition(Side.LONG)) {
                    double atrValue = atr != null ? atr.get(i) : Double.NaN;
                    positionManager.evaluateEntries(i, bar, true, false, atrValue, context);
                } else if (signals.isSell(i)) {
                    positionManager.evaluateExits(bar, true, context);
                }
            } catch (BacktestException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ExecutionFailureException(context.getInstrument(), i, bar.getTimestamp(), e);
            }
        }
        log.debug("SMA({}) run on {} recorded {} trades", smaPeriod, context.getInstrument(), context.getTrades().size());
    }
}
