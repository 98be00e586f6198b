package com.makemytrade.backtester.strategy;

import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.exception.InvalidConfigurationException;
import com.makemytrade.backtester.indicator.IndicatorDefinition;
import com.makemytrade.backtester.indicator.IndicatorSpec;
import com.makemytrade.backtester.signal.SignalGenerator;

import java.util.ArrayList;
import java.util.List;

/**
 * A strategy variant as configuration: indicators, signal rules and risk parameters, all resolved once from the
 * strategy parameters when the strategy is built.
 */
public abstract class BaseStrategy implements TradingStrategy {

    public static final String RISK_PER_TRADE_FRACTION = "risk_per_trade_fraction";
    public static final String STOP_ATR_MULTIPLE = "stop_atr_multiple";
    public static final String TAKE_PROFIT_ATR_MULTIPLE = "take_profit_atr_multiple";
    public static final String MAX_NOTIONAL_FRACTION = "max_notional_fraction";
    public static final String MIN_NOTIONAL = "min_notional";
    public static final String ATR_PERIOD = "atr_period";
    public static final int DEFAULT_ATR_PERIOD = 14;

    private final StrategyType type;
    private IndicatorSpec indicatorSpec;
    private SignalGenerator signalGenerator;
    private RiskParameters riskParameters;

    protected BaseStrategy(StrategyType type) {
        this.type = type;
    }

    /**
     * Builds indicators, signal rules and risk parameters. Subclasses call it at the end of their constructor,
     * once their own parameters are read.
     */
    protected final void initialize(StrategyParameters parameters) {
        this.riskParameters = applyCommonRiskParameters(defaultRiskParameters().toBuilder(), parameters).build();
        this.indicatorSpec = withExitAtr(buildIndicatorSpec(), parameters);
        this.signalGenerator = buildSignalGenerator();
    }

    protected abstract IndicatorSpec buildIndicatorSpec();

    protected abstract SignalGenerator buildSignalGenerator();

    protected abstract RiskParameters defaultRiskParameters();

    private static RiskParameters.RiskParametersBuilder applyCommonRiskParameters(
            RiskParameters.RiskParametersBuilder builder, StrategyParameters parameters) {
        RiskParameters defaults = builder.build();

        // Risk and notional fractions only size ATR-risk entries, other sizing models reject them as unknown
        if (defaults.getSizingModel() == RiskParameters.SizingModel.ATR_RISK) {
            double riskFraction = parameters.getNonNegativeDouble(RISK_PER_TRADE_FRACTION,
                    defaults.getRiskPerTradeFraction());
            double maxNotionalFraction = parameters.getNonNegativeDouble(MAX_NOTIONAL_FRACTION,
                    defaults.getMaxNotionalFraction());
            if (riskFraction > 1 || maxNotionalFraction > 1) {
                throw new InvalidConfigurationException(
                        RISK_PER_TRADE_FRACTION + " and " + MAX_NOTIONAL_FRACTION + " must be fractions between 0 and 1");
            }
            builder.riskPerTradeFraction(riskFraction).maxNotionalFraction(maxNotionalFraction);
        }

        return builder
                .stopAtrMultiple(parameters.getNonNegativeDouble(STOP_ATR_MULTIPLE, defaults.getStopAtrMultiple()))
                .takeProfitAtrMultiple(parameters.getNonNegativeDouble(TAKE_PROFIT_ATR_MULTIPLE,
                        defaults.getTakeProfitAtrMultiple()))
                .minNotional(parameters.getNonNegativeDouble(MIN_NOTIONAL, defaults.getMinNotional()));
    }

    /**
     * Appends an ATR series for stops and targets when they are configured and the variant computes none itself.
     */
    private IndicatorSpec withExitAtr(IndicatorSpec spec, StrategyParameters parameters) {
        boolean atrExits = riskParameters.getStopAtrMultiple() > 0 || riskParameters.getTakeProfitAtrMultiple() > 0;
        boolean hasAtr = spec.getDefinitions().stream()
                .anyMatch(definition -> definition.getName().equals(getAtrSeriesName()));
        if (!atrExits || hasAtr) {
            return spec;
        }

        List<IndicatorDefinition> definitions = new ArrayList<>(spec.getDefinitions());
        definitions.add(IndicatorDefinition.atr(getAtrSeriesName(),
                parameters.getPositiveInt(ATR_PERIOD, DEFAULT_ATR_PERIOD)).withPartialWindow());
        return IndicatorSpec.of(definitions);
    }

    @Override
    public String getName() {
        return type.name();
    }

    public StrategyType getType() {
        return type;
    }

    @Override
    public IndicatorSpec getIndicatorSpec() {
        return indicatorSpec;
    }

    @Override
    public SignalGenerator getSignalGenerator() {
        return signalGenerator;
    }

    @Override
    public RiskParameters getRiskParameters() {
        return riskParameters;
    }
}
