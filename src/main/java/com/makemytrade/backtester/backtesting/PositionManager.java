package com.makemytrade.backtester.backtesting;

import com.makemytrade.backtester.backtesting.model.ExitReason;
import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.backtesting.model.Side;
import com.makemytrade.backtester.backtesting.model.Trade;
import com.makemytrade.backtester.backtesting.model.TradeType;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.broker.Broker;
import com.makemytrade.backtester.broker.OrderConfirmation;
import com.makemytrade.backtester.broker.OrderSide;
import com.makemytrade.backtester.broker.OrderType;
import com.makemytrade.backtester.broker.TimeInForce;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the signals of one bar into position changes: stops first, then signal exits, then entries.
 * Stateless, all run state lives in the {@link RunContext}.
 */
@Component
@Slf4j
public class PositionManager {

    private final Broker broker;

    public PositionManager(@Autowired Broker broker) {
        this.broker = broker;
    }

    public List<Trade> onBar(int index, Bar bar, boolean buySignal, boolean sellSignal, double atr, RunContext context) {
        List<Trade> trades = new ArrayList<>(evaluateStops(bar, context));
        trades.addAll(evaluateExits(bar, sellSignal, context));
        trades.addAll(evaluateEntries(index, bar, buySignal, sellSignal, atr, context));
        return trades;
    }

    public List<Trade> evaluateStops(Bar bar, RunContext context) {
        List<Trade> trades = new ArrayList<>();

        for (Position position : new ArrayList<>(context.getOpenPositions())) {
            if (position.hasStop() && isStopHit(position, bar)) {
                trades.add(close(position, position.getStopPrice(), ExitReason.STOP, OrderType.STOP, bar, context));
            } else if (position.hasTakeProfit() && isTargetHit(position, bar)) {
                trades.add(close(position, position.getTakeProfitPrice(), ExitReason.TAKE_PROFIT, OrderType.LIMIT,
                        bar, context));
            }
        }
        return trades;
    }

    public List<Trade> evaluateExits(Bar bar, boolean sellSignal, RunContext context) {
        RiskParameters risk = context.getRiskParameters();
        Position position = context.getOpenPosition(Side.LONG);

        if (!sellSignal || risk.getSellAction() != RiskParameters.SellAction.EXIT_LONG || position == null) {
            return List.of();
        }

        double price = bar.getClose();
        if (risk.isProfitGatedExit() && !isProfitable(position, price, risk.getProfitThreshold())) {
            return List.of();
        }
        return List.of(close(position, price, ExitReason.SIGNAL, OrderType.MARKET, bar, context));
    }

    public List<Trade> evaluateEntries(int index, Bar bar, boolean buySignal, boolean sellSignal, double atr,
                                       RunContext context) {
        List<Trade> trades = new ArrayList<>();

        if (buySignal && !context.hasOpenPosition(Side.LONG)) {
            open(Side.LONG, index, bar, atr, context).ifPresent(trades::add);
        }
        if (sellSignal && context.getRiskParameters().getSellAction() == RiskParameters.SellAction.OPEN_SHORT
                && !context.hasOpenPosition(Side.SHORT)) {
            open(Side.SHORT, index, bar, atr, context).ifPresent(trades::add);
        }
        return trades;
    }

    private Optional<Trade> open(Side side, int index, Bar bar, double atr, RunContext context) {
        RiskParameters risk = context.getRiskParameters();
        double price = bar.getClose();
        boolean atrDefined = Double.isFinite(atr) && atr > 0;

        double size = calculateSize(price, atr, context);
        if (!(size > 0)) {
            return Optional.empty();
        }

        double stopPrice = Double.NaN;
        if (risk.getStopAtrMultiple() > 0 && atrDefined) {
            double stopDistance = risk.getStopAtrMultiple() * atr;
            stopPrice = side == Side.LONG ? price - stopDistance : price + stopDistance;
        }
        double takeProfitPrice = Double.NaN;
        if (risk.getTakeProfitAtrMultiple() > 0 && atrDefined) {
            double targetDistance = risk.getTakeProfitAtrMultiple() * atr;
            takeProfitPrice = side == Side.LONG ? price + targetDistance : price - targetDistance;
        }

        OrderConfirmation confirmation = broker.placeOrder(context.getInstrument(), size,
                side == Side.LONG ? OrderSide.BUY : OrderSide.SELL, price, OrderType.MARKET, TimeInForce.GTC);
        if (!confirmation.isFilled()) {
            log.warn("Entry order {} on {} was not filled", confirmation.getOrderId(), context.getInstrument());
            return Optional.empty();
        }

        double fillPrice = confirmation.getFilledPrice();
        double notional = size * fillPrice;
        boolean debit = risk.getEntryAccounting() == RiskParameters.EntryAccounting.DEBIT_NOTIONAL;

        Position position = Position.builder()
                .side(side)
                .entryPrice(fillPrice)
                .size(size)
                .stopPrice(stopPrice)
                .takeProfitPrice(takeProfitPrice)
                .entryTime(bar.getTimestamp())
                .entryIndex(index)
                .entryNotional(debit ? notional : 0)
                .build();
        context.open(position);
        if (debit) {
            context.adjustCash(-notional);
        }

        Trade trade = Trade.builder()
                .timestamp(bar.getTimestamp())
                .type(isLongOnly(risk) ? TradeType.BUY : TradeType.ENTRY)
                .side(side)
                .price(fillPrice)
                .size(size)
                .balance(context.getCash())
                .stopPrice(stopPrice)
                .build();
        context.record(trade);

        log.debug("Opened {} {} on {} at {}, size {}, stop {}", side, context.getInstrument(), bar.getTimestamp(),
                String.format("%.4f", fillPrice), String.format("%.6f", size), String.format("%.4f", stopPrice));
        return Optional.of(trade);
    }

    /**
     * @return the quantity to trade, zero or less when the entry must be skipped
     */
    double calculateSize(double price, double atr, RunContext context) {
        RiskParameters risk = context.getRiskParameters();
        double cash = context.getCash();
        double size;

        switch (risk.getSizingModel()) {
            case ATR_RISK -> {
                if (!Double.isFinite(atr) || atr <= 0 || risk.getStopAtrMultiple() <= 0) {
                    return 0;
                }
                double dollarRisk = cash * risk.getRiskPerTradeFraction();
                size = dollarRisk / (risk.getStopAtrMultiple() * atr);
                if (size * price < risk.getMinNotional()) {
                    return 0;
                }
                double maxNotional = risk.getMaxNotionalFraction() * cash;
                if (size * price > maxNotional) {
                    size = maxNotional / price;
                }
            }
            case BALANCE_FRACTION -> size = cash * risk.getInvestmentFraction() / price;
            case FIXED_UNITS -> size = risk.getFixedUnits();
            default -> throw new IllegalStateException("Unsupported sizing model " + risk.getSizingModel());
        }

        if (risk.getSizingModel() != RiskParameters.SizingModel.ATR_RISK && size * price < risk.getMinNotional()) {
            return 0;
        }
        return Double.isFinite(size) ? size : 0;
    }

    private Trade close(Position position, double price, ExitReason reason, OrderType orderType, Bar bar,
                        RunContext context) {
        RiskParameters risk = context.getRiskParameters();
        OrderConfirmation confirmation = broker.placeOrder(context.getInstrument(), position.getSize(),
                position.isLong() ? OrderSide.SELL : OrderSide.BUY, price, orderType, TimeInForce.GTC);

        double fillPrice = confirmation.getFilledPrice();
        double profit = position.close(fillPrice, bar.getTimestamp(), reason);
        context.release(position);
        context.adjustCash(position.getEntryNotional() + profit);

        Trade trade = Trade.builder()
                .timestamp(bar.getTimestamp())
                .type(reason == ExitReason.SIGNAL && isLongOnly(risk) ? TradeType.SELL : TradeType.EXIT)
                .side(position.getSide())
                .price(fillPrice)
                .size(position.getSize())
                .balance(context.getCash())
                .realizedProfit(profit)
                .exitReason(reason)
                .stopPrice(position.getStopPrice())
                .build();
        context.record(trade);

        log.debug("Closed {} {} on {} at {} ({}), profit {}", position.getSide(), context.getInstrument(),
                bar.getTimestamp(), String.format("%.4f", fillPrice), reason, String.format("%.2f", profit));
        return trade;
    }

    private static boolean isStopHit(Position position, Bar bar) {
        return position.isLong() ? bar.getLow() <= position.getStopPrice() : bar.getHigh() >= position.getStopPrice();
    }

    private static boolean isTargetHit(Position position, Bar bar) {
        return position.isLong()
                ? bar.getHigh() >= position.getTakeProfitPrice()
                : bar.getLow() <= position.getTakeProfitPrice();
    }

    private static boolean isProfitable(Position position, double price, double threshold) {
        if (price <= position.getEntryPrice()) {
            return false;
        }
        return (price - position.getEntryPrice()) / position.getEntryPrice() >= threshold;
    }

    private static boolean isLongOnly(RiskParameters risk) {
        return risk.getSellAction() == RiskParameters.SellAction.EXIT_LONG;
    }
}
