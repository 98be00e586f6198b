package com.makemytrade.backtester.backtesting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.makemytrade.backtester.backtesting.model.EquityPoint;
import com.makemytrade.backtester.backtesting.model.RiskParameters;
import com.makemytrade.backtester.backtesting.model.Side;
import com.makemytrade.backtester.bar.Bar;
import com.makemytrade.backtester.bar.TestBars;
import com.makemytrade.backtester.broker.Broker;
import com.makemytrade.backtester.broker.PaperBroker;
import com.makemytrade.backtester.exception.ExecutionFailureException;
import com.makemytrade.backtester.indicator.IndicatorEngine;
import java.util.List;
import org.junit.jupiter.api.Test;

class SimulationLoopTest {

    private final SimulationLoop loop = new SimulationLoop(new IndicatorEngine(), new PositionManager(new PaperBroker()));

    @Test
    void run_recordsOneEquityPointPerBarInOrder() {
        List<Bar> bars = TestBars.fromCloses(100, 101, 102, 103, 104);
        RunContext context = new RunContext("BTC", 10_000, RiskParameters.builder().build());

        loop.run(strategy(new boolean[]{false, true, false, false, false}, new boolean[5]), bars, context);

        List<EquityPoint> equity = context.getEquityCurve();
        assertThat(equity).hasSize(bars.size());
        for (int i = 0; i < bars.size(); i++) {
            assertThat(equity.get(i).getTimestamp()).isEqualTo(bars.get(i).getTimestamp());
        }
        assertThat(equity.get(0).getEquity()).isEqualTo(10_000);
        assertThat(equity.get(4).getEquity()).isGreaterThan(10_000);
    }

    @Test
    void run_keepsCapitalFlatWithoutSignals() {
        List<Bar> bars = TestBars.fromCloses(100, 90, 80);
        RunContext context = new RunContext("BTC", 10_000, RiskParameters.builder().build());

        loop.run(strategy(new boolean[3], new boolean[3]), bars, context);

        assertThat(context.getTrades()).isEmpty();
        assertThat(context.getEquityCurve()).extracting(EquityPoint::getEquity).containsOnly(10_000.0);
    }

    @Test
    void run_leavesPositionsOpenAfterLastBar() {
        List<Bar> bars = TestBars.fromCloses(100, 101, 102);
        RunContext context = new RunContext("BTC", 10_000, RiskParameters.builder().build());

        loop.run(strategy(new boolean[]{false, false, true}, new boolean[3]), bars, context);

        assertThat(context.hasOpenPosition(Side.LONG)).isTrue();
        assertThat(context.getCash()).isEqualTo(10_000);
        assertThat(context.getEquityCurve()).hasSize(3);
    }

    @Test
    void run_wrapsUnexpectedFaultWithBarContext() {
        Broker broker = mock(Broker.class);
        when(broker.placeOrder(any(), anyDouble(), any(), anyDouble(), any(), any()))
                .thenThrow(new IllegalStateException("exchange down"));
        SimulationLoop failingLoop = new SimulationLoop(new IndicatorEngine(), new PositionManager(broker));
        List<Bar> bars = TestBars.fromCloses(100, 101, 102);
        RunContext context = new RunContext("BTC", 10_000, RiskParameters.builder().build());

        assertThatThrownBy(() -> failingLoop.run(strategy(new boolean[]{false, true, false}, new boolean[3]), bars,
                context))
                .isInstanceOfSatisfying(ExecutionFailureException.class, e -> {
                    assertThat(e.getInstrument()).isEqualTo("BTC");
                    assertThat(e.getBarIndex()).isEqualTo(1);
                    assertThat(e.getBarTimestamp()).isEqualTo(bars.get(1).getTimestamp());
                    assertThat(e.getCause()).hasMessage("exchange down");
                });
    }

    private static FixedSignalStrategy strategy(boolean[] buy, boolean[] sell) {
        return new FixedSignalStrategy(buy, sell, RiskParameters.builder().build());
    }
}
