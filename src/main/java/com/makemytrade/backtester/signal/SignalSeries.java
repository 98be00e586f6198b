package com.makemytrade.backtester.signal;

import lombok.AllArgsConstructor;

/**
 * Per-bar buy and sell flags. Buy and sell are independent so that a strategy can open a long and a short
 * from the same generator.
 */
@AllArgsConstructor
public class SignalSeries {
    private final boolean[] buy;
    private final boolean[] sell;

    public boolean isBuy(int index) {
        return buy[index];
    }

    public boolean isSell(int index) {
        return sell[index];
    }

    public Signal getSignal(int index) {
        if (buy[index]) {
            return Signal.BUY;
        }
        return sell[index] ? Signal.SELL : Signal.HOLD;
    }

    public int size() {
        return buy.length;
    }

    public long countBuys() {
        return count(buy);
    }

    public long countSells() {
        return count(sell);
    }

    private static long count(boolean[] flags) {
        long count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }
}
