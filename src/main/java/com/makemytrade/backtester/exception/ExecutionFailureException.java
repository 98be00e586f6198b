package com.makemytrade.backtester.exception;

import lombok.Getter;

import java.time.Instant;

/**
 * Unexpected fault while replaying bars. Keeps the failing instrument and bar for the caller.
 */
@Getter
public class ExecutionFailureException extends BacktestException {
    private final String instrument;
    private final int barIndex;
    private final Instant barTimestamp;

    public ExecutionFailureException(String instrument, int barIndex, Instant barTimestamp, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILURE,
                String.format("Backtest of %s failed at bar #%d (%s): %s",
                        instrument, barIndex, barTimestamp, cause.getMessage()),
                cause);
        this.instrument = instrument;
        this.barIndex = barIndex;
        this.barTimestamp = barTimestamp;
    }

    public ExecutionFailureException(String instrument, String message, Throwable cause) {
        super(ErrorCode.EXECUTION_FAILURE, message, cause);
        this.instrument = instrument;
        this.barIndex = -1;
        this.barTimestamp = null;
    }
}
