package com.makemytrade.backtester.exception;

/**
 * Unknown or invalid strategy, timeframe or parameter. Raised while resolving configuration, never mid-run.
 */
public class InvalidConfigurationException extends BacktestException {

    public InvalidConfigurationException(String message) {
        super(ErrorCode.CONFIG_ERROR, message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIG_ERROR, message, cause);
    }
}
