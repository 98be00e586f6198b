package com.makemytrade.backtester.exception;

import lombok.Getter;

/**
 * Base class of every failure raised by the backtester.
 * Carries an error code so callers driving several instruments can decide what to abort.
 */
@Getter
public class BacktestException extends RuntimeException {

    public enum ErrorCode {
        DATA_ERROR,
        CONFIG_ERROR,
        EXECUTION_FAILURE
    }

    private final ErrorCode errorCode;

    public BacktestException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BacktestException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
