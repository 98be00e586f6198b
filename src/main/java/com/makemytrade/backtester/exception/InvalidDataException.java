package com.makemytrade.backtester.exception;

/**
 * Malformed or missing input columns.
 */
public class InvalidDataException extends BacktestException {

    public InvalidDataException(String message) {
        super(ErrorCode.DATA_ERROR, message);
    }

    public InvalidDataException(String message, Throwable cause) {
        super(ErrorCode.DATA_ERROR, message, cause);
    }
}
