package com.backtestplatform.common.exception;

/**
 * Rejected backtest request. Maps to HTTP 400 and is never retried.
 */
public class BacktestValidationException extends RuntimeException {

    public BacktestValidationException(String message) {
        super(message);
    }
}
