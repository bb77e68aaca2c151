package com.backtestplatform.common.exception;

public class SessionNotFoundException extends RuntimeException {
    private final String backtestId;

    public SessionNotFoundException(String backtestId) {
        super("Backtest not found: " + backtestId);
        this.backtestId = backtestId;
    }

    public String getBacktestId() {
        return backtestId;
    }
}
