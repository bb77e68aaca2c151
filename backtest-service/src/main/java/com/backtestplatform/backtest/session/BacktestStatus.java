package com.backtestplatform.backtest.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code PENDING → RUNNING → {COMPLETED, CANCELLED, FAILED}}; terminal states are final.
 */
public enum BacktestStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    CANCELLED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public boolean canTransitionTo(BacktestStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING || next == FAILED;
            case RUNNING -> next.isTerminal();
            default      -> false;
        };
    }
}
