package com.backtestplatform.backtest.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record BacktestErrorEvent(
    @JsonProperty("backtest_id") String backtestId,
    @JsonProperty("timestamp")   Instant timestamp,
    @JsonProperty("message")     String message
) implements BacktestEvent {

    @Override
    @JsonProperty("type")
    public String type() { return "error"; }

    @Override
    @JsonIgnore
    public boolean isTerminal() { return true; }
}
