package com.backtestplatform.backtest.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

public record BacktestProgressEvent(
    @JsonProperty("backtest_id")    String backtestId,
    @JsonProperty("timestamp")      Instant timestamp,
    @JsonProperty("current_date")   LocalDate currentDate,
    @JsonProperty("completed_days") int completedDays,
    @JsonProperty("total_days")     int totalDays,
    @JsonProperty("progress")       double progress
) implements BacktestEvent {

    @Override
    @JsonProperty("type")
    public String type() { return "backtest_progress"; }
}
