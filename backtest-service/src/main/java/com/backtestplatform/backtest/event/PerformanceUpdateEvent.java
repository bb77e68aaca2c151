package com.backtestplatform.backtest.event;

import com.backtestplatform.common.performance.PerformanceMetrics;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

public record PerformanceUpdateEvent(
    @JsonProperty("backtest_id")         String backtestId,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("date")                LocalDate date,
    @JsonProperty("performance_metrics") PerformanceMetrics metrics
) implements BacktestEvent {

    @Override
    @JsonProperty("type")
    public String type() { return "performance_update"; }
}
