package com.backtestplatform.backtest.event;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record BacktestStartEvent(
    @JsonProperty("backtest_id")      String backtestId,
    @JsonProperty("timestamp")        Instant timestamp,
    @JsonProperty("tickers")          List<String> tickers,
    @JsonProperty("start_date")       LocalDate startDate,
    @JsonProperty("end_date")         LocalDate endDate,
    @JsonProperty("total_days")       int totalDays,
    @JsonProperty("initial_capital")  double initialCapital,
    @JsonProperty("signal_producers") List<String> signalProducers
) implements BacktestEvent {

    @Override
    @JsonProperty("type")
    public String type() { return "backtest_start"; }
}
