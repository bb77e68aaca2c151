package com.backtestplatform.backtest.event;

import com.backtestplatform.common.model.OrderAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;

/** One executed, non-hold order. {@code totalValue} is the portfolio value after the day's fills. */
public record TradingEvent(
    @JsonProperty("backtest_id") String backtestId,
    @JsonProperty("timestamp")   Instant timestamp,
    @JsonProperty("date")        LocalDate date,
    @JsonProperty("ticker")      String ticker,
    @JsonProperty("action")      OrderAction action,
    @JsonProperty("quantity")    long quantity,
    @JsonProperty("price")       double price,
    @JsonProperty("total_value") double totalValue
) implements BacktestEvent {

    @Override
    @JsonProperty("type")
    public String type() { return "trading"; }
}
