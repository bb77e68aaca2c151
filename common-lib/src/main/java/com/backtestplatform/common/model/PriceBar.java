package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record PriceBar(
    @JsonProperty("ticker") String ticker,
    @JsonProperty("date")   LocalDate date,
    @JsonProperty("open")   double open,
    @JsonProperty("high")   double high,
    @JsonProperty("low")    double low,
    @JsonProperty("close")  double close,
    @JsonProperty("volume") long volume
) {
    public static PriceBar ofClose(String ticker, LocalDate date, double close) {
        return new PriceBar(ticker, date, close, close, close, close, 0L);
    }
}
