package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.model.PriceBar;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Cache entry: the bars fetched for one ticker over {@code [from, to]}.
 */
public record CachedPriceHistory(
    String ticker,
    LocalDate from,
    LocalDate to,
    List<PriceBar> bars,
    Instant fetchedAt
) {
    public boolean covers(LocalDate requestedFrom, LocalDate requestedTo) {
        return !from.isAfter(requestedFrom) && !to.isBefore(requestedTo);
    }
}
