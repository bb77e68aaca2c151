package com.backtestplatform.backtest.event;

import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.ledger.PositionSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Carries a full {@link DailySnapshot}, so a subscriber can rebuild the snapshot series
 * from the stream alone.
 */
public record PortfolioUpdateEvent(
    @JsonProperty("backtest_id")  String backtestId,
    @JsonProperty("timestamp")    Instant timestamp,
    @JsonProperty("date")         LocalDate date,
    @JsonProperty("cash")         double cash,
    @JsonProperty("margin_used")  double marginUsed,
    @JsonProperty("total_value")  double totalValue,
    @JsonProperty("daily_return") double dailyReturn,
    @JsonProperty("positions")    Map<String, PositionSnapshot> positions,
    @JsonProperty("prices")       Map<String, Double> prices
) implements BacktestEvent {

    public static PortfolioUpdateEvent of(String backtestId, Instant timestamp, DailySnapshot s) {
        return new PortfolioUpdateEvent(backtestId, timestamp, s.date(), s.cash(), s.marginUsed(),
            s.totalValue(), s.dailyReturn(), s.positions(), s.prices());
    }

    public DailySnapshot toSnapshot() {
        return new DailySnapshot(date, cash, marginUsed, totalValue, dailyReturn, positions, prices);
    }

    @Override
    @JsonProperty("type")
    public String type() { return "portfolio_update"; }
}
