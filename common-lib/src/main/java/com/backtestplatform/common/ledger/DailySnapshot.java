package com.backtestplatform.common.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * End-of-day view of the portfolio. The ordered series of snapshots is the sole
 * input to performance metrics.
 *
 * <p>{@code prices} holds the closes each position was valued at, so every snapshot
 * can be re-checked against {@code total_value = cash + Σ (long − short) × price}.
 */
public record DailySnapshot(
    @JsonProperty("date")         LocalDate date,
    @JsonProperty("cash")         double cash,
    @JsonProperty("margin_used")  double marginUsed,
    @JsonProperty("total_value")  double totalValue,
    @JsonProperty("daily_return") double dailyReturn,
    @JsonProperty("positions")    Map<String, PositionSnapshot> positions,
    @JsonProperty("prices")       Map<String, Double> prices
) {
    public DailySnapshot {
        positions = positions != null ? Collections.unmodifiableMap(new LinkedHashMap<>(positions)) : Map.of();
        prices    = prices != null ? Collections.unmodifiableMap(new LinkedHashMap<>(prices)) : Map.of();
    }

    /** Recomputes total value from cash, positions and valuation prices. */
    public double impliedValue() {
        double value = cash;
        for (Map.Entry<String, PositionSnapshot> e : positions.entrySet()) {
            PositionSnapshot p = e.getValue();
            if (p.longQuantity() == 0 && p.shortQuantity() == 0) continue;
            value += (p.longQuantity() - p.shortQuantity()) * prices.getOrDefault(e.getKey(), 0.0);
        }
        return value;
    }
}
