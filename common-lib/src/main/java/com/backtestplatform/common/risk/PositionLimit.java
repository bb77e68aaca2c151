package com.backtestplatform.common.risk;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-ticker cap for one simulated day.
 *
 * @param remainingPositionValue notional still allowed before the share-of-portfolio limit
 * @param maxLongShares          cap for opening or adding to a long leg
 * @param maxShortShares         cap for opening or adding to a short leg
 */
public record PositionLimit(
    @JsonProperty("ticker")                   String ticker,
    @JsonProperty("price")                    double price,
    @JsonProperty("remaining_position_value") double remainingPositionValue,
    @JsonProperty("max_long_shares")          long maxLongShares,
    @JsonProperty("max_short_shares")         long maxShortShares,
    @JsonProperty("reasoning")                String reasoning
) {
    public static PositionLimit blocked(String ticker, double price, String reasoning) {
        return new PositionLimit(ticker, price, 0.0, 0, 0, reasoning);
    }
}
