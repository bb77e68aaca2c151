package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exactly one order is synthesized per ticker per simulated day.
 */
public record Order(
    @JsonProperty("ticker")    String ticker,
    @JsonProperty("action")    OrderAction action,
    @JsonProperty("quantity")  long quantity,
    @JsonProperty("reasoning") String reasoning
) {
    public Order {
        if (quantity < 0) {
            throw new IllegalArgumentException("Order quantity must be >= 0. ticker=" + ticker + " quantity=" + quantity);
        }
        action = action != null ? action : OrderAction.HOLD;
    }

    public static Order hold(String ticker, String reasoning) {
        return new Order(ticker, OrderAction.HOLD, 0, reasoning);
    }

    public boolean isHold() {
        return action == OrderAction.HOLD;
    }
}
