package com.backtestplatform.common.execution;

import com.backtestplatform.common.model.OrderAction;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of applying one order. {@code quantity} may be lower than
 * {@code requestedQuantity} when the order was clipped to what cash, margin or the
 * held position allowed.
 */
public record Fill(
    @JsonProperty("ticker")             String ticker,
    @JsonProperty("action")             OrderAction action,
    @JsonProperty("requested_quantity") long requestedQuantity,
    @JsonProperty("quantity")           long quantity,
    @JsonProperty("price")              double price,
    @JsonProperty("realized_gain")      double realizedGain
) {
    public boolean executed() {
        return action != OrderAction.HOLD && quantity > 0;
    }
}
