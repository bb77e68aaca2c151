package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One producer's view of one ticker on one simulated day.
 *
 * <p>Immutable once emitted. {@code reasoning} is descriptive only and never takes
 * part in any computation.
 */
public record TradeSignal(
    @JsonProperty("producer_id") String producerId,
    @JsonProperty("ticker")      String ticker,
    @JsonProperty("direction")   SignalDirection direction,
    @JsonProperty("confidence")  double confidence,   // 0–100
    @JsonProperty("reasoning")   String reasoning
) {
    public static final double MAX_CONFIDENCE = 100.0;

    public TradeSignal {
        direction  = direction != null ? direction : SignalDirection.NEUTRAL;
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(MAX_CONFIDENCE, confidence));
        reasoning  = reasoning != null ? reasoning : "";
    }

    public static TradeSignal of(String producerId, String ticker, SignalDirection direction,
                                 double confidence, String reasoning) {
        return new TradeSignal(producerId, ticker, direction, confidence, reasoning);
    }

    /** Re-attributes the signal to {@code producerId} and {@code ticker}. */
    public TradeSignal attributedTo(String producerId, String ticker) {
        return new TradeSignal(producerId, ticker, direction, confidence, reasoning);
    }
}
