package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Directional view a signal producer holds on a ticker for one day.
 */
public enum SignalDirection {

    BULLISH,
    BEARISH,
    NEUTRAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /** Lenient parse; unknown or null values map to {@link #NEUTRAL}. */
    @JsonCreator
    public static SignalDirection fromString(String value) {
        if (value == null) return NEUTRAL;
        return switch (value.trim().toLowerCase()) {
            case "bullish", "buy", "long"   -> BULLISH;
            case "bearish", "sell", "short" -> BEARISH;
            default                         -> NEUTRAL;
        };
    }
}
