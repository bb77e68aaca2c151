package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderAction {

    BUY,
    SELL,
    SHORT,
    COVER,
    HOLD;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static OrderAction fromString(String value) {
        return value == null ? HOLD : OrderAction.valueOf(value.trim().toUpperCase());
    }

    /** Sell and cover close (part of) an existing position and realize gains. */
    public boolean isClosing() {
        return this == SELL || this == COVER;
    }
}
