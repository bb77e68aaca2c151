package com.backtestplatform.backtest.engine;

import com.backtestplatform.common.ledger.Portfolio;
import com.backtestplatform.common.ledger.PositionSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

public record FinalPortfolio(
    @JsonProperty("cash")           double cash,
    @JsonProperty("margin_used")    double marginUsed,
    @JsonProperty("positions")      Map<String, PositionSnapshot> positions,
    @JsonProperty("realized_gains") Map<String, Double> realizedGains
) {
    public static FinalPortfolio of(Portfolio p) {
        return new FinalPortfolio(p.getCash(), p.getMarginUsed(), p.positionSnapshots(),
            new LinkedHashMap<>(p.getRealizedGains()));
    }
}
