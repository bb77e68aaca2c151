package com.backtestplatform.common.ledger;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PositionSnapshot(
    @JsonProperty("long")              long longQuantity,
    @JsonProperty("short")             long shortQuantity,
    @JsonProperty("long_cost_basis")   double longCostBasis,
    @JsonProperty("short_cost_basis")  double shortCostBasis,
    @JsonProperty("short_margin_used") double shortMarginUsed
) {}
