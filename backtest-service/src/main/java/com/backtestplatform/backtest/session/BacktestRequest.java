package com.backtestplatform.backtest.session;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Body of {@code POST /start} and {@code POST /run-sync}.
 *
 * <p>{@code selected_agents} and {@code initial_capital} are accepted as aliases.
 * {@code margin_requirement} defaults to 0 (shorts bounded by the position limit only).
 * Fields this service does not use, such as model settings, are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestRequest(
    @JsonProperty("tickers")
    List<String> tickers,

    @JsonProperty("selected_signal_producers")
    @JsonAlias("selected_agents")
    List<String> selectedSignalProducers,

    @JsonProperty("start_date")
    LocalDate startDate,

    @JsonProperty("end_date")
    LocalDate endDate,

    @JsonProperty("initial_cash")
    @JsonAlias("initial_capital")
    Double initialCash,

    @JsonProperty("margin_requirement")
    Double marginRequirement
) {
    public double marginRequirementOrDefault() {
        return marginRequirement != null ? marginRequirement : 0.0;
    }
}
