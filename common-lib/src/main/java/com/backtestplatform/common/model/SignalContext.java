package com.backtestplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything a signal producer may look at for one ticker on one simulated day.
 *
 * <p>{@code closes} are the closing prices inside the lookback window up to and
 * including {@code date}, newest-first (index 0 = the day's close). Producers never
 * see prices after {@code date}.
 */
public record SignalContext(
    @JsonProperty("ticker")        String ticker,
    @JsonProperty("date")          LocalDate date,
    @JsonProperty("lookbackStart") LocalDate lookbackStart,
    @JsonProperty("closes")        List<Double> closes,
    @JsonProperty("position")      Map<String, Object> position,
    @JsonProperty("backtestId")    String backtestId
) {
    public static SignalContext of(String ticker, LocalDate date, LocalDate lookbackStart,
                                   List<Double> closes, Map<String, Object> position,
                                   String backtestId) {
        return new SignalContext(ticker, date, lookbackStart, List.copyOf(closes),
            position != null ? Map.copyOf(position) : Map.of(), backtestId);
    }

    public double latestClose() {
        return closes.isEmpty() ? Double.NaN : closes.get(0);
    }
}
