package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.exception.MarketDataException;
import com.backtestplatform.common.model.PriceBar;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Daily price client for a financialdatasets-style {@code /prices/} endpoint.
 *
 * <p>Response shape: {@code {"prices":[{"time":"2024-01-02T05:00:00Z","open":..,"high":..,
 * "low":..,"close":..,"volume":..}, ...]}}.
 */
public class MarketDataWebClient {

    private static final Logger log = LoggerFactory.getLogger(MarketDataWebClient.class);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public MarketDataWebClient(WebClient marketDataWebClient, ObjectMapper objectMapper, String apiKey) {
        this.webClient    = marketDataWebClient;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
    }

    public Mono<List<PriceBar>> fetchDailyBars(String ticker, LocalDate from, LocalDate to) {
        log.info("[MarketData] Fetching daily bars. ticker={} from={} to={}", ticker, from, to);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/prices/")
                .queryParam("ticker", ticker)
                .queryParam("interval", "day")
                .queryParam("interval_multiplier", 1)
                .queryParam("start_date", from)
                .queryParam("end_date", to)
                .build())
            .headers(h -> {
                if (apiKey != null && !apiKey.isBlank()) h.set("X-API-KEY", apiKey);
            })
            .retrieve()
            .bodyToMono(String.class)
            .map(json -> parse(ticker, json))
            .doOnSuccess(bars -> log.info("[MarketData] Bars fetched. ticker={} count={}", ticker, bars.size()))
            .doOnError(e -> log.error("[MarketData] Fetch failed. ticker={}", ticker, e));
    }

    List<PriceBar> parse(String ticker, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new MarketDataException("Unreadable price response for ticker: " + ticker, e);
        }
        JsonNode prices = root.path("prices");
        if (!prices.isArray()) {
            throw new MarketDataException("No 'prices' array in response for ticker: " + ticker);
        }

        List<PriceBar> bars = new ArrayList<>(prices.size());
        for (JsonNode bar : prices) {
            String time = bar.path("time").asText("");
            if (time.isEmpty() || !bar.hasNonNull("close")) {
                log.debug("[MarketData] Skipping malformed bar. ticker={} bar={}", ticker, bar);
                continue;
            }
            bars.add(new PriceBar(ticker, parseDate(time),
                bar.path("open").asDouble(), bar.path("high").asDouble(),
                bar.path("low").asDouble(), bar.path("close").asDouble(),
                bar.path("volume").asLong()));
        }
        bars.sort(Comparator.comparing(PriceBar::date));
        return bars;
    }

    private static LocalDate parseDate(String time) {
        // "2024-01-02T05:00:00Z" or plain "2024-01-02"
        return time.length() > 10 ? OffsetDateTime.parse(time).toLocalDate() : LocalDate.parse(time);
    }
}
