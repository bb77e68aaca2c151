package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.exception.MarketDataException;
import com.backtestplatform.common.model.PriceBar;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarketDataWebClientTest {

    private final MarketDataWebClient client = new MarketDataWebClient(WebClient.create(), new ObjectMapper(), "");

    @Test
    @DisplayName("parses bars, sorts them by date and skips malformed entries")
    void parse() {
        String json = """
            {"ticker":"AAPL","prices":[
              {"time":"2024-01-03T05:00:00Z","open":1,"high":2,"low":0.5,"close":1.5,"volume":100},
              {"time":"2024-01-02","open":1,"high":2,"low":0.5,"close":1.2,"volume":90},
              {"open":1,"close":9},
              {"time":"2024-01-04","open":1}
            ]}
            """;

        List<PriceBar> bars = client.parse("AAPL", json);

        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2024, 1, 2), bars.get(0).date());
        assertEquals(1.2, bars.get(0).close());
        assertEquals(LocalDate.of(2024, 1, 3), bars.get(1).date());
        assertEquals(100, bars.get(1).volume());
        assertEquals("AAPL", bars.get(1).ticker());
    }

    @Test
    @DisplayName("unreadable body → MarketDataException")
    void unreadable() {
        assertThrows(MarketDataException.class, () -> client.parse("AAPL", "<html>rate limited</html>"));
    }

    @Test
    @DisplayName("missing prices array → MarketDataException")
    void missingPrices() {
        MarketDataException e = assertThrows(MarketDataException.class,
            () -> client.parse("MSFT", "{\"error\":\"unknown ticker\"}"));
        assertTrue(e.getMessage().contains("MSFT"));
    }
}
