package com.backtestplatform.backtest.config;

import com.backtestplatform.backtest.marketdata.MarketDataWebClient;
import com.backtestplatform.common.exception.MarketDataException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the historical price API. Non-2xx answers become {@link MarketDataException}
 * so a failed load surfaces as a session failure rather than an empty series.
 */
@Configuration
public class WebClientConfig {

    private static final Logger log = LoggerFactory.getLogger(WebClientConfig.class);

    @Value("${market-data.base-url:https://api.financialdatasets.ai}")
    private String baseUrl;

    @Value("${market-data.api-key:}")
    private String apiKey;

    @Value("${market-data.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${market-data.read-timeout:30s}")
    private Duration readTimeout;

    @Bean
    public WebClient marketDataWebClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
            .responseTimeout(readTimeout)
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(readTimeout.toMillis(), TimeUnit.MILLISECONDS)));

        return builder
            .baseUrl(baseUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            // a multi-year daily series exceeds the 256 KB default
            .exchangeStrategies(ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build())
            .filter(rejectErrorStatus())
            .filter(logRequest())
            .build();
    }

    @Bean
    public MarketDataWebClient marketDataClient(WebClient marketDataWebClient, ObjectMapper objectMapper) {
        return new MarketDataWebClient(marketDataWebClient, objectMapper, apiKey);
    }

    private ExchangeFilterFunction rejectErrorStatus() {
        return ExchangeFilterFunction.ofResponseProcessor(response -> {
            if (response.statusCode().isError()) {
                return response.releaseBody().then(Mono.error(new MarketDataException(
                    "Price request rejected with status " + response.statusCode().value())));
            }
            return Mono.just(response);
        });
    }

    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(request -> {
            log.debug("[MarketData] {} {}", request.method(), request.url());
            return Mono.just(request);
        });
    }
}
