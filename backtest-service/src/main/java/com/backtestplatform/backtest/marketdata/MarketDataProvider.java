package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.model.PriceBar;
import reactor.core.publisher.Flux;

import java.time.LocalDate;

/**
 * Source of daily price bars. The HTTP-backed {@link MarketDataService} is the default;
 * tests and offline runs plug in their own implementation.
 */
public interface MarketDataProvider {

    /** Daily bars for {@code ticker} with {@code from <= date <= to}, oldest first. */
    Flux<PriceBar> getPriceHistory(String ticker, LocalDate from, LocalDate to);
}
