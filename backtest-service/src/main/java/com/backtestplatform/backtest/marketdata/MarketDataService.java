package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.model.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Default {@link MarketDataProvider}: serves from {@link PriceHistoryCache}, falls back
 * to {@link MarketDataWebClient} on a miss and caches the fetched range.
 */
@Service
public class MarketDataService implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(MarketDataService.class);

    private final MarketDataWebClient client;
    private final PriceHistoryCache cache;

    public MarketDataService(MarketDataWebClient client, PriceHistoryCache cache) {
        this.client = client;
        this.cache  = cache;
    }

    @Override
    public Flux<PriceBar> getPriceHistory(String ticker, LocalDate from, LocalDate to) {
        String key = ticker.toUpperCase();

        return Mono.defer(() -> {
            CachedPriceHistory cached = cache.get(key, from, to);
            if (cached != null) {
                log.info("CACHE_HIT ticker={} fetchedAt={}", key, cached.fetchedAt());
                return Mono.just(cached.bars());
            }
            log.info("CACHE_MISS ticker={} from={} to={}", key, from, to);
            return client.fetchDailyBars(key, from, to)
                .doOnSuccess(bars -> cache.put(key, from, to, bars));
        })
        .flatMapMany(Flux::fromIterable)
        .filter(bar -> !bar.date().isBefore(from) && !bar.date().isAfter(to));
    }
}
