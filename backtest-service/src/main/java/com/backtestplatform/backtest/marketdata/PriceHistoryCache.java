package com.backtestplatform.backtest.marketdata;

import com.backtestplatform.common.model.PriceBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory price history cache, one entry per ticker.
 *
 * <p>An entry serves any request whose range it covers. Entries expire after
 * {@code market-data.cache-ttl}; an expired entry is evicted on lookup and reported as a
 * miss. Thread-safe via {@link ConcurrentHashMap}.
 */
@Component
public class PriceHistoryCache {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryCache.class);

    private final ConcurrentHashMap<String, CachedPriceHistory> store = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public PriceHistoryCache(@Value("${market-data.cache-ttl:30m}") Duration ttl) {
        this(ttl, Clock.systemUTC());
    }

    PriceHistoryCache(Duration ttl, Clock clock) {
        this.ttl   = ttl;
        this.clock = clock;
    }

    /** Returns the cached entry covering the range, or {@code null} on a miss. */
    public CachedPriceHistory get(String ticker, LocalDate from, LocalDate to) {
        CachedPriceHistory entry = store.get(ticker);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(ticker, entry);
            return null;
        }
        return entry.covers(from, to) ? entry : null;
    }

    public void put(String ticker, LocalDate from, LocalDate to, List<PriceBar> bars) {
        store.put(ticker, new CachedPriceHistory(ticker, from, to, List.copyOf(bars), clock.instant()));
        log.info("CACHE_REFRESH ticker={} from={} to={} bars={} ttlSeconds={}",
                 ticker, from, to, bars.size(), ttl.toSeconds());
    }

    public boolean isExpired(CachedPriceHistory entry) {
        return Instant.now(clock).isAfter(entry.fetchedAt().plus(ttl));
    }
}
