package com.backtestplatform.backtest.support;

import com.backtestplatform.backtest.marketdata.MarketDataProvider;
import com.backtestplatform.common.model.PriceBar;
import reactor.core.publisher.Flux;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Offline {@link MarketDataProvider} for tests. Optionally holds every fetch until a
 * gate is released, so a test can subscribe to a session's stream before day one.
 */
public class InMemoryMarketData implements MarketDataProvider {

    private final Map<String, List<PriceBar>> bars = new ConcurrentHashMap<>();
    private final Set<String> failing = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch gate;

    /** One bar per calendar day starting at {@code first}. */
    public InMemoryMarketData withDailyCloses(String ticker, LocalDate first, double... closes) {
        List<PriceBar> list = new ArrayList<>(closes.length);
        for (int i = 0; i < closes.length; i++) {
            list.add(PriceBar.ofClose(ticker, first.plusDays(i), closes[i]));
        }
        bars.put(ticker, list);
        return this;
    }

    public InMemoryMarketData withoutBar(String ticker, LocalDate date) {
        List<PriceBar> list = new ArrayList<>(bars.getOrDefault(ticker, List.of()));
        list.removeIf(bar -> bar.date().equals(date));
        bars.put(ticker, list);
        return this;
    }

    public InMemoryMarketData failingFor(String ticker) {
        failing.add(ticker);
        return this;
    }

    public InMemoryMarketData gatedBy(CountDownLatch latch) {
        this.gate = latch;
        return this;
    }

    @Override
    public Flux<PriceBar> getPriceHistory(String ticker, LocalDate from, LocalDate to) {
        return Flux.defer(() -> {
            awaitGate();
            if (failing.contains(ticker)) {
                return Flux.error(new IllegalStateException("price feed unavailable for " + ticker));
            }
            return Flux.fromIterable(bars.getOrDefault(ticker, List.of()))
                .filter(bar -> !bar.date().isBefore(from) && !bar.date().isAfter(to));
        });
    }

    private void awaitGate() {
        CountDownLatch latch = gate;
        if (latch == null) return;
        try {
            if (!latch.await(10, TimeUnit.SECONDS)) {
                throw new IllegalStateException("market data gate was never released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /** {@code count} closes starting at {@code start}, rising by {@code step} per day. */
    public static double[] linear(int count, double start, double step) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) out[i] = start + i * step;
        return out;
    }

    /** Rising trend with a dip every third day, so both consensus directions occur. */
    public static double[] choppy(int count, double start) {
        double[] out = new double[count];
        for (int i = 0; i < count; i++) out[i] = start + i + (i % 3 == 0 ? -4.0 : 0.0);
        return out;
    }
}
