package com.backtestplatform.backtest.engine;

import com.backtestplatform.common.model.PriceBar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Prefetched daily bars for every ticker of a session, indexed by date.
 */
public class PriceHistory {

    private final Map<String, NavigableMap<LocalDate, PriceBar>> bars;

    private PriceHistory(Map<String, NavigableMap<LocalDate, PriceBar>> bars) {
        this.bars = bars;
    }

    public static PriceHistory of(Map<String, List<PriceBar>> barsByTicker) {
        Map<String, NavigableMap<LocalDate, PriceBar>> index = new LinkedHashMap<>();
        barsByTicker.forEach((ticker, list) -> {
            NavigableMap<LocalDate, PriceBar> byDate = new TreeMap<>();
            for (PriceBar bar : list) {
                if (bar.close() > 0.0 && Double.isFinite(bar.close())) byDate.put(bar.date(), bar);
            }
            index.put(ticker, byDate);
        });
        return new PriceHistory(index);
    }

    /** Every date in {@code [start, end]} on which at least one ticker has a bar, ascending. */
    public List<LocalDate> tradingCalendar(LocalDate start, LocalDate end) {
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (NavigableMap<LocalDate, PriceBar> byDate : bars.values()) {
            dates.addAll(byDate.subMap(start, true, end, true).keySet());
        }
        return new ArrayList<>(dates);
    }

    public boolean hasBar(String ticker, LocalDate date) {
        NavigableMap<LocalDate, PriceBar> byDate = bars.get(ticker);
        return byDate != null && byDate.containsKey(date);
    }

    /**
     * Each ticker's most recent close on or before {@code date}. Tickers with no bar yet
     * are absent.
     */
    public Map<String, Double> valuationPrices(LocalDate date) {
        Map<String, Double> prices = new TreeMap<>();
        bars.forEach((ticker, byDate) -> {
            Map.Entry<LocalDate, PriceBar> e = byDate.floorEntry(date);
            if (e != null) prices.put(ticker, e.getValue().close());
        });
        return prices;
    }

    /** Closes in {@code [from, to]}, newest first. */
    public List<Double> closesNewestFirst(String ticker, LocalDate from, LocalDate to) {
        NavigableMap<LocalDate, PriceBar> byDate = bars.get(ticker);
        if (byDate == null) return Collections.emptyList();
        List<Double> closes = new ArrayList<>();
        for (PriceBar bar : byDate.subMap(from, true, to, true).descendingMap().values()) {
            closes.add(bar.close());
        }
        return closes;
    }
}
