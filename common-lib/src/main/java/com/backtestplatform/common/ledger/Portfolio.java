package com.backtestplatform.common.ledger;

import com.backtestplatform.common.exception.LedgerInvariantException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cash, per-ticker positions and realized gains of one backtest session.
 *
 * <p>Not thread-safe. A portfolio is owned by a single session loop; the execution
 * simulator mutates a {@link #copy()} and the ledger swaps it in on commit.
 */
public class Portfolio {

    private double cash;
    private double marginUsed;
    private final Map<String, Position> positions;
    private final Map<String, Double> realizedGains;

    private Portfolio(double cash, double marginUsed,
                      Map<String, Position> positions, Map<String, Double> realizedGains) {
        this.cash          = cash;
        this.marginUsed    = marginUsed;
        this.positions     = positions;
        this.realizedGains = realizedGains;
    }

    public static Portfolio open(double initialCash, Iterable<String> tickers) {
        Map<String, Position> positions = new LinkedHashMap<>();
        Map<String, Double> gains       = new LinkedHashMap<>();
        for (String ticker : tickers) {
            positions.put(ticker, new Position());
            gains.put(ticker, 0.0);
        }
        return new Portfolio(initialCash, 0.0, positions, gains);
    }

    public Portfolio copy() {
        Map<String, Position> positionsCopy = new LinkedHashMap<>();
        positions.forEach((ticker, p) -> positionsCopy.put(ticker, p.copy()));
        return new Portfolio(cash, marginUsed, positionsCopy, new LinkedHashMap<>(realizedGains));
    }

    // ── accessors ──────────────────────────────────────────────────────────

    public double getCash()       { return cash; }
    public double getMarginUsed() { return marginUsed; }

    /**
     * Cash free for new buys and new short margin: excludes reserved margin and the
     * proceeds held against open shorts. Never negative.
     */
    public double availableCash() {
        double heldProceeds = 0.0;
        for (Position p : positions.values()) {
            heldProceeds += p.getShortQuantity() * p.getShortCostBasis();
        }
        return Math.max(0.0, cash - marginUsed - heldProceeds);
    }

    public Position position(String ticker) {
        return positions.computeIfAbsent(ticker, t -> new Position());
    }

    public Map<String, Position> getPositions() {
        return Collections.unmodifiableMap(positions);
    }

    public Map<String, Double> getRealizedGains() {
        return Collections.unmodifiableMap(realizedGains);
    }

    public Map<String, PositionSnapshot> positionSnapshots() {
        Map<String, PositionSnapshot> out = new LinkedHashMap<>();
        positions.forEach((ticker, p) -> out.put(ticker, p.snapshot()));
        return out;
    }

    /**
     * {@code cash + Σ (long − short) × price}. Every non-flat position needs a price.
     */
    public double totalValue(Map<String, Double> prices) {
        double total = cash;
        for (Map.Entry<String, Position> e : positions.entrySet()) {
            Position p = e.getValue();
            if (p.isFlat()) continue;
            Double price = prices.get(e.getKey());
            if (price == null) {
                throw new LedgerInvariantException("No valuation price for open position. ticker=" + e.getKey());
            }
            total += p.marketValue(price);
        }
        return total;
    }

    // ── mutators, called by the execution simulator on a working copy ───────

    public void adjustCash(double delta)       { this.cash += delta; }
    public void adjustMarginUsed(double delta) { this.marginUsed = Math.max(0.0, this.marginUsed + delta); }

    public void addRealizedGain(String ticker, double gain) {
        realizedGains.merge(ticker, gain, Double::sum);
    }
}
