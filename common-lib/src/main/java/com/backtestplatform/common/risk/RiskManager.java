package com.backtestplatform.common.risk;

import com.backtestplatform.common.ledger.Portfolio;
import com.backtestplatform.common.ledger.Position;
import com.backtestplatform.common.model.TradeSignal;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes the per-ticker position cap for one trading day.
 *
 * <h3>Formula</h3>
 * <pre>
 *   totalValue      = cash + Σ (long − short) × price
 *   positionLimit   = maxPositionFraction × totalValue
 *   remaining       = max(0, positionLimit − (long + short) × price)
 *   maxLongShares   = ⌊ min(remaining, availableCash) / price ⌋
 *   marginHeadroom  = availableCash / (price × marginRequirement)      (∞ when marginRequirement = 0)
 *   maxShortShares  = ⌊ min(remaining / price, marginHeadroom) ⌋
 * </pre>
 *
 * <p>Referentially transparent: output depends only on the arguments, and the input
 * portfolio is never mutated. Signals are accepted so the cap can later depend on
 * signal dispersion; they do not affect the current formula.
 */
public final class RiskManager {

    private RiskManager() {}

    /**
     * @param portfolio committed portfolio at the start of the day
     * @param prices    valuation prices; tickers absent from {@code signals} are not capped
     * @param signals   the day's collected signals, keyed by ticker
     * @param limits    configured limits
     * @return one {@link PositionLimit} per ticker in {@code signals}, ordered by ticker
     */
    public static Map<String, PositionLimit> assess(Portfolio portfolio, Map<String, Double> prices,
                                                   Map<String, List<TradeSignal>> signals, RiskLimits limits) {
        double totalValue = portfolio.totalValue(prices);
        double available  = portfolio.availableCash();

        Map<String, PositionLimit> out = new TreeMap<>();
        for (String ticker : new TreeMap<>(signals).keySet()) {
            Double price = prices.get(ticker);
            if (price == null || !(price > 0.0)) {
                out.put(ticker, PositionLimit.blocked(ticker, 0.0, "No price available"));
                continue;
            }
            if (!(totalValue > 0.0)) {
                out.put(ticker, PositionLimit.blocked(ticker, price, "Non-positive portfolio value"));
                continue;
            }

            Position position    = portfolio.getPositions().get(ticker);
            double exposure      = position != null ? position.grossExposure(price) : 0.0;
            double positionLimit = limits.maxPositionFraction() * totalValue;
            double remaining     = Math.max(0.0, positionLimit - exposure);

            long maxLong = (long) Math.floor(Math.min(remaining, available) / price);

            double byLimit  = remaining / price;
            double byMargin = limits.marginRequirement() > 0.0
                ? available / (price * limits.marginRequirement())
                : Double.POSITIVE_INFINITY;
            long maxShort = (long) Math.floor(Math.min(byLimit, byMargin));

            String reasoning = String.format(
                "value=%.2f limit=%.2f exposure=%.2f remaining=%.2f available=%.2f margin=%.2f",
                totalValue, positionLimit, exposure, remaining, available, limits.marginRequirement());
            out.put(ticker, new PositionLimit(ticker, price, remaining, maxLong, maxShort, reasoning));
        }
        return Collections.unmodifiableMap(out);
    }
}
