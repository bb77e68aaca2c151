package com.backtestplatform.common.portfolio;

import com.backtestplatform.common.consensus.ConsensusEngine;
import com.backtestplatform.common.consensus.ConsensusResult;
import com.backtestplatform.common.ledger.Portfolio;
import com.backtestplatform.common.ledger.Position;
import com.backtestplatform.common.model.Order;
import com.backtestplatform.common.model.OrderAction;
import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;
import com.backtestplatform.common.risk.PositionLimit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns one day's signals and risk caps into exactly one {@link Order} per ticker.
 *
 * <h3>Decision table</h3>
 * <pre>
 *   consensus  open leg      action   quantity
 *   bullish    short &gt; 0    cover    short quantity
 *   bullish    none          buy      min(maxLongShares, ⌊availableCash / price⌋)
 *   bearish    long &gt; 0     sell     long quantity
 *   bearish    none          short    maxShortShares
 *   neutral / tie            hold     0
 * </pre>
 * A zero resulting quantity becomes {@code hold}.
 *
 * <p>Deterministic: identical inputs produce identical orders. The portfolio is read,
 * never mutated.
 */
public class PortfolioManager {

    private final ConsensusEngine consensusEngine;

    public PortfolioManager(ConsensusEngine consensusEngine) {
        this.consensusEngine = consensusEngine;
    }

    /**
     * @param signals   collected signals keyed by ticker; defines the set of tickers ordered
     * @param limits    per-ticker caps from the risk manager
     * @param portfolio committed portfolio at the start of the day
     * @return one order per ticker in {@code signals}, ordered by ticker
     */
    public List<Order> synthesize(Map<String, List<TradeSignal>> signals, Map<String, PositionLimit> limits,
                                  Portfolio portfolio) {
        double available = portfolio.availableCash();
        List<Order> orders = new ArrayList<>(signals.size());
        for (Map.Entry<String, List<TradeSignal>> e : new TreeMap<>(signals).entrySet()) {
            orders.add(decide(e.getKey(), e.getValue(), limits.get(e.getKey()), portfolio, available));
        }
        return Collections.unmodifiableList(orders);
    }

    private Order decide(String ticker, List<TradeSignal> signals, PositionLimit limit,
                         Portfolio portfolio, double availableCash) {
        ConsensusResult consensus = consensusEngine.compute(signals);
        String weights = String.format("bullish=%.1f bearish=%.1f neutral=%.1f",
            consensus.weightOf(SignalDirection.BULLISH),
            consensus.weightOf(SignalDirection.BEARISH),
            consensus.weightOf(SignalDirection.NEUTRAL));

        if (consensus.tie()) {
            return Order.hold(ticker, "Tied consensus: " + weights);
        }
        if (consensus.direction() == SignalDirection.NEUTRAL) {
            return Order.hold(ticker, "Neutral consensus: " + weights);
        }
        if (limit == null || !(limit.price() > 0.0)) {
            return Order.hold(ticker, "No risk limit or price available");
        }

        Position position = portfolio.getPositions().get(ticker);
        long longQty  = position != null ? position.getLongQuantity() : 0;
        long shortQty = position != null ? position.getShortQuantity() : 0;

        OrderAction action;
        long quantity;
        if (consensus.direction() == SignalDirection.BULLISH) {
            if (shortQty > 0) {
                action   = OrderAction.COVER;
                quantity = shortQty;
            } else {
                action   = OrderAction.BUY;
                quantity = Math.min(limit.maxLongShares(), (long) Math.floor(availableCash / limit.price()));
            }
        } else {
            if (longQty > 0) {
                action   = OrderAction.SELL;
                quantity = longQty;
            } else {
                action   = OrderAction.SHORT;
                quantity = limit.maxShortShares();
            }
        }

        if (quantity <= 0) {
            return Order.hold(ticker, consensus.direction().wireName() + " consensus but no capacity to "
                + action.wireName() + ": " + weights);
        }
        return new Order(ticker, action, quantity,
            consensus.direction().wireName() + " consensus: " + weights);
    }
}
