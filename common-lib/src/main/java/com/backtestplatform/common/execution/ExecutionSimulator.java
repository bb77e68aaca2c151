package com.backtestplatform.common.execution;

import com.backtestplatform.common.exception.LedgerInvariantException;
import com.backtestplatform.common.ledger.LedgerInvariants;
import com.backtestplatform.common.ledger.Portfolio;
import com.backtestplatform.common.ledger.Position;
import com.backtestplatform.common.model.Order;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a day's orders at the closing price.
 *
 * <h3>Accounting</h3>
 * <pre>
 *   buy   : cash −= qty × price                 long basis re-averaged
 *   sell  : cash += qty × price                 gain = (price − long basis) × qty
 *   short : cash += qty × price                 margin += qty × price × marginRequirement
 *   cover : cash −= qty × price                 gain = (short basis − price) × qty, margin released pro rata
 * </pre>
 *
 * <p>Quantities are clipped to what the portfolio allows (available cash, margin
 * headroom, held shares), never rejected. All orders of one call are applied to a
 * copy of the input portfolio and the copy is verified before it is returned: the
 * input is never mutated, so a failing day leaves no partial state behind.
 */
public class ExecutionSimulator {

    private final double marginRequirement;

    public ExecutionSimulator(double marginRequirement) {
        this.marginRequirement = marginRequirement;
    }

    /**
     * @param committed the session's committed portfolio (left untouched)
     * @param orders    at most one order per ticker
     * @param prices    the day's closes for traded tickers plus valuation prices for
     *                  every other open position
     * @throws LedgerInvariantException if an order has no price or the resulting
     *         portfolio breaks a ledger invariant
     */
    public ExecutionResult execute(Portfolio committed, List<Order> orders, Map<String, Double> prices) {
        Portfolio working = committed.copy();
        List<Fill> fills  = new ArrayList<>(orders.size());

        for (Order order : orders) {
            if (order.isHold()) {
                fills.add(new Fill(order.ticker(), order.action(), 0, 0, prices.getOrDefault(order.ticker(), 0.0), 0.0));
                continue;
            }
            Double price = prices.get(order.ticker());
            if (price == null || !(price > 0.0)) {
                throw new LedgerInvariantException("No valid execution price. ticker=" + order.ticker() + " price=" + price);
            }
            fills.add(switch (order.action()) {
                case BUY   -> buy(working, order, price);
                case SELL  -> sell(working, order, price);
                case SHORT -> shortSell(working, order, price);
                case COVER -> cover(working, order, price, prices);
                case HOLD  -> throw new IllegalStateException("unreachable");
            });
        }

        LedgerInvariants.verify(working, prices, marginRequirement);
        return new ExecutionResult(working, fills);
    }

    private Fill buy(Portfolio portfolio, Order order, double price) {
        long affordable = (long) Math.floor(portfolio.availableCash() / price);
        long quantity   = Math.min(order.quantity(), affordable);
        if (quantity > 0) {
            Position p   = portfolio.position(order.ticker());
            long held    = p.getLongQuantity();
            p.setLongCostBasis(weightedAverage(p.getLongCostBasis(), held, price, quantity));
            p.setLongQuantity(held + quantity);
            portfolio.adjustCash(-quantity * price);
        }
        return new Fill(order.ticker(), order.action(), order.quantity(), quantity, price, 0.0);
    }

    private Fill sell(Portfolio portfolio, Order order, double price) {
        Position p    = portfolio.position(order.ticker());
        long quantity = Math.min(order.quantity(), p.getLongQuantity());
        double gain   = 0.0;
        if (quantity > 0) {
            gain = (price - p.getLongCostBasis()) * quantity;
            p.setLongQuantity(p.getLongQuantity() - quantity);
            if (p.getLongQuantity() == 0) p.setLongCostBasis(0.0);
            portfolio.adjustCash(quantity * price);
            portfolio.addRealizedGain(order.ticker(), gain);
        }
        return new Fill(order.ticker(), order.action(), order.quantity(), quantity, price, gain);
    }

    private Fill shortSell(Portfolio portfolio, Order order, double price) {
        long quantity = order.quantity();
        if (marginRequirement > 0.0) {
            long headroom = (long) Math.floor(portfolio.availableCash() / (price * marginRequirement));
            quantity = Math.min(quantity, headroom);
        }
        if (quantity > 0) {
            Position p     = portfolio.position(order.ticker());
            long held      = p.getShortQuantity();
            double margin  = quantity * price * marginRequirement;
            p.setShortCostBasis(weightedAverage(p.getShortCostBasis(), held, price, quantity));
            p.setShortQuantity(held + quantity);
            p.setShortMarginUsed(p.getShortMarginUsed() + margin);
            portfolio.adjustMarginUsed(margin);
            portfolio.adjustCash(quantity * price);
        }
        return new Fill(order.ticker(), order.action(), order.quantity(), quantity, price, 0.0);
    }

    private Fill cover(Portfolio portfolio, Order order, double price, Map<String, Double> prices) {
        Position p    = portfolio.position(order.ticker());
        long quantity = Math.min(order.quantity(), p.getShortQuantity());
        // Covering cannot push cash below the margin floor.
        double floorCash  = portfolio.getCash() + marginRequirement * portfolio.totalValue(prices);
        long affordable   = (long) Math.floor(Math.max(0.0, floorCash) / price);
        quantity          = Math.min(quantity, affordable);
        double gain       = 0.0;
        if (quantity > 0) {
            long held        = p.getShortQuantity();
            double released  = p.getShortMarginUsed() * quantity / held;
            gain = (p.getShortCostBasis() - price) * quantity;
            p.setShortQuantity(held - quantity);
            p.setShortMarginUsed(p.getShortMarginUsed() - released);
            if (p.getShortQuantity() == 0) {
                p.setShortCostBasis(0.0);
                released += p.getShortMarginUsed();
                p.setShortMarginUsed(0.0);
            }
            portfolio.adjustMarginUsed(-released);
            portfolio.adjustCash(-quantity * price);
            portfolio.addRealizedGain(order.ticker(), gain);
        }
        return new Fill(order.ticker(), order.action(), order.quantity(), quantity, price, gain);
    }

    private static double weightedAverage(double basis, long held, double price, long added) {
        long total = held + added;
        return total == 0 ? 0.0 : (basis * held + price * added) / total;
    }

    public double marginRequirement() {
        return marginRequirement;
    }
}
