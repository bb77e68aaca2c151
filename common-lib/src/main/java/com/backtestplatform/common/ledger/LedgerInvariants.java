package com.backtestplatform.common.ledger;

import com.backtestplatform.common.exception.LedgerInvariantException;

import java.util.Map;

/**
 * Bookkeeping checks run before a day's mutations are committed and before a
 * snapshot is appended.
 */
public final class LedgerInvariants {

    /** Absolute tolerance for floating-point comparisons. */
    public static final double EPSILON = 1e-6;

    private LedgerInvariants() {}

    /**
     * @throws LedgerInvariantException if a quantity is negative, any amount is not
     *         finite, margin exceeds cash, or cash sits below
     *         {@code −marginRequirement × totalValue}
     */
    public static void verify(Portfolio portfolio, Map<String, Double> prices, double marginRequirement) {
        if (!Double.isFinite(portfolio.getCash()) || !Double.isFinite(portfolio.getMarginUsed())) {
            throw new LedgerInvariantException("Non-finite cash or margin. cash=" + portfolio.getCash()
                + " marginUsed=" + portfolio.getMarginUsed());
        }
        double shortMargin = 0.0;
        for (Map.Entry<String, Position> e : portfolio.getPositions().entrySet()) {
            Position p = e.getValue();
            if (p.getLongQuantity() < 0 || p.getShortQuantity() < 0) {
                throw new LedgerInvariantException("Negative quantity. ticker=" + e.getKey()
                    + " long=" + p.getLongQuantity() + " short=" + p.getShortQuantity());
            }
            if (!Double.isFinite(p.getLongCostBasis()) || !Double.isFinite(p.getShortCostBasis())) {
                throw new LedgerInvariantException("Non-finite cost basis. ticker=" + e.getKey());
            }
            shortMargin += p.getShortMarginUsed();
        }
        if (Math.abs(shortMargin - portfolio.getMarginUsed()) > EPSILON) {
            throw new LedgerInvariantException(String.format(
                "Margin ledger out of balance. positions=%.6f portfolio=%.6f", shortMargin, portfolio.getMarginUsed()));
        }

        double totalValue = portfolio.totalValue(prices);
        if (!Double.isFinite(totalValue)) {
            throw new LedgerInvariantException("Non-finite total value");
        }
        double floor = -marginRequirement * totalValue;
        if (portfolio.getCash() < floor - EPSILON) {
            throw new LedgerInvariantException(String.format(
                "Cash below margin floor. cash=%.2f floor=%.2f totalValue=%.2f marginRequirement=%.2f",
                portfolio.getCash(), floor, totalValue, marginRequirement));
        }
    }
}
