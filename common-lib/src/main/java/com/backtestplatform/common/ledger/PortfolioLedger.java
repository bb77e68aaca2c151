package com.backtestplatform.common.ledger;

import com.backtestplatform.common.exception.LedgerInvariantException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Owns the committed {@link Portfolio} of a session and its append-only
 * {@link DailySnapshot} history.
 *
 * <p>Mutation happens in two steps: the execution simulator works on
 * {@link #workingCopy()}, then {@link #commit(Portfolio, Map)} swaps the verified copy
 * in. A rejected copy leaves the committed state untouched, which is what makes a
 * trading day all-or-nothing.
 */
public class PortfolioLedger {

    private final double initialCapital;
    private final double marginRequirement;
    private final List<DailySnapshot> snapshots = new ArrayList<>();
    private Portfolio portfolio;

    private PortfolioLedger(double initialCapital, double marginRequirement, Portfolio portfolio) {
        this.initialCapital    = initialCapital;
        this.marginRequirement = marginRequirement;
        this.portfolio         = portfolio;
    }

    /**
     * Opens a ledger holding only cash and records the opening snapshot dated
     * {@code openingDate}.
     */
    public static PortfolioLedger open(double initialCash, double marginRequirement,
                                       List<String> tickers, LocalDate openingDate) {
        PortfolioLedger ledger = new PortfolioLedger(initialCash, marginRequirement,
            Portfolio.open(initialCash, tickers));
        ledger.snapshots.add(new DailySnapshot(openingDate, initialCash, 0.0, initialCash, 0.0,
            ledger.portfolio.positionSnapshots(), Map.of()));
        return ledger;
    }

    public Portfolio workingCopy() {
        return portfolio.copy();
    }

    /** Read-only view; callers get a copy so the committed state cannot leak. */
    public Portfolio current() {
        return portfolio.copy();
    }

    public void commit(Portfolio next, Map<String, Double> prices) {
        LedgerInvariants.verify(next, prices, marginRequirement);
        this.portfolio = next;
    }

    /**
     * Values the committed portfolio at {@code prices} and appends a snapshot.
     *
     * @throws LedgerInvariantException if {@code date} is not strictly after the last
     *         snapshot or the valued portfolio breaks an invariant
     */
    public DailySnapshot recordSnapshot(LocalDate date, Map<String, Double> prices) {
        DailySnapshot last = latestSnapshot();
        if (!date.isAfter(last.date())) {
            throw new LedgerInvariantException("Snapshot dates must be strictly increasing. last="
                + last.date() + " next=" + date);
        }
        LedgerInvariants.verify(portfolio, prices, marginRequirement);

        double totalValue  = portfolio.totalValue(prices);
        double dailyReturn = last.totalValue() != 0.0 ? totalValue / last.totalValue() - 1.0 : 0.0;
        DailySnapshot snapshot = new DailySnapshot(date, portfolio.getCash(), portfolio.getMarginUsed(),
            totalValue, dailyReturn, portfolio.positionSnapshots(), prices);
        snapshots.add(snapshot);
        return snapshot;
    }

    public DailySnapshot latestSnapshot() {
        return snapshots.get(snapshots.size() - 1);
    }

    public List<DailySnapshot> snapshots() {
        return Collections.unmodifiableList(snapshots);
    }

    public double initialCapital()    { return initialCapital; }
    public double marginRequirement() { return marginRequirement; }
}
