package com.backtestplatform.common.performance;

import com.backtestplatform.common.execution.Fill;
import com.backtestplatform.common.ledger.DailySnapshot;

import java.util.List;

/**
 * Computes {@link PerformanceMetrics} from scratch over a snapshot series.
 *
 * <p>The first snapshot is the opening one; returns are taken from every snapshot
 * after it. All outputs are finite: degenerate inputs (no returns, zero variance,
 * no downside) yield 0 rather than NaN or infinity.
 */
public final class PerformanceCalculator {

    public static final double TRADING_DAYS_PER_YEAR = 252.0;

    /** Deviations at or below this fraction of the mean's magnitude count as zero. */
    static final double FLAT_DEVIATION_EPSILON = 1e-12;

    private PerformanceCalculator() {}

    public static PerformanceMetrics compute(List<DailySnapshot> snapshots, List<Fill> fills, double initialCapital) {
        if (snapshots.isEmpty()) {
            return PerformanceMetrics.initial(initialCapital);
        }

        int n = snapshots.size() - 1;
        double sum = 0.0;
        for (int i = 1; i < snapshots.size(); i++) sum += snapshots.get(i).dailyReturn();
        double mean = n > 0 ? sum / n : 0.0;

        double squaredDeviation = 0.0;
        double downsideSquares  = 0.0;
        for (int i = 1; i < snapshots.size(); i++) {
            double r = snapshots.get(i).dailyReturn();
            squaredDeviation += (r - mean) * (r - mean);
            double down = Math.min(r, 0.0);
            downsideSquares += down * down;
        }

        double stddev = n >= 2 ? Math.sqrt(squaredDeviation / (n - 1)) : 0.0;
        double sharpe = ratio(mean, stddev, n >= 2);

        double downside = n > 0 ? Math.sqrt(downsideSquares / n) : 0.0;
        double sortino  = ratio(mean, downside, n > 0);

        double peak = snapshots.get(0).totalValue();
        double maxDrawdown = 0.0;
        for (DailySnapshot s : snapshots) {
            peak = Math.max(peak, s.totalValue());
            if (peak > 0.0) maxDrawdown = Math.min(maxDrawdown, s.totalValue() / peak - 1.0);
        }

        double finalValue = snapshots.get(snapshots.size() - 1).totalValue();
        return new PerformanceMetrics(
            totalReturn(finalValue, initialCapital), finalValue, initialCapital,
            sharpe, sortino, finite(maxDrawdown * 100.0),
            winRate(fills), totalTrades(fills), n);
    }

    static double ratio(double mean, double deviation, boolean enoughData) {
        // rounding leaves a constant series with a deviation near 1e-18, not 0
        if (!enoughData || !(deviation > FLAT_DEVIATION_EPSILON * Math.max(1.0, Math.abs(mean)))) return 0.0;
        return finite(mean / deviation * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    static double totalReturn(double finalValue, double initialCapital) {
        return initialCapital > 0.0 ? finite((finalValue / initialCapital - 1.0) * 100.0) : 0.0;
    }

    static double winRate(List<Fill> fills) {
        int closing = 0;
        int winners = 0;
        for (Fill f : fills) {
            if (!f.executed() || !f.action().isClosing()) continue;
            closing++;
            if (f.realizedGain() > 0.0) winners++;
        }
        return closing == 0 ? 0.0 : (double) winners / closing;
    }

    static int totalTrades(List<Fill> fills) {
        int count = 0;
        for (Fill f : fills) if (f.executed()) count++;
        return count;
    }

    static double finite(double v) {
        return Double.isFinite(v) ? v : 0.0;
    }
}
