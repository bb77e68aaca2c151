package com.backtestplatform.common.performance;

import com.backtestplatform.common.execution.Fill;
import com.backtestplatform.common.ledger.DailySnapshot;

import java.util.List;

/**
 * Incremental counterpart of {@link PerformanceCalculator}: O(1) per appended
 * snapshot, used for the per-day {@code performance_update} events.
 *
 * <p>Variance uses Welford's update, which stays within 1e-9 of the two-pass
 * computation for realistic daily returns.
 */
public class RunningPerformanceTracker {

    private final double initialCapital;

    private int n;
    private double mean;
    private double m2;
    private double downsideSquares;

    private double peak;
    private double maxDrawdown;
    private double lastValue;

    private int closingFills;
    private int winningFills;
    private int totalTrades;

    public RunningPerformanceTracker(DailySnapshot opening, double initialCapital) {
        this.initialCapital = initialCapital;
        this.peak           = opening.totalValue();
        this.lastValue      = opening.totalValue();
    }

    /** Folds in one post-opening snapshot and the fills that produced it. */
    public PerformanceMetrics add(DailySnapshot snapshot, List<Fill> fills) {
        double r = snapshot.dailyReturn();
        n++;
        double delta = r - mean;
        mean += delta / n;
        m2   += delta * (r - mean);
        double down = Math.min(r, 0.0);
        downsideSquares += down * down;

        lastValue = snapshot.totalValue();
        peak      = Math.max(peak, lastValue);
        if (peak > 0.0) maxDrawdown = Math.min(maxDrawdown, lastValue / peak - 1.0);

        for (Fill f : fills) {
            if (!f.executed()) continue;
            totalTrades++;
            if (f.action().isClosing()) {
                closingFills++;
                if (f.realizedGain() > 0.0) winningFills++;
            }
        }
        return current();
    }

    public PerformanceMetrics current() {
        double stddev   = n >= 2 ? Math.sqrt(Math.max(0.0, m2) / (n - 1)) : 0.0;
        double downside = n > 0 ? Math.sqrt(downsideSquares / n) : 0.0;
        return new PerformanceMetrics(
            PerformanceCalculator.totalReturn(lastValue, initialCapital), lastValue, initialCapital,
            PerformanceCalculator.ratio(mean, stddev, n >= 2),
            PerformanceCalculator.ratio(mean, downside, n > 0),
            PerformanceCalculator.finite(maxDrawdown * 100.0),
            closingFills == 0 ? 0.0 : (double) winningFills / closingFills,
            totalTrades, n);
    }
}
