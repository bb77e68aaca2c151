package com.backtestplatform.backtest.producer;

import java.util.List;

/**
 * Indicator math used by the built-in signal producers.
 *
 * <p>Every series is newest-first: {@code closes.get(0)} is the close of the day being
 * evaluated. Functions return NaN when the series is too short for the requested window.
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    /**
     * Relative strength index over {@code period} bars, Wilder-smoothed across the whole series.
     * A series with no movement reads 50.
     */
    public static double rsi(List<Double> closes, int period) {
        if (!covers(closes, period + 1) || period <= 0) return Double.NaN;

        // walk from the oldest close towards index 0
        int oldest = closes.size() - 1;
        double up = 0;
        double down = 0;
        for (int idx = oldest - 1; idx >= oldest - period; idx--) {
            double delta = closes.get(idx) - closes.get(idx + 1);
            up   += Math.max(delta, 0);
            down += Math.max(-delta, 0);
        }
        up /= period;
        down /= period;

        for (int idx = oldest - period - 1; idx >= 0; idx--) {
            double delta = closes.get(idx) - closes.get(idx + 1);
            up   = smooth(up, Math.max(delta, 0), period);
            down = smooth(down, Math.max(-delta, 0), period);
        }

        if (down == 0) return up == 0 ? 50.0 : 100.0;
        return 100.0 * up / (up + down);
    }

    /** Mean of the newest {@code window} closes. */
    public static double sma(List<Double> closes, int window) {
        if (!covers(closes, window)) return Double.NaN;
        return sum(closes, window) / window;
    }

    /**
     * Exponential moving average seeded with the oldest close and run up to the newest.
     */
    public static double ema(List<Double> closes, int window) {
        if (!covers(closes, window)) return Double.NaN;
        double alpha = 2.0 / (window + 1);
        double value = closes.get(closes.size() - 1);
        for (int idx = closes.size() - 2; idx >= 0; idx--) {
            value += alpha * (closes.get(idx) - value);
        }
        return value;
    }

    /** Population standard deviation of the newest {@code window} closes. */
    public static double stdDev(List<Double> closes, int window) {
        if (!covers(closes, window)) return Double.NaN;
        double mean = sum(closes, window) / window;
        double squares = 0;
        for (Double close : closes.subList(0, window)) {
            squares += (close - mean) * (close - mean);
        }
        return Math.sqrt(squares / window);
    }

    /** Distance of the latest close from its {@code window} mean, in standard deviations. */
    public static double zScore(List<Double> closes, int window) {
        double sd = stdDev(closes, window);
        if (Double.isNaN(sd)) return Double.NaN;
        if (sd == 0) return 0.0;
        return (closes.get(0) - sma(closes, window)) / sd;
    }

    /** Fractional change from {@code lag} bars ago to now. */
    public static double momentum(List<Double> closes, int lag) {
        if (!covers(closes, lag + 1) || closes.get(lag) == 0) return Double.NaN;
        return closes.get(0) / closes.get(lag) - 1.0;
    }

    private static boolean covers(List<Double> closes, int needed) {
        return closes != null && needed > 0 && closes.size() >= needed;
    }

    private static double sum(List<Double> closes, int window) {
        double total = 0;
        for (int idx = 0; idx < window; idx++) total += closes.get(idx);
        return total;
    }

    private static double smooth(double previous, double current, int period) {
        return (previous * (period - 1) + current) / period;
    }
}
