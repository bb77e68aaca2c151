package com.backtestplatform.common.performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Risk-adjusted summary of a (possibly partial) backtest.
 *
 * @param totalReturn  percent, {@code (final / initial − 1) × 100}
 * @param maxDrawdown  percent, ≤ 0
 * @param winRate      share of closing fills with a positive realized gain, 0–1
 */
public record PerformanceMetrics(
    @JsonProperty("total_return")    double totalReturn,
    @JsonProperty("final_value")     double finalValue,
    @JsonProperty("initial_capital") double initialCapital,
    @JsonProperty("sharpe_ratio")    double sharpeRatio,
    @JsonProperty("sortino_ratio")   double sortinoRatio,
    @JsonProperty("max_drawdown")    double maxDrawdown,
    @JsonProperty("win_rate")        double winRate,
    @JsonProperty("total_trades")    int totalTrades,
    @JsonProperty("trading_days")    int tradingDays
) {
    public static PerformanceMetrics initial(double initialCapital) {
        return new PerformanceMetrics(0.0, initialCapital, initialCapital, 0.0, 0.0, 0.0, 0.0, 0, 0);
    }
}
