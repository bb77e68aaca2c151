package com.backtestplatform.backtest.event;

import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.performance.PerformanceMetrics;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Terminal event for a completed or cancelled run; {@code status} tells which.
 */
public record BacktestCompleteEvent(
    @JsonProperty("backtest_id")         String backtestId,
    @JsonProperty("timestamp")           Instant timestamp,
    @JsonProperty("status")              String status,
    @JsonProperty("performance_metrics") PerformanceMetrics metrics,
    @JsonProperty("portfolio_history")   List<DailySnapshot> portfolioHistory
) implements BacktestEvent {

    @JsonProperty("total_return")
    public double totalReturn() { return metrics.totalReturn(); }

    @JsonProperty("final_value")
    public double finalValue() { return metrics.finalValue(); }

    @JsonProperty("initial_capital")
    public double initialCapital() { return metrics.initialCapital(); }

    @JsonProperty("sharpe_ratio")
    public double sharpeRatio() { return metrics.sharpeRatio(); }

    @JsonProperty("max_drawdown")
    public double maxDrawdown() { return metrics.maxDrawdown(); }

    @Override
    @JsonProperty("type")
    public String type() { return "backtest_complete"; }

    @Override
    @JsonIgnore
    public boolean isTerminal() { return true; }
}
