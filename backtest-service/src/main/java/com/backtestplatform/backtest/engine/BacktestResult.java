package com.backtestplatform.backtest.engine;

import com.backtestplatform.backtest.session.BacktestStatus;
import com.backtestplatform.common.execution.Fill;
import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.performance.PerformanceMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of one engine run; also the {@code POST /run-sync} response body.
 *
 * @param portfolioHistory every snapshot, opening one included
 * @param trades           executed fills in execution order
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BacktestResult(
    @JsonProperty("backtest_id")         String backtestId,
    @JsonProperty("status")              BacktestStatus status,
    @JsonProperty("performance_metrics") PerformanceMetrics performanceMetrics,
    @JsonProperty("portfolio_history")   List<DailySnapshot> portfolioHistory,
    @JsonProperty("final_portfolio")     FinalPortfolio finalPortfolio,
    @JsonProperty("trades")              List<Fill> trades,
    @JsonProperty("warnings")            List<String> warnings,
    @JsonProperty("error_message")       String errorMessage
) {}
