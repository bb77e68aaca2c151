package com.backtestplatform.backtest.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Closed set of events a backtest session emits, in causal order:
 * {@code backtest_start}, then per day {@code backtest_progress}, {@code trading}*,
 * {@code portfolio_update}, {@code performance_update}, and finally exactly one of
 * {@code backtest_complete} or {@code error}.
 *
 * <p>{@code type} is written on every payload and skipped when one is read back.
 */
@JsonIgnoreProperties(value = "type", allowGetters = true)
public sealed interface BacktestEvent
    permits BacktestStartEvent, BacktestProgressEvent, TradingEvent, PortfolioUpdateEvent,
            PerformanceUpdateEvent, BacktestCompleteEvent, BacktestErrorEvent {

    String backtestId();

    Instant timestamp();

    /** Wire discriminator, also used as the SSE event name. */
    String type();

    @JsonIgnore
    default boolean isTerminal() {
        return false;
    }
}
