package com.backtestplatform.backtest.engine;

import com.backtestplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Logs each stage of a backtest session's lifecycle. Pure side effects; no business
 * logic.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #SESSION_STARTED}   : price history loaded, calendar built</li>
 *   <li>{@link #DAY_STARTED}       : a tradable date begins</li>
 *   <li>{@link #SIGNALS_COLLECTED} : every producer call for the day settled</li>
 *   <li>{@link #ORDERS_SYNTHESIZED}: risk caps applied, one order per ticker</li>
 *   <li>{@link #ORDERS_EXECUTED}   : fills applied and committed to the ledger</li>
 *   <li>{@link #SNAPSHOT_APPENDED} : daily snapshot recorded</li>
 *   <li>{@link #SESSION_FINISHED}  : terminal status reached</li>
 * </ol>
 */
@Component
public class BacktestFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(BacktestFlowLogger.class);

    public static final String SESSION_STARTED    = "SESSION_STARTED";
    public static final String DAY_STARTED        = "DAY_STARTED";
    public static final String SIGNALS_COLLECTED  = "SIGNALS_COLLECTED";
    public static final String ORDERS_SYNTHESIZED = "ORDERS_SYNTHESIZED";
    public static final String ORDERS_EXECUTED    = "ORDERS_EXECUTED";
    public static final String SNAPSHOT_APPENDED  = "SNAPSHOT_APPENDED";
    public static final String SESSION_FINISHED   = "SESSION_FINISHED";

    public void stage(String stageName, String backtestId, LocalDate date, String detail) {
        TraceContextUtil.withMdc(backtestId, () ->
            log.info("[BacktestFlow] stage={} backtestId={} date={} {}", stageName, backtestId, date, detail)
        );
    }

    /** Per-day stages are chatty on long ranges, so they log at debug. */
    public void dayStage(String stageName, String backtestId, LocalDate date, String detail) {
        TraceContextUtil.withMdc(backtestId, () ->
            log.debug("[BacktestFlow] stage={} backtestId={} date={} {}", stageName, backtestId, date, detail)
        );
    }
}
