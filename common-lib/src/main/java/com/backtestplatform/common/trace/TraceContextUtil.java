package com.backtestplatform.common.trace;

import org.slf4j.MDC;

/**
 * Puts the backtest id on log lines written from reactive callbacks.
 *
 * <p>The engine runs each day on whatever worker thread the scheduler hands out, so MDC
 * is set only around a single log statement and cleared straight after.
 */
public final class TraceContextUtil {

    public static final String BACKTEST_ID_KEY = "backtestId";

    private TraceContextUtil() {}

    public static void withMdc(String backtestId, Runnable logAction) {
        MDC.put(BACKTEST_ID_KEY, backtestId);
        try {
            logAction.run();
        } finally {
            MDC.remove(BACKTEST_ID_KEY);
        }
    }
}
