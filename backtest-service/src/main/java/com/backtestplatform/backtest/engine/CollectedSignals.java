package com.backtestplatform.backtest.engine;

import com.backtestplatform.common.model.TradeSignal;

import java.util.List;
import java.util.Map;

/**
 * @param signals  per ticker, in producer order; producers that failed or timed out are absent
 * @param warnings one entry per dropped producer call
 */
public record CollectedSignals(Map<String, List<TradeSignal>> signals, List<String> warnings) {}
