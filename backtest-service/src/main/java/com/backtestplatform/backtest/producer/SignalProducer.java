package com.backtestplatform.backtest.producer;

import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.model.TradeSignal;

/**
 * A pluggable decision source, selected per backtest request by {@link #id()}.
 *
 * <p>{@link #produce(SignalContext)} is called once per ticker per simulated day and may
 * block; calls run on the producer pool with a per-call timeout. Throwing drops this
 * producer's signal for that ticker and day only.
 */
public interface SignalProducer {

    String id();

    TradeSignal produce(SignalContext context);
}
