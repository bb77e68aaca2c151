package com.backtestplatform.common.consensus;

import com.backtestplatform.common.model.TradeSignal;

import java.util.List;

/**
 * Collapses the signals every producer emitted for one ticker on one day into a single
 * direction and confidence. Implementations are called from several sessions at once and
 * must not keep state between calls. An empty list still yields a result.
 */
public interface ConsensusEngine {

    ConsensusResult compute(List<TradeSignal> signals);
}
