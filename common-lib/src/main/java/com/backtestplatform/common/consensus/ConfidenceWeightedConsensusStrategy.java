package com.backtestplatform.common.consensus;

import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link ConsensusEngine}: every producer votes for its direction with a
 * weight equal to its confidence.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>{@code weight[direction] = Σ confidence} over signals with that direction.</li>
 *   <li>The direction with the strictly highest weight wins.</li>
 *   <li>Any tie at the top, or no signals at all, yields {@code NEUTRAL}.</li>
 * </ol>
 *
 * <p>Summation runs in the order of {@link SignalDirection} constants and signal list
 * order, so identical input always produces an identical result.
 */
public class ConfidenceWeightedConsensusStrategy implements ConsensusEngine {

    @Override
    public ConsensusResult compute(List<TradeSignal> signals) {
        Map<SignalDirection, Double> weights = new EnumMap<>(SignalDirection.class);
        for (SignalDirection d : SignalDirection.values()) weights.put(d, 0.0);

        Map<String, Double> producerWeights = new LinkedHashMap<>();
        for (TradeSignal s : signals) {
            weights.merge(s.direction(), s.confidence(), Double::sum);
            producerWeights.put(s.producerId(), s.confidence());
        }

        SignalDirection best = SignalDirection.NEUTRAL;
        double bestWeight    = -1.0;
        boolean tie          = false;
        for (SignalDirection d : SignalDirection.values()) {
            double w = weights.get(d);
            if (w > bestWeight) {
                best       = d;
                bestWeight = w;
                tie        = false;
            } else if (w == bestWeight) {
                tie = true;
            }
        }

        boolean undecided = signals.isEmpty() || bestWeight <= 0.0 || tie;
        return new ConsensusResult(undecided ? SignalDirection.NEUTRAL : best, tie && !signals.isEmpty(),
            Collections.unmodifiableMap(weights), Collections.unmodifiableMap(producerWeights));
    }
}
