package com.backtestplatform.common.consensus;

import com.backtestplatform.common.model.SignalDirection;

import java.util.Map;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * @param direction       winning direction; {@code NEUTRAL} when undecided
 * @param tie             true when two or more directions shared the top weight
 * @param weights         summed confidence per direction
 * @param producerWeights per-producer weight used in this computation
 */
public record ConsensusResult(
    SignalDirection direction,
    boolean tie,
    Map<SignalDirection, Double> weights,
    Map<String, Double> producerWeights
) {
    public double weightOf(SignalDirection d) {
        return weights.getOrDefault(d, 0.0);
    }
}
