package com.backtestplatform.backtest.producer;

import com.backtestplatform.common.exception.BacktestValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Every {@link SignalProducer} bean in the context, addressable by id.
 */
@Component
public class SignalProducerRegistry {

    private static final Logger log = LoggerFactory.getLogger(SignalProducerRegistry.class);

    private final Map<String, SignalProducer> producers = new TreeMap<>();

    public SignalProducerRegistry(List<SignalProducer> producers) {
        for (SignalProducer p : producers) {
            SignalProducer previous = this.producers.put(p.id(), p);
            if (previous != null) {
                throw new IllegalStateException("Duplicate signal producer id: " + p.id());
            }
        }
        log.info("[Producers] Registered ids={}", this.producers.keySet());
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(producers.keySet());
    }

    public boolean contains(String id) {
        return producers.containsKey(id);
    }

    /** Resolves ids in request order. */
    public List<SignalProducer> resolve(List<String> ids) {
        List<SignalProducer> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            SignalProducer p = producers.get(id);
            if (p == null) {
                throw new BacktestValidationException("Unknown signal producer: " + id);
            }
            out.add(p);
        }
        return out;
    }
}
