package com.backtestplatform.backtest.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Per-session fan-out channel.
 *
 * <p>Hot and non-replaying: a subscriber sees only events emitted after it subscribed.
 * Each subscriber gets its own bounded buffer; when a slow subscriber's buffer is full
 * the oldest buffered event is dropped, so emission never blocks the session loop.
 * Emission happens from the single session thread.
 */
public class BacktestEventStream {

    private static final Logger log = LoggerFactory.getLogger(BacktestEventStream.class);

    private final String backtestId;
    private final int subscriberBuffer;
    private final Sinks.Many<BacktestEvent> sink = Sinks.many().multicast().directBestEffort();
    private volatile boolean closed;

    public BacktestEventStream(String backtestId, int subscriberBuffer) {
        this.backtestId       = backtestId;
        this.subscriberBuffer = subscriberBuffer;
    }

    /**
     * Emits {@code event}; a terminal event also completes the stream.
     *
     * @throws IllegalStateException if the stream was already closed by a terminal event
     */
    public void emit(BacktestEvent event) {
        if (closed) {
            throw new IllegalStateException("Event stream closed. backtestId=" + backtestId + " type=" + event.type());
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[EventStream] Emit failed. backtestId={} type={} result={}", backtestId, event.type(), result);
        }
        if (event.isTerminal()) {
            closed = true;
            sink.tryEmitComplete();
        }
    }

    public Flux<BacktestEvent> subscribe() {
        return sink.asFlux()
            .onBackpressureBuffer(subscriberBuffer,
                dropped -> log.debug("[EventStream] Slow subscriber, dropped oldest. backtestId={} type={}",
                    backtestId, dropped.type()),
                BufferOverflowStrategy.DROP_OLDEST);
    }

    public boolean isClosed() {
        return closed;
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
