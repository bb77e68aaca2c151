package com.backtestplatform.backtest.engine;

import com.backtestplatform.backtest.producer.SignalProducer;
import com.backtestplatform.common.exception.ProducerTimeoutException;
import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.model.TradeSignal;
import com.backtestplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.TimeoutException;

/**
 * Fans one day's producer calls out across the producer pool and joins them.
 *
 * <p>Every (ticker, producer) call runs concurrently with a per-call timeout. A timed-out
 * call is retried with exponential backoff; when retries are exhausted, or the producer
 * throws, that producer's signal is omitted for the ticker and a warning is recorded.
 * {@link #collect} returns only once every call has settled.
 */
@Component
public class SignalAggregator {

    private static final Logger log = LoggerFactory.getLogger(SignalAggregator.class);

    private final Scheduler producerScheduler;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration backoff;

    public SignalAggregator(Scheduler producerScheduler,
                            @Value("${backtest.producers.timeout:10s}") Duration timeout,
                            @Value("${backtest.producers.max-retries:2}") int maxRetries,
                            @Value("${backtest.producers.backoff:200ms}") Duration backoff) {
        this.producerScheduler = producerScheduler;
        this.timeout           = timeout;
        this.maxRetries        = maxRetries;
        this.backoff           = backoff;
    }

    /**
     * Blocks the calling (session) thread until every call has settled.
     *
     * @param contexts one context per ticker that has a bar on the day
     */
    public CollectedSignals collect(String backtestId, List<SignalProducer> producers,
                                    Map<String, SignalContext> contexts) {
        Queue<String> warnings = new ConcurrentLinkedQueue<>();

        Map<String, List<TradeSignal>> signals = Flux.fromIterable(contexts.values())
            .flatMapSequential(ctx -> Flux.fromIterable(producers)
                .flatMapSequential(p -> call(backtestId, p, ctx, warnings))
                .collectList()
                .map(list -> Map.entry(ctx.ticker(), list)))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue,
                () -> new TreeMap<String, List<TradeSignal>>())
            .block();

        return new CollectedSignals(signals != null ? signals : new TreeMap<>(), new ArrayList<>(warnings));
    }

    private Mono<TradeSignal> call(String backtestId, SignalProducer producer, SignalContext ctx,
                                   Queue<String> warnings) {
        return Mono.fromCallable(() -> producer.produce(ctx))
            .subscribeOn(producerScheduler)
            .timeout(timeout)
            .onErrorMap(TimeoutException.class, e -> new ProducerTimeoutException(producer.id(), timeout, e))
            .retryWhen(Retry.backoff(maxRetries, backoff)
                .filter(e -> e instanceof ProducerTimeoutException)
                .doBeforeRetry(rs -> TraceContextUtil.withMdc(backtestId, () ->
                    log.warn("[Aggregator] Retrying producer. producer={} ticker={} attempt={}",
                             producer.id(), ctx.ticker(), rs.totalRetries() + 1)))
                .onRetryExhaustedThrow((retry, rs) -> rs.failure()))
            .map(signal -> signal.attributedTo(producer.id(), ctx.ticker()))
            .onErrorResume(e -> {
                String reason = e instanceof ProducerTimeoutException
                    ? "timed out after " + timeout.toMillis() + "ms"
                    : "failed: " + e.getMessage();
                warnings.add("Producer " + producer.id() + " " + reason + " for " + ctx.ticker() + " on " + ctx.date());
                TraceContextUtil.withMdc(backtestId, () ->
                    log.warn("[Aggregator] Signal dropped. producer={} ticker={} date={} reason={}",
                             producer.id(), ctx.ticker(), ctx.date(), reason, e));
                return Mono.empty();
            });
    }
}
