package com.backtestplatform.backtest.session;

import com.backtestplatform.backtest.engine.BacktestEngine;
import com.backtestplatform.backtest.engine.BacktestResult;
import com.backtestplatform.backtest.event.BacktestEvent;
import com.backtestplatform.backtest.event.BacktestEventStream;
import com.backtestplatform.backtest.producer.SignalProducerRegistry;
import com.backtestplatform.common.exception.BacktestValidationException;
import com.backtestplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Session controller: validates requests, creates sessions, runs them in the
 * background and answers status, cancel and subscribe calls.
 */
@Service
public class BacktestService {

    private static final Logger log = LoggerFactory.getLogger(BacktestService.class);

    private final SessionRegistry registry;
    private final BacktestEngine engine;
    private final SignalProducerRegistry producers;
    private final int subscriberBuffer;
    private final Scheduler sessionScheduler;

    @Autowired
    public BacktestService(SessionRegistry registry, BacktestEngine engine, SignalProducerRegistry producers,
                           @Value("${backtest.events.subscriber-buffer:256}") int subscriberBuffer) {
        this(registry, engine, producers, subscriberBuffer, Schedulers.boundedElastic());
    }

    BacktestService(SessionRegistry registry, BacktestEngine engine, SignalProducerRegistry producers,
                    int subscriberBuffer, Scheduler sessionScheduler) {
        this.registry         = registry;
        this.engine           = engine;
        this.producers        = producers;
        this.subscriberBuffer = subscriberBuffer;
        this.sessionScheduler = sessionScheduler;
    }

    /**
     * Creates a {@code pending} session and starts its day loop in the background.
     *
     * @throws BacktestValidationException if the request is invalid
     */
    public BacktestSession start(BacktestRequest request) {
        BacktestSession session = newSession(validate(request));
        registry.register(session);
        TraceContextUtil.withMdc(session.id(), () ->
            log.info("[Backtest] Session created. backtestId={} tickers={} from={} to={}",
                     session.id(), session.request().tickers(), session.request().startDate(),
                     session.request().endDate()));

        Mono.fromCallable(() -> engine.run(session))
            .subscribeOn(sessionScheduler)
            .subscribe(
                result -> TraceContextUtil.withMdc(session.id(), () ->
                    log.info("[Backtest] Session ended. backtestId={} status={}", session.id(), result.status())),
                err -> TraceContextUtil.withMdc(session.id(), () ->
                    log.error("[Backtest] Session loop crashed. backtestId={}", session.id(), err))
            );
        return session;
    }

    /** Validates, then runs the whole backtest on the calling thread. */
    public BacktestResult runSync(BacktestRequest request) {
        BacktestSession session = newSession(validate(request));
        registry.register(session);
        log.info("[Backtest] Synchronous run. backtestId={}", session.id());
        return engine.run(session);
    }

    public BacktestStatusView status(String id) {
        return registry.require(id).view();
    }

    /**
     * Requests cooperative cancellation; the loop stops at the next day boundary.
     *
     * @return the status after the request; a session that already finished keeps its
     *         terminal status
     */
    public BacktestStatus cancel(String id) {
        BacktestSession session = registry.require(id);
        if (!session.requestCancel()) {
            BacktestStatus outcome = session.outcome();
            log.info("[Backtest] Cancel ignored, session already finished. backtestId={} status={}", id, outcome);
            return outcome;
        }
        TraceContextUtil.withMdc(id, () -> log.info("[Backtest] Cancel requested. backtestId={}", id));
        return BacktestStatus.CANCELLED;
    }

    public Flux<BacktestEvent> subscribe(String id) {
        BacktestSession session = registry.require(id);
        log.info("[Backtest] Stream subscriber attached. backtestId={}", id);
        return session.events().subscribe();
    }

    public Set<String> producerIds() {
        return producers.ids();
    }

    private BacktestSession newSession(BacktestRequest request) {
        String id = UUID.randomUUID().toString();
        return new BacktestSession(id, request, new BacktestEventStream(id, subscriberBuffer),
            registry.clock().instant());
    }

    /**
     * @return the request with tickers upper-cased and de-duplicated (first occurrence
     *         wins) and the margin requirement defaulted
     */
    BacktestRequest validate(BacktestRequest request) {
        if (request == null) {
            throw new BacktestValidationException("Request body is required");
        }
        if (request.tickers() == null || request.tickers().isEmpty()) {
            throw new BacktestValidationException("At least one ticker is required");
        }
        Set<String> tickers = new LinkedHashSet<>();
        for (String t : request.tickers()) {
            if (t == null || t.isBlank()) {
                throw new BacktestValidationException("Tickers must not be blank");
            }
            tickers.add(t.trim().toUpperCase(Locale.ROOT));
        }

        List<String> selected = request.selectedSignalProducers();
        if (selected == null || selected.isEmpty()) {
            throw new BacktestValidationException("At least one signal producer must be selected");
        }
        List<String> producerIds = new ArrayList<>(new LinkedHashSet<>(selected));
        for (String p : producerIds) {
            if (p == null || !producers.contains(p)) {
                throw new BacktestValidationException("Unknown signal producer: " + p
                    + ". Available: " + producers.ids());
            }
        }

        if (request.startDate() == null || request.endDate() == null) {
            throw new BacktestValidationException("start_date and end_date are required");
        }
        if (!request.startDate().isBefore(request.endDate())) {
            throw new BacktestValidationException("start_date must be before end_date");
        }
        if (request.initialCash() == null || !(request.initialCash() > 0.0) || request.initialCash().isInfinite()) {
            throw new BacktestValidationException("initial_cash must be positive");
        }
        double margin = request.marginRequirementOrDefault();
        if (!(margin >= 0.0 && margin <= 1.0)) {
            throw new BacktestValidationException("margin_requirement must be between 0 and 1");
        }

        return new BacktestRequest(List.copyOf(tickers), List.copyOf(producerIds), request.startDate(),
            request.endDate(), request.initialCash(), margin);
    }
}
