package com.backtestplatform.backtest.controller;

import com.backtestplatform.backtest.event.BacktestEvent;
import com.backtestplatform.backtest.session.BacktestRequest;
import com.backtestplatform.backtest.session.BacktestService;
import com.backtestplatform.backtest.session.BacktestSession;
import com.backtestplatform.backtest.session.BacktestStatus;
import com.backtestplatform.common.exception.BacktestValidationException;
import com.backtestplatform.common.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * REST + SSE surface of the backtest service.
 *
 * <p>Typical client flow:
 * <ol>
 *   <li>POST /start: returns {@code backtest_id} and the stream/status URLs</li>
 *   <li>GET  /stream/{id}: SSE until {@code backtest_complete} or {@code error}</li>
 *   <li>GET  /status/{id}: poll progress instead of streaming</li>
 *   <li>DELETE /{id}: cancel at the next day boundary</li>
 * </ol>
 */
@RestController
@RequestMapping("/api/v1/backtest")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final BacktestService backtestService;
    private final Duration keepAlive;

    public BacktestController(BacktestService backtestService,
                              @Value("${backtest.events.keep-alive:15s}") Duration keepAlive) {
        this.backtestService = backtestService;
        this.keepAlive       = keepAlive;
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<Map<String, Object>>> start(@RequestBody BacktestRequest request) {
        log.info("[BacktestAPI] start. tickers={} producers={}",
                 request.tickers(), request.selectedSignalProducers());
        return Mono.fromCallable(() -> backtestService.start(request))
            .map(session -> ResponseEntity.ok(startedBody(session)))
            .onErrorResume(e -> Mono.just(errorResponse("start", e)));
    }

    @GetMapping("/stream/{id}")
    public Mono<ResponseEntity<Flux<ServerSentEvent<Object>>>> stream(@PathVariable String id) {
        log.info("[BacktestAPI] stream client connected. backtestId={}", id);
        return Mono.fromCallable(() -> backtestService.subscribe(id))
            .map(events -> ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .body(withKeepAlive(events)))
            .onErrorResume(SessionNotFoundException.class, e -> {
                log.warn("[BacktestAPI] stream for unknown session. backtestId={}", id);
                return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).<Flux<ServerSentEvent<Object>>>build());
            });
    }

    @GetMapping("/status/{id}")
    public Mono<ResponseEntity<Object>> status(@PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.<Object>ok(backtestService.status(id)))
            .onErrorResume(e -> Mono.just(ResponseEntity.status(statusFor(e))
                .<Object>body(Map.of("error", messageOf(e)))));
    }

    @PostMapping("/run-sync")
    public Mono<ResponseEntity<Object>> runSync(@RequestBody BacktestRequest request) {
        log.info("[BacktestAPI] run-sync. tickers={} producers={}",
                 request.tickers(), request.selectedSignalProducers());
        return Mono.fromCallable(() -> backtestService.runSync(request))
            .subscribeOn(Schedulers.boundedElastic())
            .map(result -> result.status() == BacktestStatus.FAILED
                ? ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).<Object>body(result)
                : ResponseEntity.<Object>ok(result))
            .onErrorResume(e -> Mono.just(ResponseEntity.status(statusFor(e))
                .<Object>body(Map.of("error", messageOf(e)))));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Map<String, Object>>> cancel(@PathVariable String id) {
        log.info("[BacktestAPI] cancel. backtestId={}", id);
        return Mono.fromCallable(() -> backtestService.cancel(id))
            .map(status -> ResponseEntity.ok(Map.<String, Object>of("backtest_id", id, "status", status.wireName())))
            .onErrorResume(e -> Mono.just(errorResponse("cancel", e)));
    }

    @GetMapping("/producers")
    public ResponseEntity<Set<String>> producers() {
        return ResponseEntity.ok(backtestService.producerIds());
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Flux<ServerSentEvent<Object>> withKeepAlive(Flux<BacktestEvent> events) {
        Flux<ServerSentEvent<Object>> data = events
            .map(event -> ServerSentEvent.<Object>builder()
                .event(event.type())
                .data(event)
                .build())
            .publish()
            .autoConnect(2);

        Flux<ServerSentEvent<Object>> keepAliveFrames = Flux.interval(keepAlive)
            .map(tick -> ServerSentEvent.<Object>builder().comment("keepalive").build())
            .takeUntilOther(data.ignoreElements());

        return Flux.merge(data, keepAliveFrames);
    }

    private Map<String, Object> startedBody(BacktestSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("backtest_id", session.id());
        body.put("status", "started");
        body.put("stream_url", "/api/v1/backtest/stream/" + session.id());
        body.put("status_url", "/api/v1/backtest/status/" + session.id());
        return body;
    }

    private ResponseEntity<Map<String, Object>> errorResponse(String operation, Throwable e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("[BacktestAPI] {} error", operation, e);
        } else {
            log.warn("[BacktestAPI] {} rejected. reason={}", operation, e.getMessage());
        }
        return ResponseEntity.status(status).<Map<String, Object>>body(Map.of("error", messageOf(e)));
    }

    private static HttpStatus statusFor(Throwable e) {
        if (e instanceof BacktestValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof SessionNotFoundException)    return HttpStatus.NOT_FOUND;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
