package com.backtestplatform.backtest.session;

import com.backtestplatform.backtest.config.BacktestConfig;
import com.backtestplatform.backtest.engine.BacktestResult;
import com.backtestplatform.backtest.event.BacktestCompleteEvent;
import com.backtestplatform.backtest.event.BacktestEvent;
import com.backtestplatform.backtest.event.BacktestStartEvent;
import com.backtestplatform.backtest.event.PortfolioUpdateEvent;
import com.backtestplatform.backtest.producer.SignalProducerRegistry;
import com.backtestplatform.backtest.support.InMemoryMarketData;
import com.backtestplatform.backtest.support.ScriptedProducer;
import com.backtestplatform.backtest.support.TestEngines;
import com.backtestplatform.common.exception.BacktestValidationException;
import com.backtestplatform.common.exception.SessionNotFoundException;
import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.model.SignalDirection;
import com.backtestplatform.common.model.TradeSignal;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.*;

class BacktestServiceTest {

    private static final LocalDate BARS_FROM = LocalDate.of(2024, 1, 1);
    private static final LocalDate START     = LocalDate.of(2024, 2, 1);
    private static final LocalDate END       = LocalDate.of(2024, 2, 10);
    private static final LocalDate CANCEL_ON = LocalDate.of(2024, 2, 3);

    private final CountDownLatch gate = new CountDownLatch(1);
    private SessionRegistry registry;
    private BacktestService service;

    @BeforeEach
    void setUp() {
        registry = new SessionRegistry(Duration.ofHours(1), Duration.ofMinutes(5), Clock.systemUTC());
        InMemoryMarketData marketData = new InMemoryMarketData()
            .withDailyCloses("AAPL", BARS_FROM, InMemoryMarketData.choppy(60, 180))
            .gatedBy(gate);

        SignalProducerRegistry producers = TestEngines.registry(
            ScriptedProducer.alternating("alternating"),
            ScriptedProducer.constant("steady", SignalDirection.BULLISH, 60),
            ScriptedProducer.of("canceller", ctx -> {
                if (ctx.date().equals(CANCEL_ON)) {
                    registry.require(ctx.backtestId()).requestCancel();
                }
                return TradeSignal.of("canceller", ctx.ticker(), SignalDirection.NEUTRAL, 10, "");
            }));

        service = new BacktestService(registry, TestEngines.engine(marketData, producers), producers,
            1024, Schedulers.boundedElastic());
    }

    private static BacktestRequest request(String... producers) {
        return new BacktestRequest(List.of("AAPL"), Arrays.asList(producers), START, END, 100_000.0, null);
    }

    @Test
    @DisplayName("cancel requested during day 3 of 10 → exactly 3 portfolio updates, then cancelled")
    void cancelMidRun() {
        BacktestSession session = service.start(request("steady", "canceller"));
        assertEquals(BacktestStatus.PENDING, session.status());

        StepVerifier.create(service.subscribe(session.id())
                .filter(e -> e instanceof PortfolioUpdateEvent || e.isTerminal()))
            .then(gate::countDown)
            .expectNextCount(3)
            .assertNext(e -> assertEquals("cancelled", ((BacktestCompleteEvent) e).status()))
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        BacktestStatusView view = service.status(session.id());
        assertEquals(BacktestStatus.CANCELLED, view.status());
        assertFalse(view.isRunning());
        assertEquals(CANCEL_ON, view.currentDate());
        assertEquals(BacktestStatus.CANCELLED, service.cancel(session.id()));
        assertEquals(4, session.result().portfolioHistory().size());
    }

    @Test
    @DisplayName("streamed snapshots equal the synchronous run's history")
    void streamMatchesRunSync() {
        BacktestSession session = service.start(request("alternating"));
        List<DailySnapshot> streamed = new ArrayList<>();

        StepVerifier.create(service.subscribe(session.id()))
            .then(gate::countDown)
            .assertNext(e -> assertInstanceOf(BacktestStartEvent.class, e))
            .thenConsumeWhile(e -> !e.isTerminal(), e -> {
                if (e instanceof PortfolioUpdateEvent p) streamed.add(p.toSnapshot());
            })
            .assertNext(e -> assertEquals("completed", ((BacktestCompleteEvent) e).status()))
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        BacktestResult sync = service.runSync(request("alternating"));

        assertEquals(BacktestStatus.COMPLETED, sync.status());
        assertEquals(10, streamed.size());
        assertEquals(sync.portfolioHistory().subList(1, sync.portfolioHistory().size()), streamed);
        assertEquals(BacktestStatus.COMPLETED, service.status(session.id()).status());
    }

    @Test
    @DisplayName("JSON payloads of the stream decode back into the run-sync history")
    void wirePayloadsMatchRunSync() throws Exception {
        ObjectMapper mapper = new BacktestConfig().objectMapper();
        BacktestSession session = service.start(request("alternating"));
        List<BacktestEvent> received = new ArrayList<>();

        StepVerifier.create(service.subscribe(session.id()))
            .then(gate::countDown)
            .thenConsumeWhile(e -> true, received::add)
            .expectComplete()
            .verify(Duration.ofSeconds(10));

        List<DailySnapshot> decoded = new ArrayList<>();
        for (BacktestEvent event : received) {
            String json = mapper.writeValueAsString(event);
            JsonNode node = mapper.readTree(json);
            assertEquals(event.type(), node.get("type").asText());
            assertFalse(node.has("terminal"), json);
            if (event instanceof PortfolioUpdateEvent) {
                decoded.add(mapper.readValue(json, PortfolioUpdateEvent.class).toSnapshot());
            }
        }

        BacktestResult sync = service.runSync(request("alternating"));
        assertEquals(10, decoded.size());
        assertEquals(sync.portfolioHistory().subList(1, sync.portfolioHistory().size()), decoded);
    }

    @Test
    @DisplayName("cancel on a finished session keeps its terminal status")
    void cancelAfterCompletion() {
        gate.countDown();
        BacktestResult result = service.runSync(request("steady"));

        assertEquals(BacktestStatus.COMPLETED, service.cancel(result.backtestId()));
        assertEquals(BacktestStatus.COMPLETED, service.status(result.backtestId()).status());
    }

    @Test
    @DisplayName("unknown ids → SessionNotFoundException")
    void unknownSession() {
        assertThrows(SessionNotFoundException.class, () -> service.status("missing"));
        assertThrows(SessionNotFoundException.class, () -> service.cancel("missing"));
        assertThrows(SessionNotFoundException.class, () -> service.subscribe("missing"));
    }

    @Test
    @DisplayName("producer ids are listed sorted")
    void producerIds() {
        assertEquals(List.of("alternating", "canceller", "steady"), List.copyOf(service.producerIds()));
    }

    @Nested
    @DisplayName("request validation")
    class Validation {

        private void rejects(BacktestRequest request, String messagePart) {
            BacktestValidationException e = assertThrows(BacktestValidationException.class,
                () -> service.validate(request));
            assertTrue(e.getMessage().contains(messagePart), e.getMessage());
        }

        @Test
        @DisplayName("normalizes tickers and producers, defaults margin to 0")
        void normalizes() {
            BacktestRequest normalized = service.validate(new BacktestRequest(
                List.of(" aapl", "AAPL", "msft"), List.of("steady", "steady", "alternating"),
                START, END, 5_000.0, null));

            assertEquals(List.of("AAPL", "MSFT"), normalized.tickers());
            assertEquals(List.of("steady", "alternating"), normalized.selectedSignalProducers());
            assertEquals(Double.valueOf(0.0), normalized.marginRequirement());
        }

        @Test
        void emptyTickers() {
            rejects(new BacktestRequest(List.of(), List.of("steady"), START, END, 1_000.0, null), "ticker");
        }

        @Test
        void blankTicker() {
            rejects(new BacktestRequest(List.of("AAPL", " "), List.of("steady"), START, END, 1_000.0, null), "blank");
        }

        @Test
        void unknownProducer() {
            rejects(new BacktestRequest(List.of("AAPL"), List.of("oracle"), START, END, 1_000.0, null), "oracle");
        }

        @Test
        void noProducer() {
            rejects(new BacktestRequest(List.of("AAPL"), null, START, END, 1_000.0, null), "producer");
        }

        @Test
        void invertedDates() {
            rejects(new BacktestRequest(List.of("AAPL"), List.of("steady"), END, START, 1_000.0, null), "start_date");
        }

        @Test
        void sameDayRange() {
            rejects(new BacktestRequest(List.of("AAPL"), List.of("steady"), START, START, 1_000.0, null), "start_date");
        }

        @Test
        void nonPositiveCash() {
            rejects(new BacktestRequest(List.of("AAPL"), List.of("steady"), START, END, 0.0, null), "initial_cash");
            rejects(new BacktestRequest(List.of("AAPL"), List.of("steady"), START, END, Double.NaN, null), "initial_cash");
        }

        @Test
        void marginOutOfRange() {
            rejects(new BacktestRequest(List.of("AAPL"), List.of("steady"), START, END, 1_000.0, 1.5), "margin");
        }

        @Test
        @DisplayName("invalid start request registers no session")
        void nothingRegistered() {
            assertThrows(BacktestValidationException.class, () -> service.start(
                new BacktestRequest(List.of(), List.of("steady"), START, END, 1_000.0, null)));
            assertTrue(registry.all().isEmpty());
        }
    }
}
