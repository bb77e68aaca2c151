package com.backtestplatform.backtest.engine;

import com.backtestplatform.backtest.event.BacktestCompleteEvent;
import com.backtestplatform.backtest.event.BacktestErrorEvent;
import com.backtestplatform.backtest.event.BacktestEvent;
import com.backtestplatform.backtest.event.BacktestEventStream;
import com.backtestplatform.backtest.event.BacktestStartEvent;
import com.backtestplatform.backtest.event.PortfolioUpdateEvent;
import com.backtestplatform.backtest.event.TradingEvent;
import com.backtestplatform.backtest.producer.SignalProducerRegistry;
import com.backtestplatform.backtest.session.BacktestRequest;
import com.backtestplatform.backtest.session.BacktestSession;
import com.backtestplatform.backtest.session.BacktestStatus;
import com.backtestplatform.backtest.support.InMemoryMarketData;
import com.backtestplatform.backtest.support.ScriptedProducer;
import com.backtestplatform.backtest.support.TestEngines;
import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.ledger.LedgerInvariants;
import com.backtestplatform.common.ledger.PositionSnapshot;
import com.backtestplatform.common.model.SignalDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BacktestEngineTest {

    private static final LocalDate BARS_FROM = LocalDate.of(2024, 1, 1);
    private static final LocalDate START     = LocalDate.of(2024, 1, 20);
    private static final LocalDate END       = LocalDate.of(2024, 2, 9);

    private final List<BacktestEvent> events = new CopyOnWriteArrayList<>();

    private BacktestSession session(BacktestRequest request) {
        BacktestSession session = new BacktestSession("bt-test", request,
            new BacktestEventStream("bt-test", 4096), Instant.EPOCH);
        session.events().subscribe().subscribe(events::add);
        return session;
    }

    private static InMemoryMarketData twoTickers() {
        return new InMemoryMarketData()
            .withDailyCloses("AAPL", BARS_FROM, InMemoryMarketData.choppy(40, 150))
            .withDailyCloses("MSFT", BARS_FROM, InMemoryMarketData.linear(40, 400, -2));
    }

    private String eventTypes() {
        return events.stream().map(BacktestEvent::type).collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("completed run")
    class CompletedRun {

        private final SignalProducerRegistry registry = TestEngines.registry(
            ScriptedProducer.alternating("alternating"));

        private final BacktestRequest request = TestEngines.request(List.of("AAPL", "MSFT"),
            List.of("alternating"), START, END, 100_000, 0.5);

        @Test
        @DisplayName("every snapshot balances and respects the margin floor")
        void snapshotsHoldInvariants() {
            BacktestSession session = session(request);
            BacktestResult result = TestEngines.engine(twoTickers(), registry).run(session);

            assertEquals(BacktestStatus.COMPLETED, result.status());
            assertEquals(22, result.portfolioHistory().size(), "opening snapshot + 21 trading days");
            for (DailySnapshot s : result.portfolioHistory()) {
                assertEquals(s.impliedValue(), s.totalValue(), LedgerInvariants.EPSILON, "value on " + s.date());
                assertTrue(s.cash() >= -0.5 * s.totalValue() - LedgerInvariants.EPSILON, "margin floor on " + s.date());
                for (PositionSnapshot p : s.positions().values()) {
                    assertTrue(p.longQuantity() >= 0 && p.shortQuantity() >= 0);
                }
            }
            assertFalse(result.trades().isEmpty(), "alternating signals must trade");
        }

        @Test
        @DisplayName("events follow start, per-day progress/trading/portfolio/performance, complete")
        void eventOrder() {
            BacktestSession session = session(request);
            TestEngines.engine(twoTickers(), registry).run(session);

            assertTrue(eventTypes().matches(
                "backtest_start( backtest_progress( trading)* portfolio_update performance_update)+ backtest_complete"),
                eventTypes());
            assertEquals(21, events.stream().filter(e -> e instanceof PortfolioUpdateEvent).count());
            assertTrue(session.events().isClosed());
        }

        @Test
        @DisplayName("stream carries the same history and trades as the result")
        void streamMatchesResult() {
            BacktestSession session = session(request);
            BacktestResult result = TestEngines.engine(twoTickers(), registry).run(session);

            List<DailySnapshot> streamed = events.stream()
                .filter(e -> e instanceof PortfolioUpdateEvent)
                .map(e -> ((PortfolioUpdateEvent) e).toSnapshot())
                .toList();
            assertEquals(result.portfolioHistory().subList(1, result.portfolioHistory().size()), streamed);

            long trades = events.stream().filter(e -> e instanceof TradingEvent).count();
            assertEquals(result.trades().size(), trades);

            BacktestCompleteEvent complete = (BacktestCompleteEvent) events.get(events.size() - 1);
            assertEquals("completed", complete.status());
            assertEquals(result.performanceMetrics(), complete.metrics());
            assertEquals(result.portfolioHistory(), complete.portfolioHistory());
        }

        @Test
        @DisplayName("session ends completed at full progress")
        void sessionState() {
            BacktestSession session = session(request);
            TestEngines.engine(twoTickers(), registry).run(session);

            assertEquals(BacktestStatus.COMPLETED, session.status());
            assertEquals(1.0, session.progress());
            assertEquals(END, session.currentDate());
            assertNotNull(session.completionTime());
            assertEquals(21, session.totalDays());
        }
    }

    @Test
    @DisplayName("no tradable day in range → only the opening snapshot, zero return")
    void zeroTradingDays() {
        InMemoryMarketData marketData = new InMemoryMarketData()
            .withDailyCloses("AAPL", BARS_FROM, InMemoryMarketData.linear(10, 100, 1));
        SignalProducerRegistry registry = TestEngines.registry(ScriptedProducer.alternating("alternating"));
        BacktestSession session = session(TestEngines.request(List.of("AAPL"), List.of("alternating"),
            LocalDate.of(2024, 1, 20), LocalDate.of(2024, 1, 25), 50_000, 0.0));

        BacktestResult result = TestEngines.engine(marketData, registry).run(session);

        assertEquals(BacktestStatus.COMPLETED, result.status());
        assertEquals(1, result.portfolioHistory().size());
        assertEquals(0.0, result.performanceMetrics().totalReturn());
        assertEquals(0, result.performanceMetrics().tradingDays());
        assertEquals("backtest_start backtest_complete", eventTypes());
    }

    @Test
    @DisplayName("a ticker missing a bar is skipped that day with a warning")
    void missingBar() {
        LocalDate gap = LocalDate.of(2024, 1, 22);
        InMemoryMarketData marketData = twoTickers().withoutBar("MSFT", gap);
        SignalProducerRegistry registry = TestEngines.registry(ScriptedProducer.alternating("alternating"));
        BacktestSession session = session(TestEngines.request(List.of("AAPL", "MSFT"), List.of("alternating"),
            START, END, 100_000, 0.0));

        BacktestResult result = TestEngines.engine(marketData, registry).run(session);

        assertEquals(BacktestStatus.COMPLETED, result.status());
        assertTrue(result.warnings().stream().anyMatch(w -> w.startsWith(gap.toString()) && w.contains("MSFT")),
            result.warnings().toString());
        DailySnapshot onGap = result.portfolioHistory().stream().filter(s -> s.date().equals(gap)).findFirst().orElseThrow();
        assertEquals(onGap.impliedValue(), onGap.totalValue(), LedgerInvariants.EPSILON);
    }

    @Test
    @DisplayName("a producer that always throws only produces warnings; the book stays in cash")
    void failingProducer() {
        SignalProducerRegistry registry = TestEngines.registry(ScriptedProducer.failing("broken"));
        BacktestSession session = session(TestEngines.request(List.of("AAPL"), List.of("broken"),
            START, END, 100_000, 0.0));

        BacktestResult result = TestEngines.engine(twoTickers(), registry).run(session);

        assertEquals(BacktestStatus.COMPLETED, result.status());
        assertTrue(result.trades().isEmpty());
        assertEquals(100_000.0, result.performanceMetrics().finalValue());
        assertEquals(21, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("broken"));
    }

    @Test
    @DisplayName("price feed failure → failed session and a single error event")
    void marketDataFailure() {
        SignalProducerRegistry registry = TestEngines.registry(ScriptedProducer.alternating("alternating"));
        BacktestSession session = session(TestEngines.request(List.of("AAPL"), List.of("alternating"),
            START, END, 100_000, 0.0));

        BacktestResult result = TestEngines.engine(twoTickers().failingFor("AAPL"), registry).run(session);

        assertEquals(BacktestStatus.FAILED, result.status());
        assertEquals(BacktestStatus.FAILED, session.status());
        assertTrue(result.errorMessage().contains("AAPL"), result.errorMessage());
        assertEquals(1, events.size());
        assertInstanceOf(BacktestErrorEvent.class, events.get(0));
        assertTrue(session.events().isClosed());
    }

    @Test
    @DisplayName("price spike against a short on day 4 → failed, three committed days, error last")
    void ledgerBreachMidRun() {
        // flat at 100 until 2024-01-23, then 5000: the 200-share short puts cash under the margin floor
        double[] closes = new double[40];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = BARS_FROM.plusDays(i).isBefore(LocalDate.of(2024, 1, 23)) ? 100.0 : 5000.0;
        }
        InMemoryMarketData marketData = new InMemoryMarketData().withDailyCloses("AAPL", BARS_FROM, closes);
        SignalProducerRegistry registry = TestEngines.registry(
            ScriptedProducer.constant("bear", SignalDirection.BEARISH, 80));
        BacktestSession session = session(TestEngines.request(List.of("AAPL"), List.of("bear"),
            START, END, 100_000, 0.5));

        BacktestResult result = TestEngines.engine(marketData, registry).run(session);

        assertEquals(BacktestStatus.FAILED, result.status());
        assertEquals(BacktestStatus.FAILED, session.status());
        assertTrue(result.errorMessage().contains("margin floor"), result.errorMessage());

        BacktestEvent last = events.get(events.size() - 1);
        assertInstanceOf(BacktestErrorEvent.class, last);
        assertEquals(1, events.stream().filter(BacktestEvent::isTerminal).count());
        assertTrue(session.events().isClosed());

        List<DailySnapshot> history = result.portfolioHistory();
        assertEquals(4, history.size(), "opening snapshot plus three committed days");
        assertEquals(LocalDate.of(2024, 1, 22), history.get(history.size() - 1).date());
        assertEquals(3, events.stream().filter(e -> e instanceof PortfolioUpdateEvent).count());

        // the failed day left the book exactly as day 3 closed it
        DailySnapshot lastCommitted = history.get(history.size() - 1);
        assertEquals(lastCommitted.cash(), result.finalPortfolio().cash());
        assertEquals(lastCommitted.marginUsed(), result.finalPortfolio().marginUsed());
        assertEquals(lastCommitted.positions(), result.finalPortfolio().positions());
        assertEquals(200, result.finalPortfolio().positions().get("AAPL").shortQuantity());
        assertEquals(1, result.trades().size());
    }

    @Test
    @DisplayName("cancel requested before day one → cancelled with only the opening snapshot")
    void cancelledBeforeFirstDay() {
        SignalProducerRegistry registry = TestEngines.registry(ScriptedProducer.alternating("alternating"));
        BacktestSession session = session(TestEngines.request(List.of("AAPL"), List.of("alternating"),
            START, END, 100_000, 0.0));
        assertTrue(session.requestCancel());

        BacktestResult result = TestEngines.engine(twoTickers(), registry).run(session);

        assertEquals(BacktestStatus.CANCELLED, result.status());
        assertEquals(1, result.portfolioHistory().size());
        assertInstanceOf(BacktestStartEvent.class, events.get(0));
        assertEquals("cancelled", ((BacktestCompleteEvent) events.get(events.size() - 1)).status());
    }
}
