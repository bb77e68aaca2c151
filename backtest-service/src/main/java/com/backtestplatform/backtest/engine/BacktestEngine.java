package com.backtestplatform.backtest.engine;

import com.backtestplatform.backtest.event.BacktestCompleteEvent;
import com.backtestplatform.backtest.event.BacktestErrorEvent;
import com.backtestplatform.backtest.event.BacktestEventStream;
import com.backtestplatform.backtest.event.BacktestProgressEvent;
import com.backtestplatform.backtest.event.BacktestStartEvent;
import com.backtestplatform.backtest.event.PerformanceUpdateEvent;
import com.backtestplatform.backtest.event.PortfolioUpdateEvent;
import com.backtestplatform.backtest.event.TradingEvent;
import com.backtestplatform.backtest.marketdata.MarketDataProvider;
import com.backtestplatform.backtest.producer.SignalProducer;
import com.backtestplatform.backtest.producer.SignalProducerRegistry;
import com.backtestplatform.backtest.session.BacktestRequest;
import com.backtestplatform.backtest.session.BacktestSession;
import com.backtestplatform.backtest.session.BacktestStatus;
import com.backtestplatform.common.consensus.ConsensusEngine;
import com.backtestplatform.common.exception.MarketDataException;
import com.backtestplatform.common.execution.ExecutionResult;
import com.backtestplatform.common.execution.ExecutionSimulator;
import com.backtestplatform.common.execution.Fill;
import com.backtestplatform.common.ledger.DailySnapshot;
import com.backtestplatform.common.ledger.Portfolio;
import com.backtestplatform.common.ledger.PortfolioLedger;
import com.backtestplatform.common.ledger.Position;
import com.backtestplatform.common.model.Order;
import com.backtestplatform.common.model.PriceBar;
import com.backtestplatform.common.model.SignalContext;
import com.backtestplatform.common.performance.PerformanceCalculator;
import com.backtestplatform.common.performance.PerformanceMetrics;
import com.backtestplatform.common.performance.RunningPerformanceTracker;
import com.backtestplatform.common.portfolio.PortfolioManager;
import com.backtestplatform.common.risk.PositionLimit;
import com.backtestplatform.common.risk.RiskLimits;
import com.backtestplatform.common.risk.RiskManager;
import com.backtestplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one backtest session day by day on the calling thread.
 *
 * <h3>Per tradable date</h3>
 * <ol>
 *   <li>emit {@code backtest_progress}</li>
 *   <li>collect signals for every ticker with a bar that day (barrier)</li>
 *   <li>risk caps, then one order per ticker</li>
 *   <li>execute at the close on a working copy; commit only if every invariant holds</li>
 *   <li>emit {@code trading} per executed fill, append the snapshot, emit
 *       {@code portfolio_update} and {@code performance_update}</li>
 *   <li>honour a pending cancel request</li>
 * </ol>
 *
 * <p>Never throws: a fatal error moves the session to {@code failed} and emits
 * {@code error}. The session's status is always updated before its terminal event is
 * emitted.
 */
@Component
public class BacktestEngine {

    private static final Logger log = LoggerFactory.getLogger(BacktestEngine.class);

    private final MarketDataProvider marketData;
    private final SignalProducerRegistry producerRegistry;
    private final SignalAggregator aggregator;
    private final PortfolioManager portfolioManager;
    private final BacktestFlowLogger flowLogger;
    private final double maxPositionFraction;
    private final int lookbackDays;
    private final Clock clock;

    @Autowired
    public BacktestEngine(MarketDataProvider marketData,
                          SignalProducerRegistry producerRegistry,
                          SignalAggregator aggregator,
                          ConsensusEngine consensusEngine,
                          BacktestFlowLogger flowLogger,
                          @Value("${backtest.risk.max-position-fraction:0.20}") double maxPositionFraction,
                          @Value("${backtest.lookback-days:30}") int lookbackDays) {
        this(marketData, producerRegistry, aggregator, consensusEngine, flowLogger,
             maxPositionFraction, lookbackDays, Clock.systemUTC());
    }

    public BacktestEngine(MarketDataProvider marketData,
                          SignalProducerRegistry producerRegistry,
                          SignalAggregator aggregator,
                          ConsensusEngine consensusEngine,
                          BacktestFlowLogger flowLogger,
                          double maxPositionFraction,
                          int lookbackDays,
                          Clock clock) {
        this.marketData          = marketData;
        this.producerRegistry    = producerRegistry;
        this.aggregator          = aggregator;
        this.portfolioManager    = new PortfolioManager(consensusEngine);
        this.flowLogger          = flowLogger;
        this.maxPositionFraction = maxPositionFraction;
        this.lookbackDays        = lookbackDays;
        this.clock               = clock;
    }

    /**
     * Drives {@code session} from {@code pending} to a terminal state.
     *
     * @return the final result; its status mirrors the session's
     */
    public BacktestResult run(BacktestSession session) {
        Run run = new Run(session);
        session.markRunning();
        try {
            return run.execute();
        } catch (RuntimeException e) {
            return run.fail(e);
        }
    }

    /** State of a single run; confined to the session thread. */
    private final class Run {

        private final BacktestSession session;
        private final BacktestRequest request;
        private final String id;
        private final BacktestEventStream events;
        private final List<Fill> fills = new ArrayList<>();
        private PortfolioLedger ledger;

        Run(BacktestSession session) {
            this.session = session;
            this.request = session.request();
            this.id      = session.id();
            this.events  = session.events();
        }

        BacktestResult execute() {
            List<SignalProducer> producers = producerRegistry.resolve(request.selectedSignalProducers());
            double initialCash = request.initialCash();
            double margin      = request.marginRequirementOrDefault();

            PriceHistory history = prefetch(request.startDate().minusDays(lookbackDays), request.endDate());
            List<LocalDate> calendar = history.tradingCalendar(request.startDate(), request.endDate());
            session.setTotalDays(calendar.size());

            ledger = PortfolioLedger.open(initialCash, margin, request.tickers(), request.startDate().minusDays(1));
            RunningPerformanceTracker tracker = new RunningPerformanceTracker(ledger.latestSnapshot(), initialCash);
            ExecutionSimulator simulator = new ExecutionSimulator(margin);
            RiskLimits limits = new RiskLimits(maxPositionFraction, margin);

            flowLogger.stage(BacktestFlowLogger.SESSION_STARTED, id, request.startDate(),
                "tickers=" + request.tickers() + " producers=" + request.selectedSignalProducers()
                    + " tradingDays=" + calendar.size());
            events.emit(new BacktestStartEvent(id, clock.instant(), request.tickers(), request.startDate(),
                request.endDate(), calendar.size(), initialCash, request.selectedSignalProducers()));

            if (session.isCancelRequested()) {
                return finish(BacktestStatus.CANCELLED);
            }
            for (int i = 0; i < calendar.size(); i++) {
                runDay(calendar.get(i), i, calendar.size(), producers, history, limits, simulator, tracker);
                if (session.isCancelRequested()) {
                    return finish(BacktestStatus.CANCELLED);
                }
            }
            return finish(BacktestStatus.COMPLETED);
        }

        private void runDay(LocalDate date, int dayIndex, int totalDays, List<SignalProducer> producers,
                            PriceHistory history, RiskLimits limits, ExecutionSimulator simulator,
                            RunningPerformanceTracker tracker) {
            session.advance(date, dayIndex);
            events.emit(new BacktestProgressEvent(id, clock.instant(), date, dayIndex, totalDays,
                totalDays == 0 ? 0.0 : (double) dayIndex / totalDays));
            flowLogger.dayStage(BacktestFlowLogger.DAY_STARTED, id, date, "day=" + (dayIndex + 1) + "/" + totalDays);

            Map<String, Double> prices = history.valuationPrices(date);
            Portfolio committed = ledger.current();
            LocalDate lookbackStart = date.minusDays(lookbackDays);

            Map<String, SignalContext> contexts = new LinkedHashMap<>();
            for (String ticker : request.tickers()) {
                if (!history.hasBar(ticker, date)) {
                    warn(date, "No price data for " + ticker + "; ticker skipped");
                    continue;
                }
                contexts.put(ticker, SignalContext.of(ticker, date, lookbackStart,
                    history.closesNewestFirst(ticker, lookbackStart, date), positionView(committed, ticker), id));
            }

            CollectedSignals collected = aggregator.collect(id, producers, contexts);
            collected.warnings().forEach(w -> session.addWarning(date + ": " + w));
            flowLogger.dayStage(BacktestFlowLogger.SIGNALS_COLLECTED, id, date,
                "tickers=" + collected.signals().size() + " dropped=" + collected.warnings().size());

            Map<String, PositionLimit> caps = RiskManager.assess(committed, prices, collected.signals(), limits);
            List<Order> orders = portfolioManager.synthesize(collected.signals(), caps, committed);
            flowLogger.dayStage(BacktestFlowLogger.ORDERS_SYNTHESIZED, id, date, "orders=" + orders);

            ExecutionResult execution = simulator.execute(committed, orders, prices);
            ledger.commit(execution.portfolio(), prices);
            fills.addAll(execution.fills());
            double totalValue = execution.portfolio().totalValue(prices);
            flowLogger.dayStage(BacktestFlowLogger.ORDERS_EXECUTED, id, date, "totalValue=" + totalValue);

            for (Fill fill : execution.fills()) {
                if (!fill.executed()) continue;
                events.emit(new TradingEvent(id, clock.instant(), date, fill.ticker(), fill.action(),
                    fill.quantity(), fill.price(), totalValue));
            }

            DailySnapshot snapshot = ledger.recordSnapshot(date, prices);
            events.emit(PortfolioUpdateEvent.of(id, clock.instant(), snapshot));
            flowLogger.dayStage(BacktestFlowLogger.SNAPSHOT_APPENDED, id, date,
                "cash=" + snapshot.cash() + " totalValue=" + snapshot.totalValue());

            PerformanceMetrics metrics = tracker.add(snapshot, execution.fills());
            events.emit(new PerformanceUpdateEvent(id, clock.instant(), date, metrics));
            session.advance(date, dayIndex + 1);
        }

        private PriceHistory prefetch(LocalDate from, LocalDate to) {
            Map<String, List<PriceBar>> bars = new LinkedHashMap<>();
            for (String ticker : request.tickers()) {
                List<PriceBar> list;
                try {
                    list = marketData.getPriceHistory(ticker, from, to).collectList().block();
                } catch (RuntimeException e) {
                    throw new MarketDataException("Failed to load price history for " + ticker + ": " + e.getMessage(), e);
                }
                if (list == null || list.isEmpty()) {
                    warn(from, "No price history for " + ticker + " between " + from + " and " + to);
                }
                bars.put(ticker, list != null ? list : List.of());
            }
            return PriceHistory.of(bars);
        }

        private BacktestResult finish(BacktestStatus proposed) {
            BacktestStatus status = session.settle(proposed);
            PerformanceMetrics metrics = PerformanceCalculator.compute(ledger.snapshots(), fills, ledger.initialCapital());
            BacktestResult result = result(status, metrics, null);
            if (status == BacktestStatus.CANCELLED) {
                session.cancelled(result, clock.instant());
            } else {
                session.complete(result, clock.instant());
            }
            flowLogger.stage(BacktestFlowLogger.SESSION_FINISHED, id, session.currentDate(),
                "status=" + status.wireName() + " totalReturn=" + metrics.totalReturn()
                    + " sharpe=" + metrics.sharpeRatio());
            events.emit(new BacktestCompleteEvent(id, clock.instant(), status.wireName(), metrics,
                ledger.snapshots()));
            return result;
        }

        BacktestResult fail(RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            TraceContextUtil.withMdc(id, () ->
                log.error("[Backtest] Session failed. backtestId={} date={}", id, session.currentDate(), e));
            if (session.status().isTerminal()) {
                // terminal state already published; keep it
                return session.result();
            }

            PerformanceMetrics metrics = ledger != null
                ? PerformanceCalculator.compute(ledger.snapshots(), fills, ledger.initialCapital())
                : PerformanceMetrics.initial(request.initialCash());
            BacktestResult result = result(BacktestStatus.FAILED, metrics, message);
            session.fail(message, result, clock.instant());
            flowLogger.stage(BacktestFlowLogger.SESSION_FINISHED, id, session.currentDate(), "status=failed error=" + message);
            if (!events.isClosed()) {
                events.emit(new BacktestErrorEvent(id, clock.instant(), message));
            }
            return result;
        }

        private BacktestResult result(BacktestStatus status, PerformanceMetrics metrics, String error) {
            return new BacktestResult(id, status, metrics,
                ledger != null ? List.copyOf(ledger.snapshots()) : List.of(),
                ledger != null ? FinalPortfolio.of(ledger.current()) : null,
                fills.stream().filter(Fill::executed).toList(),
                List.copyOf(session.warnings()), error);
        }

        private void warn(LocalDate date, String warning) {
            session.addWarning(date + ": " + warning);
            TraceContextUtil.withMdc(id, () ->
                log.warn("[Backtest] {} backtestId={} date={}", warning, id, date));
        }

        private Map<String, Object> positionView(Portfolio portfolio, String ticker) {
            Position p = portfolio.getPositions().get(ticker);
            Map<String, Object> view = new LinkedHashMap<>();
            view.put("long", p != null ? p.getLongQuantity() : 0L);
            view.put("short", p != null ? p.getShortQuantity() : 0L);
            view.put("cash", portfolio.getCash());
            return view;
        }
    }
}
