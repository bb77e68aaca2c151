package com.backtestplatform.backtest.session;

import com.backtestplatform.backtest.engine.BacktestResult;
import com.backtestplatform.backtest.event.BacktestEventStream;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of one backtest run, owned by the {@link SessionRegistry}.
 *
 * <p>Written by the single session loop thread and read by API threads. Status
 * transitions and progress updates are {@code synchronized}; the cancel flag is an
 * {@link AtomicBoolean} the loop polls at day boundaries.
 */
public class BacktestSession {

    private final String id;
    private final BacktestRequest request;
    private final BacktestEventStream events;
    private final Instant startTime;
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private BacktestStatus status = BacktestStatus.PENDING;
    private BacktestStatus settled;
    private LocalDate currentDate;
    private int totalDays;
    private double progress;
    private String errorMessage;
    private Instant completionTime;
    private BacktestResult result;

    public BacktestSession(String id, BacktestRequest request, BacktestEventStream events, Instant startTime) {
        this.id        = id;
        this.request   = request;
        this.events    = events;
        this.startTime = startTime;
    }

    // ── transitions ─────────────────────────────────────────────────────────

    public synchronized void markRunning() {
        transition(BacktestStatus.RUNNING);
    }

    public synchronized void complete(BacktestResult result, Instant at) {
        transition(BacktestStatus.COMPLETED);
        this.result         = result;
        this.progress       = 1.0;
        this.completionTime = at;
    }

    public synchronized void cancelled(BacktestResult result, Instant at) {
        transition(BacktestStatus.CANCELLED);
        this.result         = result;
        this.completionTime = at;
    }

    public synchronized void fail(String message, BacktestResult result, Instant at) {
        transition(BacktestStatus.FAILED);
        this.errorMessage   = message;
        this.result         = result;
        this.completionTime = at;
    }

    private void transition(BacktestStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal backtest transition " + status + " -> " + next + ". backtestId=" + id);
        }
        this.status = next;
    }

    // ── progress ────────────────────────────────────────────────────────────

    public synchronized void setTotalDays(int totalDays) {
        this.totalDays = totalDays;
    }

    public synchronized void advance(LocalDate date, int completedDays) {
        this.currentDate = date;
        this.progress    = totalDays == 0 ? 0.0 : (double) completedDays / totalDays;
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    /**
     * Sets the cooperative cancel flag.
     *
     * @return false when the session already reached a terminal state
     */
    public synchronized boolean requestCancel() {
        if (status.isTerminal() || settled != null) return false;
        cancelRequested.set(true);
        return true;
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * Fixes how a run that left its day loop ends. A cancel request that is already set
     * turns {@code COMPLETED} into {@code CANCELLED}; later requests are refused.
     *
     * @return the status the run must finish with
     */
    public synchronized BacktestStatus settle(BacktestStatus proposed) {
        if (settled == null) {
            settled = cancelRequested.get() ? BacktestStatus.CANCELLED : proposed;
        }
        return settled;
    }

    /** Current status, or the settled one while the run is still publishing its result. */
    public synchronized BacktestStatus outcome() {
        return settled != null && !status.isTerminal() ? settled : status;
    }

    // ── accessors ───────────────────────────────────────────────────────────

    public String id()                  { return id; }
    public BacktestRequest request()    { return request; }
    public BacktestEventStream events() { return events; }
    public Instant startTime()          { return startTime; }
    public List<String> warnings()      { return Collections.unmodifiableList(warnings); }

    public synchronized BacktestStatus status()     { return status; }
    public synchronized LocalDate currentDate()     { return currentDate; }
    public synchronized int totalDays()             { return totalDays; }
    public synchronized double progress()           { return progress; }
    public synchronized String errorMessage()       { return errorMessage; }
    public synchronized Instant completionTime()    { return completionTime; }
    public synchronized BacktestResult result()     { return result; }

    public synchronized BacktestStatusView view() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("tickers", request.tickers());
        summary.put("selected_signal_producers", request.selectedSignalProducers());
        summary.put("start_date", request.startDate().toString());
        summary.put("end_date", request.endDate().toString());
        summary.put("initial_cash", request.initialCash());
        summary.put("margin_requirement", request.marginRequirementOrDefault());
        summary.put("total_days", totalDays);
        return new BacktestStatusView(id, status, progress, currentDate, status == BacktestStatus.RUNNING,
            errorMessage, startTime, completionTime, List.copyOf(warnings), summary);
    }
}
