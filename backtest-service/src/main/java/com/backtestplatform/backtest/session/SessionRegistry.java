package com.backtestplatform.backtest.session;

import com.backtestplatform.common.exception.SessionNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns every live and recently finished {@link BacktestSession}.
 *
 * <p>Terminal sessions stay queryable for {@code backtest.session.retention}; a background
 * sweep every {@code backtest.session.sweep-interval} evicts older ones.
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentHashMap<String, BacktestSession> sessions = new ConcurrentHashMap<>();
    private final Duration retention;
    private final Duration sweepInterval;
    private final Clock clock;
    private Disposable sweeper;

    @Autowired
    public SessionRegistry(@Value("${backtest.session.retention:1h}") Duration retention,
                           @Value("${backtest.session.sweep-interval:5m}") Duration sweepInterval) {
        this(retention, sweepInterval, Clock.systemUTC());
    }

    public SessionRegistry(Duration retention, Duration sweepInterval, Clock clock) {
        this.retention     = retention;
        this.sweepInterval = sweepInterval;
        this.clock         = clock;
    }

    @PostConstruct
    public void startSweeper() {
        log.info("[Sessions] Sweeper started. retentionSeconds={} intervalSeconds={}",
                 retention.toSeconds(), sweepInterval.toSeconds());
        sweeper = Flux.interval(sweepInterval, sweepInterval)
            .subscribe(
                tick -> sweep(),
                err -> log.error("[Sessions] Sweeper stopped unexpectedly", err)
            );
    }

    @PreDestroy
    public void stopSweeper() {
        if (sweeper != null) sweeper.dispose();
    }

    public void register(BacktestSession session) {
        sessions.put(session.id(), session);
    }

    public Optional<BacktestSession> find(String id) {
        return Optional.ofNullable(sessions.get(id));
    }

    public BacktestSession require(String id) {
        return find(id).orElseThrow(() -> new SessionNotFoundException(id));
    }

    public Collection<BacktestSession> all() {
        return Collections.unmodifiableCollection(sessions.values());
    }

    /** Evicts terminal sessions that finished more than the retention period ago. */
    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int evicted = 0;
        for (BacktestSession s : sessions.values()) {
            Instant done = s.completionTime();
            if (s.status().isTerminal() && done != null && done.isBefore(cutoff)
                    && sessions.remove(s.id(), s)) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("[Sessions] Evicted {} finished sessions. remaining={}", evicted, sessions.size());
        }
        return evicted;
    }

    public Clock clock() {
        return clock;
    }
}
