package com.backtestplatform.common.exception;

import java.time.Duration;

/**
 * A signal producer did not answer within its per-call timeout.
 * Retried with backoff; once retries are exhausted the producer's signal is
 * omitted for that ticker and day and the session continues.
 */
public class ProducerTimeoutException extends SignalProducerException {

    private final Duration timeout;

    public ProducerTimeoutException(String producerId, Duration timeout, Throwable cause) {
        super(producerId, "No signal within " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
