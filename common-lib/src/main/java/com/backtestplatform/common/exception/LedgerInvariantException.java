package com.backtestplatform.common.exception;

/**
 * A ledger bookkeeping invariant would be broken by the pending day's mutations.
 *
 * <p>Fatal for the owning session: nothing from the offending day is committed and
 * the session transitions to {@code failed}.
 */
public class LedgerInvariantException extends RuntimeException {

    public LedgerInvariantException(String message) {
        super(message);
    }
}
