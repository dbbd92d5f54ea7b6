package com.tradejournal.domain.exception;

/**
 * Base of every failure raised while emitting, relaying or applying trade events.
 *
 * <p>Subclasses that describe input which can never succeed report
 * {@link #isRetryable()} as {@code false} so retry loops give up immediately.
 */
public class TradeRelayException extends RuntimeException {

    public TradeRelayException(String message) {
        super(message);
    }

    public TradeRelayException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return true;
    }
}
