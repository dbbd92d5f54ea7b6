package com.tradejournal.domain.exception;

/**
 * Bytes read from the broker do not form a valid trade event envelope.
 */
public class MalformedEnvelopeException extends TradeRelayException {

    public MalformedEnvelopeException(String message) {
        super(message);
    }

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
