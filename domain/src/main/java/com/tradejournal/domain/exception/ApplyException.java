package com.tradejournal.domain.exception;

/**
 * Applying an envelope to the trade store failed after every retry.
 */
public class ApplyException extends TradeRelayException {

    public ApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
