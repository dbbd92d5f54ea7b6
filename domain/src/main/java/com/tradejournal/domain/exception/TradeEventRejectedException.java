package com.tradejournal.domain.exception;

import java.util.List;

/**
 * A well-formed envelope whose payload fails validation.
 */
public class TradeEventRejectedException extends TradeRelayException {

    private final List<String> errors;

    public TradeEventRejectedException(String message, List<String> errors) {
        super(message + ": " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
