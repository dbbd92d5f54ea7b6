package com.tradejournal.application.validation;

import java.util.List;

/**
 * Raised when an incoming trade command fails validation.
 */
public class TradeValidationException extends IllegalArgumentException {

    private final List<String> errors;

    public TradeValidationException(List<String> errors) {
        super("Validation failed: " + String.join(", ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
