package com.tradejournal.domain.exception;

/**
 * A trade event could not be handed to the broker within the publish budget.
 */
public class PublishException extends TradeRelayException {

    public PublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
