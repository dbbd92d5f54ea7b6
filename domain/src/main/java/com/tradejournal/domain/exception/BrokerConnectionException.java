package com.tradejournal.domain.exception;

/**
 * The broker or the relay topic stayed unreachable for the whole connect budget.
 */
public class BrokerConnectionException extends TradeRelayException {

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
