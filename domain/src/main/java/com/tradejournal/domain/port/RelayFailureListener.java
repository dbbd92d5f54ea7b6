package com.tradejournal.domain.port;

/**
 * Notified when the relay consumer hits a failure it cannot recover from.
 */
@FunctionalInterface
public interface RelayFailureListener {

    void onFatalFailure(String source, Throwable cause);
}
