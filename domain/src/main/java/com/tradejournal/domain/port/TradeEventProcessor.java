package com.tradejournal.domain.port;

import com.tradejournal.domain.event.TradeEventEnvelope;

/**
 * Applies one decoded envelope. Returning normally means the envelope is done
 * and its offset may be committed.
 */
@FunctionalInterface
public interface TradeEventProcessor {

    void process(TradeEventEnvelope envelope);
}
