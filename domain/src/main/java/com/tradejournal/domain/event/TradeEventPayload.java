package com.tradejournal.domain.event;

/**
 * Common shape of every trade event payload: all of them name the trade they act on.
 */
public interface TradeEventPayload {

    String getId();
}
