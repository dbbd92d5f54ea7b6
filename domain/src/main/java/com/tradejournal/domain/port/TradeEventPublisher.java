package com.tradejournal.domain.port;

import com.tradejournal.domain.event.TradeEventEnvelope;

/**
 * Outbound port for trade events. Implementations block until the broker
 * acknowledges the event or the publish budget is exhausted.
 */
public interface TradeEventPublisher {

    /**
     * @throws com.tradejournal.domain.exception.PublishException when every attempt failed
     */
    void publish(String topic, TradeEventEnvelope envelope);
}
