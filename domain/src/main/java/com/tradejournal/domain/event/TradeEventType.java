package com.tradejournal.domain.event;

import com.fasterxml.jackson.annotation.JsonValue;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import com.tradejournal.domain.model.TradeReference;

import java.util.Optional;

/**
 * Closed set of trade mutation events. Each type fixes the payload class it carries.
 */
public enum TradeEventType {
    TRADE_CREATED("TradeCreated", LiveTrade.class),
    TRADE_UPDATED("TradeUpdated", LiveTradeUpdate.class),
    TRADE_DELETED("TradeDeleted", TradeReference.class),
    TRADE_CLOSED("TradeClosed", TradeClosure.class);

    private final String wireName;
    private final Class<? extends TradeEventPayload> payloadType;

    TradeEventType(String wireName, Class<? extends TradeEventPayload> payloadType) {
        this.wireName = wireName;
        this.payloadType = payloadType;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Class<? extends TradeEventPayload> getPayloadType() {
        return payloadType;
    }

    public static Optional<TradeEventType> fromWireName(String value) {
        for (TradeEventType type : values()) {
            if (type.wireName.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
