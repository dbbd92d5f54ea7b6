package com.tradejournal.domain.event;

import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import com.tradejournal.domain.model.TradeReference;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A tagged trade mutation as it travels over the broker.
 *
 * <p>The tag and the payload class always agree: a TradeClosed envelope carries a
 * {@link TradeClosure}, never anything else. Mismatched pairs cannot be constructed.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TradeEventEnvelope {

    private final TradeEventType eventType;
    private final TradeEventPayload trade;

    public TradeEventEnvelope(TradeEventType eventType, TradeEventPayload trade) {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(trade, "trade must not be null");
        if (!eventType.getPayloadType().isInstance(trade)) {
            throw new IllegalArgumentException(String.format("%s requires a %s payload but got %s",
                    eventType.getWireName(), eventType.getPayloadType().getSimpleName(),
                    trade.getClass().getSimpleName()));
        }
        this.eventType = eventType;
        this.trade = trade;
    }

    public static TradeEventEnvelope created(LiveTrade trade) {
        return new TradeEventEnvelope(TradeEventType.TRADE_CREATED, trade);
    }

    public static TradeEventEnvelope updated(LiveTradeUpdate update) {
        return new TradeEventEnvelope(TradeEventType.TRADE_UPDATED, update);
    }

    public static TradeEventEnvelope deleted(String tradeId) {
        return new TradeEventEnvelope(TradeEventType.TRADE_DELETED, new TradeReference(tradeId));
    }

    public static TradeEventEnvelope closed(String tradeId, BigDecimal exitPrice, BigDecimal fees) {
        return new TradeEventEnvelope(TradeEventType.TRADE_CLOSED, new TradeClosure(tradeId, exitPrice, fees));
    }

    public String getTradeId() {
        return trade.getId();
    }

    /**
     * Typed access to the payload. The class must be the one this envelope's type declares.
     */
    public <T extends TradeEventPayload> T payload(Class<T> type) {
        if (!type.isInstance(trade)) {
            throw new IllegalStateException(eventType.getWireName() + " does not carry a " + type.getSimpleName());
        }
        return type.cast(trade);
    }
}
