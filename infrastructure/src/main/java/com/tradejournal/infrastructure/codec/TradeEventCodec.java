package com.tradejournal.infrastructure.codec;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.event.TradeEventPayload;
import com.tradejournal.domain.event.TradeEventType;
import com.tradejournal.domain.exception.MalformedEnvelopeException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Converts trade event envelopes to and from their JSON wire form:
 * <pre>{"eventType": "TradeClosed", "trade": {"id": "t1", "exitPrice": 160, "fees": 5}}</pre>
 *
 * Older producers wrote the tag under {@code event}; both keys are accepted on decode.
 */
@Component
public class TradeEventCodec {

    private static final String EVENT_TYPE_FIELD = "eventType";
    private static final String LEGACY_EVENT_TYPE_FIELD = "event";
    private static final String TRADE_FIELD = "trade";
    private static final String ID_FIELD = "id";

    private final ObjectMapper objectMapper;

    public TradeEventCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(TradeEventEnvelope envelope) {
        WireEnvelope<TradeEventPayload> wire =
                new WireEnvelope<>(envelope.getEventType().getWireName(), envelope.getTrade());
        try {
            return objectMapper.writeValueAsBytes(wire);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + envelope.getEventType().getWireName()
                    + " for trade " + envelope.getTradeId(), e);
        }
    }

    /**
     * @throws MalformedEnvelopeException if the bytes are not a JSON object with a known tag
     *         and a trade carrying a non-blank id, or if the trade does not fit its payload type
     */
    public TradeEventEnvelope decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MalformedEnvelopeException("Trade event is empty");
        }
        JsonNode root = readTree(bytes);
        if (root == null || !root.isObject()) {
            throw new MalformedEnvelopeException("Trade event must be a JSON object");
        }

        TradeEventType type = resolveType(root);

        JsonNode trade = root.get(TRADE_FIELD);
        if (trade == null || !trade.isObject()) {
            throw new MalformedEnvelopeException(type.getWireName() + " has no trade object");
        }
        JsonNode id = trade.get(ID_FIELD);
        if (id == null || !id.isTextual() || id.asText().isBlank()) {
            throw new MalformedEnvelopeException(type.getWireName() + " is missing trade.id");
        }

        // Bind from the raw bytes so decimals keep their exact scale
        JavaType wireType = objectMapper.getTypeFactory()
                .constructParametricType(WireEnvelope.class, type.getPayloadType());
        try {
            WireEnvelope<TradeEventPayload> wire = objectMapper.readValue(bytes, wireType);
            return new TradeEventEnvelope(type, wire.getTrade());
        } catch (IOException e) {
            throw new MalformedEnvelopeException(type.getWireName() + " payload for trade "
                    + id.asText() + " is invalid: " + e.getMessage(), e);
        }
    }

    private JsonNode readTree(byte[] bytes) {
        try {
            return objectMapper.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Trade event is not valid JSON: " + e.getMessage(), e);
        }
    }

    private TradeEventType resolveType(JsonNode root) {
        JsonNode tag = root.hasNonNull(EVENT_TYPE_FIELD) ? root.get(EVENT_TYPE_FIELD) : root.get(LEGACY_EVENT_TYPE_FIELD);
        if (tag == null || !tag.isTextual()) {
            throw new MalformedEnvelopeException("Trade event is missing eventType");
        }
        return TradeEventType.fromWireName(tag.asText())
                .orElseThrow(() -> new MalformedEnvelopeException("Unknown eventType: " + tag.asText()));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class WireEnvelope<T> {
        @JsonAlias(LEGACY_EVENT_TYPE_FIELD)
        private String eventType;
        private T trade;
    }
}
