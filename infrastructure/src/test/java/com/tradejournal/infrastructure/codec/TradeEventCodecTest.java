package com.tradejournal.infrastructure.codec;

import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.event.TradeEventType;
import com.tradejournal.domain.exception.MalformedEnvelopeException;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeSize;
import com.tradejournal.domain.model.TradeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TradeEventCodecTest {

    private TradeEventCodec codec;

    @BeforeEach
    void setUp() {
        codec = new TradeEventCodec(TestObjectMapper.create());
    }

    private static byte[] json(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static LiveTrade liveTrade() {
        return LiveTrade.builder()
                .id("t1")
                .accountId("a1")
                .symbol("AAPL")
                .entryPrice(new BigDecimal("150.50"))
                .tradeType(TradeType.FREE_ROLL)
                .size(TradeSize.DOUBLE_FULL)
                .qty(10)
                .slPercentage(new BigDecimal("4"))
                .entryDate(Instant.parse("2024-03-01T14:30:00Z"))
                .build();
    }

    @Test
    void testRoundTrip_EveryEventType() {
        TradeEventEnvelope[] envelopes = {
                TradeEventEnvelope.created(liveTrade()),
                TradeEventEnvelope.updated(LiveTradeUpdate.builder().id("t1").qty(20).size(TradeSize.HALF).build()),
                TradeEventEnvelope.deleted("t1"),
                TradeEventEnvelope.closed("t1", new BigDecimal("160"), new BigDecimal("5.25")),
                TradeEventEnvelope.closed("t1", new BigDecimal("160"), null)
        };

        for (TradeEventEnvelope envelope : envelopes) {
            assertEquals(envelope, codec.decode(codec.encode(envelope)));
        }
    }

    @Test
    void testEncode_WritesTagDisplayNamesAndOmitsNulls() {
        String encoded = new String(codec.encode(TradeEventEnvelope.created(liveTrade())), StandardCharsets.UTF_8);

        assertTrue(encoded.contains("\"eventType\":\"TradeCreated\""));
        assertTrue(encoded.contains("\"tradeType\":\"Free Roll\""));
        assertTrue(encoded.contains("\"size\":\"2X Full 50%\""));
        assertTrue(encoded.contains("\"entryDate\":\"2024-03-01T14:30:00Z\""));

        String closed = new String(codec.encode(TradeEventEnvelope.closed("t1", BigDecimal.TEN, null)), StandardCharsets.UTF_8);
        assertFalse(closed.contains("fees"));
    }

    @Test
    void testDecode_AcceptsLegacyEventKeyAndStopLossAlias() {
        TradeEventEnvelope envelope = codec.decode(json(
                "{\"event\":\"TradeCreated\",\"trade\":{\"id\":\"t1\",\"accountId\":\"a1\",\"symbol\":\"AAPL\","
                        + "\"entryPrice\":150,\"tradeType\":\"Initial\",\"size\":\"Full 25%\",\"qty\":10,"
                        + "\"stopLossPercentage\":4,\"entryDate\":\"2024-03-01T14:30:00Z\"}}"));

        assertEquals(TradeEventType.TRADE_CREATED, envelope.getEventType());
        LiveTrade trade = envelope.payload(LiveTrade.class);
        assertEquals(new BigDecimal("4"), trade.getSlPercentage());
        assertEquals(TradeSize.FULL, trade.getSize());
    }

    @Test
    void testDecode_IgnoresUnknownProperties() {
        TradeEventEnvelope envelope = codec.decode(json(
                "{\"eventType\":\"TradeDeleted\",\"version\":2,\"trade\":{\"id\":\"t1\",\"reason\":\"typo\"}}"));

        assertEquals(TradeEventEnvelope.deleted("t1"), envelope);
    }

    @Test
    void testDecode_PayloadWithOnlyIdIsWellFormed() {
        TradeEventEnvelope envelope = codec.decode(json("{\"eventType\":\"TradeCreated\",\"trade\":{\"id\":\"t1\"}}"));

        assertEquals("t1", envelope.getTradeId());
        assertNull(envelope.payload(LiveTrade.class).getSymbol());
    }

    @Test
    void testDecode_MissingEventTypeIsMalformed() {
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"trade\":{\"id\":\"t1\"}}")));
    }

    @Test
    void testDecode_MissingOrBlankTradeIdIsMalformed() {
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeClosed\",\"trade\":{\"exitPrice\":160}}")));
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeClosed\",\"trade\":{\"id\":\"  \",\"exitPrice\":160}}")));
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeDeleted\"}")));
    }

    @Test
    void testDecode_UnknownEventTypeIsMalformed() {
        MalformedEnvelopeException ex = assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeArchived\",\"trade\":{\"id\":\"t1\"}}")));
        assertTrue(ex.getMessage().contains("TradeArchived"));
    }

    @Test
    void testDecode_StructuralMismatchesAreMalformed() {
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode(json("not json")));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode(json("[1,2,3]")));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode(new byte[0]));
        assertThrows(MalformedEnvelopeException.class, () -> codec.decode(null));
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeCreated\",\"trade\":{\"id\":\"t1\",\"size\":\"Huge\"}}")));
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeUpdated\",\"trade\":{\"id\":\"t1\",\"qty\":\"ten\"}}")));
        assertThrows(MalformedEnvelopeException.class,
                () -> codec.decode(json("{\"eventType\":\"TradeClosed\",\"trade\":{\"id\":\"t1\",\"exitPrice\":\"abc\"}}")));
    }
}
