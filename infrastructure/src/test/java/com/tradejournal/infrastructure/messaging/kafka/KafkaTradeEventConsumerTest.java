package com.tradejournal.infrastructure.messaging.kafka;

import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.exception.ApplyException;
import com.tradejournal.domain.exception.MalformedEnvelopeException;
import com.tradejournal.domain.exception.PublishException;
import com.tradejournal.domain.exception.TradeEventRejectedException;
import com.tradejournal.domain.exception.TradeNotFoundException;
import com.tradejournal.domain.port.RelayFailureListener;
import com.tradejournal.domain.port.TradeEventProcessor;
import com.tradejournal.infrastructure.codec.TestObjectMapper;
import com.tradejournal.infrastructure.codec.TradeEventCodec;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.RetryRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.kafka.core.ConsumerFactory;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaTradeEventConsumerTest {

    @Mock
    private ConsumerFactory<String, byte[]> consumerFactory;

    @Mock
    private DeadLetterPublisher deadLetterPublisher;

    @Mock
    private TradeEventProcessor eventProcessor;

    @Mock
    private RelayFailureListener failureListener;

    private TradeEventCodec codec;
    private KafkaTradeEventConsumer consumer;

    @BeforeEach
    void setUp() {
        codec = new TradeEventCodec(TestObjectMapper.create());
        consumer = new KafkaTradeEventConsumer(consumerFactory, codec, deadLetterPublisher,
                new RetryFactory(RetryRegistry.ofDefaults()), new RelayProperties());
        consumer.setEventProcessor(eventProcessor);
        consumer.setFailureListener(failureListener);
    }

    private static ConsumerRecord<String, byte[]> record(String key, byte[] value) {
        return new ConsumerRecord<>("trade-events", 0, 42L, key, value);
    }

    private ConsumerRecord<String, byte[]> record(TradeEventEnvelope envelope) {
        return record(envelope.getTradeId(), codec.encode(envelope));
    }

    @Test
    void testOnMessage_DispatchesDecodedEnvelope() {
        TradeEventEnvelope envelope = TradeEventEnvelope.closed("t1", new BigDecimal("160"), new BigDecimal("5"));

        consumer.onMessage(record(envelope));

        verify(eventProcessor).process(envelope);
        verifyNoInteractions(deadLetterPublisher, failureListener);
    }

    @Test
    void testOnMessage_MalformedRecordIsDeadLettered() {
        ConsumerRecord<String, byte[]> record = record("t1", "{\"trade\":{\"id\":\"t1\"}}".getBytes(StandardCharsets.UTF_8));

        assertDoesNotThrow(() -> consumer.onMessage(record));

        verify(deadLetterPublisher).publish(same(record), any(MalformedEnvelopeException.class));
        verifyNoInteractions(eventProcessor, failureListener);
    }

    @Test
    void testOnMessage_UnknownTradeIsDeadLettered() {
        ConsumerRecord<String, byte[]> record = record(TradeEventEnvelope.deleted("t9"));
        TradeNotFoundException notFound = new TradeNotFoundException("t9");
        doThrow(notFound).when(eventProcessor).process(any());

        assertDoesNotThrow(() -> consumer.onMessage(record));

        verify(deadLetterPublisher).publish(record, notFound);
        verifyNoInteractions(failureListener);
    }

    @Test
    void testOnMessage_RejectedPayloadIsDeadLettered() {
        ConsumerRecord<String, byte[]> record = record(TradeEventEnvelope.deleted("t1"));
        TradeEventRejectedException rejected = new TradeEventRejectedException("TradeCreated rejected", List.of("symbol is required"));
        doThrow(rejected).when(eventProcessor).process(any());

        consumer.onMessage(record);

        verify(deadLetterPublisher).publish(record, rejected);
    }

    @Test
    void testOnMessage_ApplyExhaustionEscalatesWithoutCommit() {
        ConsumerRecord<String, byte[]> record = record(TradeEventEnvelope.deleted("t1"));
        ApplyException failure = new ApplyException("store unavailable", new IllegalStateException("db down"));
        doThrow(failure).when(eventProcessor).process(any());

        ApplyException thrown = assertThrows(ApplyException.class, () -> consumer.onMessage(record));

        assertSame(failure, thrown);
        verify(failureListener).onFatalFailure(eq("trade-events-0@42"), same(failure));
        verifyNoInteractions(deadLetterPublisher);
    }

    @Test
    void testOnMessage_DeadLetterFailureIsFatal() {
        ConsumerRecord<String, byte[]> record = record("t1", "garbage".getBytes(StandardCharsets.UTF_8));
        PublishException dlqDown = new PublishException("dead-letter topic unavailable", null);
        doThrow(dlqDown).when(deadLetterPublisher).publish(same(record), any());

        assertThrows(PublishException.class, () -> consumer.onMessage(record));

        verify(failureListener).onFatalFailure("trade-events-0@42", dlqDown);
    }

    @Test
    void testOnMessage_RestoresCorrelationIdForOneRecord() {
        ConsumerRecord<String, byte[]> record = record(TradeEventEnvelope.deleted("t1"));
        RelayHeaders.put(record.headers(), RelayHeaders.CORRELATION_ID, "corr-7");
        AtomicReference<String> seen = new AtomicReference<>();
        doAnswer(invocation -> {
            seen.set(MDC.get(RelayHeaders.CORRELATION_ID_MDC_KEY));
            return null;
        }).when(eventProcessor).process(any());

        consumer.onMessage(record);

        assertEquals("corr-7", seen.get());
        assertNull(MDC.get(RelayHeaders.CORRELATION_ID_MDC_KEY));
    }

    @Test
    void testStart_RequiresProcessor() {
        KafkaTradeEventConsumer unwired = new KafkaTradeEventConsumer(consumerFactory, codec, deadLetterPublisher,
                new RetryFactory(RetryRegistry.ofDefaults()), new RelayProperties());

        assertThrows(IllegalStateException.class, unwired::start);
        assertFalse(unwired.isRunning());
    }
}
