package com.tradejournal.infrastructure.messaging.kafka;

import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.exception.BrokerConnectionException;
import com.tradejournal.domain.exception.MalformedEnvelopeException;
import com.tradejournal.domain.exception.TradeRelayException;
import com.tradejournal.domain.port.RelayFailureListener;
import com.tradejournal.domain.port.TradeEventProcessor;
import com.tradejournal.infrastructure.codec.TradeEventCodec;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.Retry;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.PartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.CommonContainerStoppingErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Reads trade events from the relay topic, one record at a time, and hands them
 * to the configured {@link TradeEventProcessor}.
 *
 * <p>Offsets are committed per record, only after the processor returned or the
 * record was dead-lettered. Records that can never succeed (malformed, rejected,
 * unknown trade) go to the dead-letter topic. Any other failure stops the
 * container without committing and is reported to the {@link RelayFailureListener}.
 *
 * <p>The processor and failure listener are injected by setter to keep the
 * infrastructure layer free of application dependencies.
 */
@Component
@ConditionalOnProperty(prefix = "app.relay.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KafkaTradeEventConsumer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(KafkaTradeEventConsumer.class);

    private static final Duration METADATA_TIMEOUT = Duration.ofSeconds(10);

    private final ConsumerFactory<String, byte[]> consumerFactory;
    private final TradeEventCodec codec;
    private final DeadLetterPublisher deadLetterPublisher;
    private final RelayProperties properties;
    private final Retry connectRetry;

    private TradeEventProcessor eventProcessor;
    private RelayFailureListener failureListener = (source, cause) -> { };
    private volatile KafkaMessageListenerContainer<String, byte[]> container;

    public KafkaTradeEventConsumer(ConsumerFactory<String, byte[]> consumerFactory,
                                   TradeEventCodec codec,
                                   DeadLetterPublisher deadLetterPublisher,
                                   RetryFactory retryFactory,
                                   RelayProperties properties) {
        this.consumerFactory = consumerFactory;
        this.codec = codec;
        this.deadLetterPublisher = deadLetterPublisher;
        this.properties = properties;
        this.connectRetry = retryFactory.create("consumer-connect", properties.getConnect().toRetryPolicy());
    }

    public void setEventProcessor(TradeEventProcessor eventProcessor) {
        this.eventProcessor = eventProcessor;
    }

    public void setFailureListener(RelayFailureListener failureListener) {
        this.failureListener = failureListener;
    }

    @Override
    public void start() {
        if (eventProcessor == null) {
            throw new IllegalStateException("No TradeEventProcessor configured for the relay consumer");
        }
        verifySubscription();

        ContainerProperties containerProperties = new ContainerProperties(properties.getTopic());
        containerProperties.setGroupId(properties.getGroupId());
        containerProperties.setAckMode(ContainerProperties.AckMode.RECORD);
        containerProperties.setMessageListener((MessageListener<String, byte[]>) this::onMessage);

        KafkaMessageListenerContainer<String, byte[]> listenerContainer =
                new KafkaMessageListenerContainer<>(consumerFactory, containerProperties);
        listenerContainer.setBeanName("trade-event-relay");
        listenerContainer.setCommonErrorHandler(new CommonContainerStoppingErrorHandler());
        listenerContainer.start();
        container = listenerContainer;
        log.info("Relay consumer started: group {} on topic {}", properties.getGroupId(), properties.getTopic());
    }

    @Override
    public void stop() {
        KafkaMessageListenerContainer<String, byte[]> current = container;
        if (current != null) {
            current.stop();
            container = null;
            log.info("Relay consumer stopped");
        }
    }

    @Override
    public boolean isRunning() {
        KafkaMessageListenerContainer<String, byte[]> current = container;
        return current != null && current.isRunning();
    }

    @Override
    public int getPhase() {
        return 0;
    }

    /**
     * Handles one record. Returning normally lets the container commit its offset.
     */
    public void onMessage(ConsumerRecord<String, byte[]> record) {
        String correlationId = RelayHeaders.get(record.headers(), RelayHeaders.CORRELATION_ID);
        if (correlationId != null) {
            MDC.put(RelayHeaders.CORRELATION_ID_MDC_KEY, correlationId);
        }
        try {
            handle(record);
        } catch (RuntimeException e) {
            log.error("Relay consumer cannot make progress at {}-{}@{}, stopping without commit",
                    record.topic(), record.partition(), record.offset(), e);
            failureListener.onFatalFailure(record.topic() + "-" + record.partition() + "@" + record.offset(), e);
            throw e;
        } finally {
            MDC.remove(RelayHeaders.CORRELATION_ID_MDC_KEY);
        }
    }

    private void handle(ConsumerRecord<String, byte[]> record) {
        TradeEventEnvelope envelope;
        try {
            envelope = codec.decode(record.value());
        } catch (MalformedEnvelopeException e) {
            deadLetterPublisher.publish(record, e);
            return;
        }

        log.debug("Received {} for trade {} at {}-{}@{}", envelope.getEventType().getWireName(),
                envelope.getTradeId(), record.topic(), record.partition(), record.offset());
        try {
            eventProcessor.process(envelope);
        } catch (TradeRelayException e) {
            if (e.isRetryable()) {
                throw e;
            }
            deadLetterPublisher.publish(record, e);
        }
    }

    private void verifySubscription() {
        try {
            connectRetry.executeCallable(() -> {
                try (Consumer<String, byte[]> probe = consumerFactory.createConsumer(properties.getGroupId(), "-probe")) {
                    List<PartitionInfo> partitions = probe.partitionsFor(properties.getTopic(), METADATA_TIMEOUT);
                    if (partitions == null || partitions.isEmpty()) {
                        throw new IllegalStateException("Topic " + properties.getTopic() + " does not exist");
                    }
                    return partitions;
                }
            });
        } catch (Exception e) {
            throw new BrokerConnectionException("Relay consumer could not subscribe to " + properties.getTopic()
                    + ": " + e.getMessage(), e);
        }
    }
}
