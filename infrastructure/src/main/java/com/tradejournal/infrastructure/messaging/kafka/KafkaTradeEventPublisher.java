package com.tradejournal.infrastructure.messaging.kafka;

import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.exception.BrokerConnectionException;
import com.tradejournal.domain.exception.PublishException;
import com.tradejournal.domain.port.TradeEventPublisher;
import com.tradejournal.infrastructure.codec.TradeEventCodec;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.Retry;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.PartitionInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.context.SmartLifecycle;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Kafka implementation of {@link TradeEventPublisher}.
 *
 * <p>Records are keyed by trade id so every event of one trade lands on the same
 * partition. Each send attempt is observed as {@code kafka_producer_<topic>} and
 * blocks until the broker acknowledges it. The producer session is opened in
 * {@link #start()}, before the web tier accepts requests; failing to reach the
 * broker there aborts startup.
 */
@Component
public class KafkaTradeEventPublisher implements TradeEventPublisher, SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(KafkaTradeEventPublisher.class);

    static final String PUBLISH_OBSERVATION = "trade.relay.publish";
    static final String CONNECT_OBSERVATION = "trade.relay.connect";

    /**
     * Starts ahead of the relay consumer and stops after it.
     */
    public static final int PHASE = -100;

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final TradeEventCodec codec;
    private final ObservationRegistry observationRegistry;
    private final String topic;
    private final Duration sendTimeout;
    private final Retry connectRetry;
    private final Retry publishRetry;

    private volatile boolean connected;

    public KafkaTradeEventPublisher(KafkaTemplate<String, byte[]> kafkaTemplate,
                                    TradeEventCodec codec,
                                    RetryFactory retryFactory,
                                    ObservationRegistry observationRegistry,
                                    RelayProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.codec = codec;
        this.observationRegistry = observationRegistry;
        this.topic = properties.getTopic();
        this.sendTimeout = properties.getSendTimeout();
        this.connectRetry = retryFactory.create("producer-connect", properties.getConnect().toRetryPolicy());
        this.publishRetry = retryFactory.create("publish", properties.getPublish().toRetryPolicy());
    }

    /**
     * Opens the producer session by fetching metadata of the relay topic.
     *
     * @throws BrokerConnectionException when the broker stays unreachable for the whole connect budget
     */
    public void connect() {
        log.info("Connecting trade event publisher to topic {}", topic);
        try {
            List<PartitionInfo> partitions = connectRetry.executeCallable(this::fetchPartitions);
            connected = true;
            log.info("Trade event publisher connected, topic {} has {} partitions", topic, partitions.size());
        } catch (Exception e) {
            log.error("Could not connect trade event publisher to topic {}", topic, e);
            throw new BrokerConnectionException("Could not connect to broker for topic " + topic + ": " + e.getMessage(), e);
        }
    }

    /**
     * Flushes pending sends. The underlying producer is owned and closed by its factory.
     */
    public void close() {
        if (connected) {
            kafkaTemplate.flush();
            connected = false;
            log.info("Trade event publisher closed");
        }
    }

    @Override
    public void publish(String topic, TradeEventEnvelope envelope) {
        byte[] payload = codec.encode(envelope);
        String key = envelope.getTradeId();
        try {
            publishRetry.executeCallable(() -> {
                send(topic, key, payload, envelope);
                return null;
            });
            log.debug("Published {} for trade {} to topic {}", envelope.getEventType().getWireName(), key, topic);
        } catch (Exception e) {
            log.error("Failed to publish {} for trade {} to topic {}", envelope.getEventType().getWireName(), key, topic, e);
            throw new PublishException(String.format("Failed to publish %s for trade %s: %s",
                    envelope.getEventType().getWireName(), key, e.getMessage()), e);
        }
    }

    private void send(String topic, String key, byte[] payload, TradeEventEnvelope envelope) throws Exception {
        Observation observation = Observation.createNotStarted(PUBLISH_OBSERVATION, observationRegistry)
                .contextualName("kafka_producer_" + topic)
                .lowCardinalityKeyValue("topic", topic)
                .lowCardinalityKeyValue("event.type", envelope.getEventType().getWireName())
                .start();
        try (Observation.Scope scope = observation.openScope()) {
            ProducerRecord<String, byte[]> record = new ProducerRecord<>(topic, key, payload);
            String correlationId = MDC.get(RelayHeaders.CORRELATION_ID_MDC_KEY);
            if (correlationId != null) {
                RelayHeaders.put(record.headers(), RelayHeaders.CORRELATION_ID, correlationId);
            }
            kafkaTemplate.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            observation.lowCardinalityKeyValue("status", "OK");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failed(observation, cause);
            throw cause instanceof Exception ? (Exception) cause : e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(observation, e);
            throw e;
        } catch (Exception e) {
            failed(observation, e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    private List<PartitionInfo> fetchPartitions() {
        Observation observation = Observation.createNotStarted(CONNECT_OBSERVATION, observationRegistry)
                .contextualName("kafka_producer_connect")
                .lowCardinalityKeyValue("topic", topic)
                .start();
        try (Observation.Scope scope = observation.openScope()) {
            List<PartitionInfo> partitions = kafkaTemplate.partitionsFor(topic);
            if (partitions == null || partitions.isEmpty()) {
                throw new IllegalStateException("Topic " + topic + " has no partitions");
            }
            observation.lowCardinalityKeyValue("status", "OK");
            return partitions;
        } catch (RuntimeException e) {
            failed(observation, e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    private static void failed(Observation observation, Throwable error) {
        observation.lowCardinalityKeyValue("status", "ERROR");
        observation.error(error);
    }

    @Override
    public void start() {
        connect();
    }

    @Override
    public void stop() {
        close();
    }

    @Override
    public boolean isRunning() {
        return connected;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
