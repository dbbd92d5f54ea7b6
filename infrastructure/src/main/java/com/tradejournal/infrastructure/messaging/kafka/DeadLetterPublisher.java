package com.tradejournal.infrastructure.messaging.kafka;

import com.tradejournal.domain.exception.PublishException;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.Retry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Parks records that can never be applied on the dead-letter topic.
 *
 * <p>The original key, value and headers are kept as they were read; the failure
 * and the source coordinates are added as {@code X-Relay-*} / {@code X-Original-*} headers.
 */
@Component
public class DeadLetterPublisher {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterPublisher.class);

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final String deadLetterTopic;
    private final Duration sendTimeout;
    private final Retry retry;

    public DeadLetterPublisher(KafkaTemplate<String, byte[]> kafkaTemplate,
                               RetryFactory retryFactory,
                               RelayProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.deadLetterTopic = properties.getDeadLetterTopic();
        this.sendTimeout = properties.getSendTimeout();
        this.retry = retryFactory.create("dead-letter", properties.getPublish().toRetryPolicy());
    }

    /**
     * @throws PublishException if the record could not be parked; the caller must not commit it then
     */
    public void publish(ConsumerRecord<String, byte[]> record, Exception failure) {
        ProducerRecord<String, byte[]> deadLetter = new ProducerRecord<>(deadLetterTopic, record.key(), record.value());
        for (Header header : record.headers()) {
            deadLetter.headers().add(header);
        }
        RelayHeaders.put(deadLetter.headers(), RelayHeaders.RELAY_ERROR, String.valueOf(failure.getMessage()));
        RelayHeaders.put(deadLetter.headers(), RelayHeaders.RELAY_REASON, failure.getClass().getSimpleName());
        RelayHeaders.put(deadLetter.headers(), RelayHeaders.ORIGINAL_PARTITION, String.valueOf(record.partition()));
        RelayHeaders.put(deadLetter.headers(), RelayHeaders.ORIGINAL_OFFSET, String.valueOf(record.offset()));

        try {
            retry.executeCallable(() -> kafkaTemplate.send(deadLetter).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (Exception e) {
            throw new PublishException(String.format("Failed to dead-letter %s-%d@%d: %s",
                    record.topic(), record.partition(), record.offset(), e.getMessage()), e);
        }
        log.warn("Dead-lettered {}-{}@{} (key {}) to {}: {}", record.topic(), record.partition(), record.offset(),
                record.key(), deadLetterTopic, failure.getMessage());
    }
}
