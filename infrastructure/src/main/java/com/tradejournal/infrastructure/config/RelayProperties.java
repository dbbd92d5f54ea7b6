package com.tradejournal.infrastructure.config;

import com.tradejournal.domain.retry.RetryPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings of the trade-event relay, bound from {@code app.relay.*}.
 *
 * <pre>
 * app:
 *   relay:
 *     broker-address: localhost:9092
 *     group-id: trade-group
 *     topic: trade-events
 *     dead-letter-topic: trade-events-dlq
 *     consumer:
 *       enabled: true
 *     publish:
 *       max-attempts: 3
 *       base-delay: 500ms
 *       multiplier: 2.0
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "app.relay")
public class RelayProperties {

    private String brokerAddress = "localhost:9092";
    private String groupId = "trade-group";
    private String topic = "trade-events";
    private String deadLetterTopic = "trade-events-dlq";
    private int partitions = 3;
    private int replicas = 1;

    /**
     * Upper bound on waiting for one broker acknowledgement.
     */
    private Duration sendTimeout = Duration.ofSeconds(10);

    private ConsumerSettings consumer = new ConsumerSettings();

    private Policy connect = new Policy(6, Duration.ofSeconds(1), 2.0);
    private Policy publish = new Policy(3, Duration.ofMillis(500), 2.0);
    private Policy apply = new Policy(3, Duration.ofMillis(500), 2.0);
    private Policy store = new Policy(3, Duration.ofMillis(500), 2.0);

    @Data
    public static class ConsumerSettings {
        private boolean enabled = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Policy {
        private int maxAttempts;
        private Duration baseDelay;
        private double multiplier;

        public RetryPolicy toRetryPolicy() {
            return RetryPolicy.of(maxAttempts, baseDelay, multiplier);
        }
    }
}
