package com.tradejournal.application.config;

import com.tradejournal.application.service.TradeEventApplier;
import com.tradejournal.domain.port.RelayFailureListener;
import com.tradejournal.infrastructure.messaging.kafka.KafkaTradeEventConsumer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Kafka relay consumer to the application's event applier.
 * Breaks the dependency cycle between the infrastructure and application modules.
 *
 * <p>Skipped when {@code app.relay.consumer.enabled=false}, for processes that
 * only serve HTTP.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.relay.consumer", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RelayConsumerConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConsumerConfig.class);

    private final KafkaTradeEventConsumer tradeEventConsumer;
    private final TradeEventApplier tradeEventApplier;
    private final RelayFailureListener failureListener;

    public RelayConsumerConfig(KafkaTradeEventConsumer tradeEventConsumer,
                               TradeEventApplier tradeEventApplier,
                               RelayFailureListener failureListener) {
        this.tradeEventConsumer = tradeEventConsumer;
        this.tradeEventApplier = tradeEventApplier;
        this.failureListener = failureListener;
    }

    @PostConstruct
    public void configureConsumer() {
        tradeEventConsumer.setEventProcessor(tradeEventApplier);
        tradeEventConsumer.setFailureListener(failureListener);
        log.info("Relay consumer wired to {}", tradeEventApplier.getClass().getSimpleName());
    }
}
