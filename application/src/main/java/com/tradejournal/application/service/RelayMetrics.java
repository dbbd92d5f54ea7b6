package com.tradejournal.application.service;

import com.tradejournal.domain.event.TradeEventType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Counters and timers of the trade-event relay, tagged by event type.
 */
@Service
public class RelayMetrics {

    static final String PUBLISHED = "relay.events.published";
    static final String PUBLISH_FAILURES = "relay.events.publish.failures";
    static final String APPLIED = "relay.events.applied";
    static final String REJECTED = "relay.events.rejected";
    static final String APPLY_TIME = "relay.events.apply.time";

    private static final String EVENT_TYPE_TAG = "event.type";

    private final MeterRegistry meterRegistry;

    public RelayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordPublished(TradeEventType type) {
        counter(PUBLISHED, "Trade events acknowledged by the broker", type).increment();
    }

    public void recordPublishFailure(TradeEventType type) {
        counter(PUBLISH_FAILURES, "Trade events that exhausted the publish retries", type).increment();
    }

    public void recordApplied(TradeEventType type) {
        counter(APPLIED, "Trade events applied to the trade store", type).increment();
    }

    public void recordRejected(TradeEventType type, String reason) {
        Counter.builder(REJECTED)
                .description("Trade events that can never be applied")
                .tag(EVENT_TYPE_TAG, type.getWireName())
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public Timer.Sample startApply() {
        return Timer.start(meterRegistry);
    }

    public void stopApply(Timer.Sample sample, TradeEventType type, String outcome) {
        sample.stop(Timer.builder(APPLY_TIME)
                .description("Time to apply one trade event, retries included")
                .tag(EVENT_TYPE_TAG, type.getWireName())
                .tag("outcome", outcome)
                .register(meterRegistry));
    }

    private Counter counter(String name, String description, TradeEventType type) {
        return Counter.builder(name)
                .description(description)
                .tag(EVENT_TYPE_TAG, type.getWireName())
                .register(meterRegistry);
    }
}
