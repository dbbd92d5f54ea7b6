package com.tradejournal.application.service;

import com.tradejournal.application.statemachine.EnvelopeStateMachine;
import com.tradejournal.application.statemachine.EnvelopeStateMachine.Event;
import com.tradejournal.application.statemachine.EnvelopeStateMachine.State;
import com.tradejournal.application.validation.TradeValidationService;
import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.event.TradeEventType;
import com.tradejournal.domain.exception.ApplyException;
import com.tradejournal.domain.exception.TradeEventRejectedException;
import com.tradejournal.domain.exception.TradeRelayException;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import com.tradejournal.domain.port.TradeEventProcessor;
import com.tradejournal.domain.port.TradeStore;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Applies relayed trade events to the {@link TradeStore}.
 *
 * <p>Invalid payloads are rejected before touching the store. Valid ones are
 * dispatched by event type under the {@code apply} retry policy, each attempt
 * observed as {@code kafka_consume_<eventType>}. Exhausting the retries raises
 * {@link ApplyException}, which the consumer treats as fatal.
 *
 * <p>A created trade without an entry date is stamped with the current time
 * on arrival.
 */
@Service
public class TradeEventApplier implements TradeEventProcessor {

    private static final Logger log = LoggerFactory.getLogger(TradeEventApplier.class);

    static final String APPLY_OBSERVATION = "trade.relay.apply";

    private final TradeStore tradeStore;
    private final TradeValidationService validationService;
    private final EnvelopeStateMachine stateMachine;
    private final RelayMetrics metrics;
    private final ObservationRegistry observationRegistry;
    private final Retry applyRetry;
    private final Clock clock;

    public TradeEventApplier(TradeStore tradeStore,
                             TradeValidationService validationService,
                             EnvelopeStateMachine stateMachine,
                             RelayMetrics metrics,
                             ObservationRegistry observationRegistry,
                             RetryFactory retryFactory,
                             RelayProperties properties,
                             Clock clock) {
        this.tradeStore = tradeStore;
        this.validationService = validationService;
        this.stateMachine = stateMachine;
        this.metrics = metrics;
        this.observationRegistry = observationRegistry;
        this.applyRetry = retryFactory.create("apply", properties.getApply().toRetryPolicy());
        this.clock = clock;
    }

    @Override
    public void process(TradeEventEnvelope received) {
        TradeEventEnvelope envelope = withEntryDate(received);
        String eventName = envelope.getEventType().getWireName();
        State state = State.RECEIVED;

        List<String> errors = validationService.validate(envelope);
        if (!errors.isEmpty()) {
            stateMachine.advance(state, Event.REJECT);
            metrics.recordRejected(envelope.getEventType(), "validation");
            throw new TradeEventRejectedException(eventName + " for trade " + envelope.getTradeId() + " rejected", errors);
        }

        state = stateMachine.advance(state, Event.DISPATCH);
        Timer.Sample sample = metrics.startApply();
        try {
            applyRetry.executeRunnable(() -> applyAttempt(envelope));
            state = stateMachine.advance(state, Event.SUCCEED);
            metrics.recordApplied(envelope.getEventType());
            log.info("Applied {} for trade {}", eventName, envelope.getTradeId());
        } catch (TradeRelayException e) {
            if (e.isRetryable()) {
                state = fail(state, envelope, e);
                throw new ApplyException(applyFailureMessage(envelope, e), e);
            }
            state = stateMachine.advance(state, Event.REJECT);
            metrics.recordRejected(envelope.getEventType(), e.getClass().getSimpleName());
            log.warn("{} for trade {} rejected: {}", eventName, envelope.getTradeId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            state = fail(state, envelope, e);
            throw new ApplyException(applyFailureMessage(envelope, e), e);
        } finally {
            metrics.stopApply(sample, envelope.getEventType(), state.name());
        }
    }

    private TradeEventEnvelope withEntryDate(TradeEventEnvelope envelope) {
        if (envelope.getEventType() != TradeEventType.TRADE_CREATED) {
            return envelope;
        }
        LiveTrade trade = envelope.payload(LiveTrade.class);
        if (trade.getEntryDate() != null) {
            return envelope;
        }
        return TradeEventEnvelope.created(trade.toBuilder().entryDate(clock.instant()).build());
    }

    private State fail(State state, TradeEventEnvelope envelope, RuntimeException cause) {
        log.error("Giving up on {} for trade {} after {} attempts", envelope.getEventType().getWireName(),
                envelope.getTradeId(), applyRetry.getRetryConfig().getMaxAttempts(), cause);
        return stateMachine.advance(state, Event.FAIL);
    }

    private static String applyFailureMessage(TradeEventEnvelope envelope, Exception cause) {
        return String.format("Failed to apply %s for trade %s: %s",
                envelope.getEventType().getWireName(), envelope.getTradeId(), cause.getMessage());
    }

    private void applyAttempt(TradeEventEnvelope envelope) {
        Observation observation = Observation.createNotStarted(APPLY_OBSERVATION, observationRegistry)
                .contextualName("kafka_consume_" + envelope.getEventType().getWireName())
                .lowCardinalityKeyValue("event.type", envelope.getEventType().getWireName())
                .start();
        try (Observation.Scope scope = observation.openScope()) {
            dispatch(envelope).run();
            observation.lowCardinalityKeyValue("status", "OK");
        } catch (RuntimeException e) {
            observation.lowCardinalityKeyValue("status", "ERROR");
            observation.error(e);
            throw e;
        } finally {
            observation.stop();
        }
    }

    private Runnable dispatch(TradeEventEnvelope envelope) {
        return switch (envelope.getEventType()) {
            case TRADE_CREATED -> () -> tradeStore.create(envelope.payload(LiveTrade.class));
            case TRADE_UPDATED -> () -> {
                LiveTradeUpdate update = envelope.payload(LiveTradeUpdate.class);
                tradeStore.update(update.getId(), update);
            };
            case TRADE_DELETED -> () -> tradeStore.delete(envelope.getTradeId());
            case TRADE_CLOSED -> () -> {
                TradeClosure closure = envelope.payload(TradeClosure.class);
                tradeStore.close(closure.getId(), closure.getExitPrice(), closure.getFees());
            };
        };
    }
}
