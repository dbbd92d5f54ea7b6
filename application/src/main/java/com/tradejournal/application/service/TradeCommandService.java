package com.tradejournal.application.service;

import com.tradejournal.application.validation.TradeValidationException;
import com.tradejournal.application.validation.TradeValidationService;
import com.tradejournal.domain.event.TradeEventEnvelope;
import com.tradejournal.domain.exception.PublishException;
import com.tradejournal.domain.model.ClosedTrade;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.model.TradeClosure;
import com.tradejournal.domain.model.TradeReference;
import com.tradejournal.domain.port.TradeEventPublisher;
import com.tradejournal.domain.port.TradeStore;
import com.tradejournal.infrastructure.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Turns trade commands into relayed events.
 *
 * <p>Writes never touch the store directly: each command is validated,
 * normalized and published, and the call returns once the broker has
 * acknowledged it. The relay consumer applies it afterwards.
 */
@Service
public class TradeCommandService {

    private static final Logger log = LoggerFactory.getLogger(TradeCommandService.class);

    private final TradeEventPublisher publisher;
    private final TradeStore tradeStore;
    private final TradeValidationService validationService;
    private final RelayMetrics metrics;
    private final Clock clock;
    private final String topic;

    public TradeCommandService(TradeEventPublisher publisher,
                               TradeStore tradeStore,
                               TradeValidationService validationService,
                               RelayMetrics metrics,
                               Clock clock,
                               RelayProperties properties) {
        this.publisher = publisher;
        this.tradeStore = tradeStore;
        this.validationService = validationService;
        this.metrics = metrics;
        this.clock = clock;
        this.topic = properties.getTopic();
    }

    public LiveTrade createLiveTrade(LiveTrade request) {
        LiveTrade trade = request.toBuilder()
                .id(UUID.randomUUID().toString())
                .accountId(trim(request.getAccountId()))
                .symbol(trim(request.getSymbol()))
                .entryDate(request.getEntryDate() != null ? request.getEntryDate() : clock.instant())
                .build();
        check(validationService.validateNewTrade(trade));

        publish(TradeEventEnvelope.created(trade));
        log.info("Trade {} created for account {}", trade.getId(), trade.getAccountId());
        return trade;
    }

    public LiveTradeUpdate updateLiveTrade(String id, LiveTradeUpdate request) {
        LiveTradeUpdate update = request.toBuilder()
                .id(id)
                .symbol(trim(request.getSymbol()))
                .build();
        check(validationService.validateUpdate(update));

        publish(TradeEventEnvelope.updated(update));
        log.info("Trade {} update published", id);
        return update;
    }

    public void deleteLiveTrade(String id) {
        check(validationService.validateDeletion(new TradeReference(id)));

        publish(TradeEventEnvelope.deleted(id));
        log.info("Trade {} deletion published", id);
    }

    public TradeClosure closeLiveTrade(String id, TradeClosure request) {
        TradeClosure closure = new TradeClosure(id, request.getExitPrice(), request.getFees());
        check(validationService.validateClosure(closure));

        publish(TradeEventEnvelope.closed(id, closure.getExitPrice(), closure.getFees()));
        log.info("Trade {} close published", id);
        return closure;
    }

    public List<LiveTrade> findLiveTrades(String accountId) {
        check(validationService.validateAccountId(accountId));
        return tradeStore.findLiveTrades(accountId.trim());
    }

    public List<ClosedTrade> findClosedTrades(String accountId) {
        check(validationService.validateAccountId(accountId));
        return tradeStore.findClosedTrades(accountId.trim());
    }

    private void publish(TradeEventEnvelope envelope) {
        try {
            publisher.publish(topic, envelope);
            metrics.recordPublished(envelope.getEventType());
        } catch (PublishException e) {
            metrics.recordPublishFailure(envelope.getEventType());
            throw e;
        }
    }

    private static void check(List<String> errors) {
        if (!errors.isEmpty()) {
            throw new TradeValidationException(errors);
        }
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
