package com.tradejournal.infrastructure.persistence;

import com.tradejournal.domain.exception.TradeNotFoundException;
import com.tradejournal.domain.model.ClosedTrade;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;
import com.tradejournal.domain.port.TradeStore;
import com.tradejournal.infrastructure.config.RelayProperties;
import com.tradejournal.infrastructure.persistence.entity.ClosedTradeEntity;
import com.tradejournal.infrastructure.persistence.entity.LiveTradeEntity;
import com.tradejournal.infrastructure.persistence.repository.ClosedTradeRepository;
import com.tradejournal.infrastructure.persistence.repository.LiveTradeRepository;
import com.tradejournal.infrastructure.resilience.RetryFactory;
import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link TradeStore} backed by the live_trade and closed_trade tables.
 *
 * <p>Each call runs in its own transaction and is retried as a whole with the
 * {@code store} policy; a retried attempt starts a fresh transaction.
 */
@Component
public class JpaTradeStore implements TradeStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTradeStore.class);

    private final LiveTradeRepository liveTradeRepository;
    private final ClosedTradeRepository closedTradeRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Retry retry;

    public JpaTradeStore(LiveTradeRepository liveTradeRepository,
                         ClosedTradeRepository closedTradeRepository,
                         PlatformTransactionManager transactionManager,
                         Clock clock,
                         RetryFactory retryFactory,
                         RelayProperties properties) {
        this.liveTradeRepository = liveTradeRepository;
        this.closedTradeRepository = closedTradeRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.retry = retryFactory.create("store", properties.getStore().toRetryPolicy());
    }

    @Override
    public LiveTrade create(LiveTrade trade) {
        return inTransaction(() -> {
            if (closedTradeRepository.existsById(trade.getId())) {
                log.info("Trade {} is already closed, ignoring create", trade.getId());
                return trade;
            }
            LiveTradeEntity saved = liveTradeRepository.save(toEntity(trade));
            log.debug("Stored live trade {} for account {}", saved.getId(), saved.getAccountId());
            return toDomain(saved);
        });
    }

    @Override
    public LiveTrade update(String id, LiveTradeUpdate changes) {
        return inTransaction(() -> {
            LiveTradeEntity entity = liveTradeRepository.findById(id)
                    .orElseThrow(() -> new TradeNotFoundException(id));
            LiveTrade updated = changes.applyTo(toDomain(entity));
            LiveTradeEntity saved = liveTradeRepository.save(toEntity(updated));
            log.debug("Updated live trade {}", id);
            return toDomain(saved);
        });
    }

    @Override
    public void delete(String id) {
        inTransaction(() -> {
            if (liveTradeRepository.existsById(id)) {
                liveTradeRepository.deleteById(id);
                log.debug("Deleted live trade {}", id);
            } else {
                log.debug("Live trade {} already absent, nothing to delete", id);
            }
            return null;
        });
    }

    @Override
    public ClosedTrade close(String id, BigDecimal exitPrice, BigDecimal fees) {
        return inTransaction(() -> {
            Optional<LiveTradeEntity> live = liveTradeRepository.findById(id);
            ClosedTrade closed;
            if (live.isPresent()) {
                closed = ClosedTrade.fromLive(toDomain(live.get()), exitPrice, fees, clock.instant());
                liveTradeRepository.delete(live.get());
            } else {
                ClosedTradeEntity existing = closedTradeRepository.findById(id)
                        .orElseThrow(() -> new TradeNotFoundException(id));
                log.info("Trade {} was already closed, recomputing closed record", id);
                closed = toDomain(existing).reclose(exitPrice, fees);
            }
            ClosedTradeEntity saved = closedTradeRepository.save(toEntity(closed));
            log.debug("Closed trade {} with realized P/L {}", id, saved.getRealizedPL());
            return toDomain(saved);
        });
    }

    @Override
    public List<LiveTrade> findLiveTrades(String accountId) {
        return withRetry(() -> liveTradeRepository.findAllByAccountIdOrderByEntryDateDesc(accountId).stream()
                .map(JpaTradeStore::toDomain)
                .collect(Collectors.toList()));
    }

    @Override
    public List<ClosedTrade> findClosedTrades(String accountId) {
        return withRetry(() -> closedTradeRepository.findAllByAccountIdOrderByExitDateDesc(accountId).stream()
                .map(JpaTradeStore::toDomain)
                .collect(Collectors.toList()));
    }

    private <T> T inTransaction(Supplier<T> work) {
        return withRetry(() -> transactionTemplate.execute(status -> work.get()));
    }

    private <T> T withRetry(Supplier<T> work) {
        return retry.executeSupplier(work);
    }

    static LiveTradeEntity toEntity(LiveTrade trade) {
        return LiveTradeEntity.builder()
                .id(trade.getId())
                .accountId(trade.getAccountId())
                .symbol(trade.getSymbol())
                .entryPrice(trade.getEntryPrice())
                .tradeType(trade.getTradeType())
                .size(trade.getSize())
                .qty(trade.getQty())
                .slPercentage(trade.getSlPercentage())
                .entryDate(trade.getEntryDate())
                .build();
    }

    static LiveTrade toDomain(LiveTradeEntity entity) {
        return LiveTrade.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .symbol(entity.getSymbol())
                .entryPrice(entity.getEntryPrice())
                .tradeType(entity.getTradeType())
                .size(entity.getSize())
                .qty(entity.getQty())
                .slPercentage(entity.getSlPercentage())
                .entryDate(entity.getEntryDate())
                .build();
    }

    static ClosedTradeEntity toEntity(ClosedTrade trade) {
        return ClosedTradeEntity.builder()
                .id(trade.getId())
                .accountId(trade.getAccountId())
                .symbol(trade.getSymbol())
                .entryPrice(trade.getEntryPrice())
                .exitPrice(trade.getExitPrice())
                .tradeType(trade.getTradeType())
                .size(trade.getSize())
                .qty(trade.getQty())
                .entryDate(trade.getEntryDate())
                .exitDate(trade.getExitDate())
                .fees(trade.getFees())
                .realizedPL(trade.getRealizedPL())
                .build();
    }

    static ClosedTrade toDomain(ClosedTradeEntity entity) {
        return ClosedTrade.builder()
                .id(entity.getId())
                .accountId(entity.getAccountId())
                .symbol(entity.getSymbol())
                .entryPrice(entity.getEntryPrice())
                .exitPrice(entity.getExitPrice())
                .tradeType(entity.getTradeType())
                .size(entity.getSize())
                .qty(entity.getQty())
                .entryDate(entity.getEntryDate())
                .exitDate(entity.getExitDate())
                .fees(entity.getFees())
                .realizedPL(entity.getRealizedPL())
                .build();
    }
}
