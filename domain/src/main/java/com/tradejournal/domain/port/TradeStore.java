package com.tradejournal.domain.port;

import com.tradejournal.domain.model.ClosedTrade;
import com.tradejournal.domain.model.LiveTrade;
import com.tradejournal.domain.model.LiveTradeUpdate;

import java.math.BigDecimal;
import java.util.List;

/**
 * Durable storage of live and closed trades, keyed by trade id.
 *
 * <p>Every write is safe to repeat: the relay delivers at least once.
 */
public interface TradeStore {

    /**
     * Inserts the trade, or overwrites the live trade with the same id.
     */
    LiveTrade create(LiveTrade trade);

    /**
     * Applies the non-null fields of {@code changes} to the live trade.
     *
     * @throws com.tradejournal.domain.exception.TradeNotFoundException if no live trade has this id
     */
    LiveTrade update(String id, LiveTradeUpdate changes);

    /**
     * Removes the live trade. Removing an absent trade does nothing.
     */
    void delete(String id);

    /**
     * Replaces the live trade by its closed record in one step. If the trade was
     * already closed, the closed record is recomputed from its own entry data.
     *
     * @throws com.tradejournal.domain.exception.TradeNotFoundException if the id is neither live nor closed
     */
    ClosedTrade close(String id, BigDecimal exitPrice, BigDecimal fees);

    List<LiveTrade> findLiveTrades(String accountId);

    List<ClosedTrade> findClosedTrades(String accountId);
}
