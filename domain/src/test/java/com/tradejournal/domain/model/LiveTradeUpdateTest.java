package com.tradejournal.domain.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class LiveTradeUpdateTest {

    @Test
    void testApplyTo_OnlyPresentFieldsChange() {
        LiveTrade trade = LiveTrade.builder()
                .id("t1")
                .accountId("a1")
                .symbol("AAPL")
                .entryPrice(new BigDecimal("150"))
                .tradeType(TradeType.INITIAL)
                .size(TradeSize.FULL)
                .qty(10)
                .slPercentage(new BigDecimal("4"))
                .entryDate(Instant.parse("2024-03-01T14:30:00Z"))
                .build();
        LiveTradeUpdate update = LiveTradeUpdate.builder().id("t1").qty(20).tradeType(TradeType.ADDED).build();

        LiveTrade updated = update.applyTo(trade);

        assertEquals(20, updated.getQty());
        assertEquals(TradeType.ADDED, updated.getTradeType());
        assertEquals("AAPL", updated.getSymbol());
        assertEquals(trade.getEntryPrice(), updated.getEntryPrice());
        assertEquals(trade.getEntryDate(), updated.getEntryDate());
        assertEquals(10, trade.getQty());
    }

    @Test
    void testHasChanges() {
        assertFalse(LiveTradeUpdate.builder().id("t1").build().hasChanges());
        assertTrue(LiveTradeUpdate.builder().id("t1").symbol("MSFT").build().hasChanges());
    }
}
