package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradejournal.domain.event.TradeEventPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial change to a live trade. Null fields are left untouched.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveTradeUpdate implements TradeEventPayload {
    private String id;
    private String symbol;
    private BigDecimal entryPrice;
    private TradeType tradeType;
    private TradeSize size;
    private Integer qty;

    @JsonAlias("stopLossPercentage")
    private BigDecimal slPercentage;

    public boolean hasChanges() {
        return symbol != null || entryPrice != null || tradeType != null
                || size != null || qty != null || slPercentage != null;
    }

    public LiveTrade applyTo(LiveTrade trade) {
        LiveTrade.LiveTradeBuilder builder = trade.toBuilder();
        if (symbol != null) {
            builder.symbol(symbol);
        }
        if (entryPrice != null) {
            builder.entryPrice(entryPrice);
        }
        if (tradeType != null) {
            builder.tradeType(tradeType);
        }
        if (size != null) {
            builder.size(size);
        }
        if (qty != null) {
            builder.qty(qty);
        }
        if (slPercentage != null) {
            builder.slPercentage(slPercentage);
        }
        return builder.build();
    }
}
