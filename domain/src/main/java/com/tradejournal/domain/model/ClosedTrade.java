package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A trade that has been exited. Replaces the live trade with the same id.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ClosedTrade {
    private String id;
    private String accountId;
    private String symbol;
    private BigDecimal entryPrice;
    private BigDecimal exitPrice;
    private TradeType tradeType;
    private TradeSize size;
    private Integer qty;
    private Instant entryDate;
    private Instant exitDate;
    private BigDecimal fees;
    private BigDecimal realizedPL;

    /**
     * Builds the closed record for a live trade exited at {@code exitPrice}.
     */
    public static ClosedTrade fromLive(LiveTrade live, BigDecimal exitPrice, BigDecimal fees, Instant exitDate) {
        return ClosedTrade.builder()
                .id(live.getId())
                .accountId(live.getAccountId())
                .symbol(live.getSymbol())
                .entryPrice(live.getEntryPrice())
                .exitPrice(exitPrice)
                .tradeType(live.getTradeType())
                .size(live.getSize())
                .qty(live.getQty())
                .entryDate(live.getEntryDate())
                .exitDate(exitDate)
                .fees(fees)
                .realizedPL(realizedPL(live.getEntryPrice(), exitPrice, live.getQty(), fees))
                .build();
    }

    /**
     * Recomputes this record for a repeated close. Entry data and the original
     * exit date are kept, so the same exit values always give the same record.
     */
    public ClosedTrade reclose(BigDecimal newExitPrice, BigDecimal newFees) {
        return toBuilder()
                .exitPrice(newExitPrice)
                .fees(newFees)
                .realizedPL(realizedPL(entryPrice, newExitPrice, qty, newFees))
                .build();
    }

    public static BigDecimal realizedPL(BigDecimal entryPrice, BigDecimal exitPrice, int qty, BigDecimal fees) {
        BigDecimal gross = exitPrice.subtract(entryPrice).multiply(BigDecimal.valueOf(qty));
        return fees == null ? gross : gross.subtract(fees);
    }
}
