package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradejournal.domain.event.TradeEventPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An open trade. Also the payload of a TradeCreated event.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveTrade implements TradeEventPayload {
    private String id;
    private String accountId;
    private String symbol;
    private BigDecimal entryPrice;
    private TradeType tradeType;
    private TradeSize size;
    private Integer qty;

    @JsonAlias("stopLossPercentage")
    private BigDecimal slPercentage;

    private Instant entryDate;
}
