package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradejournal.domain.event.TradeEventPayload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Exit of a live trade. Payload of a TradeClosed event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TradeClosure implements TradeEventPayload {
    private String id;
    private BigDecimal exitPrice;
    private BigDecimal fees;
}
