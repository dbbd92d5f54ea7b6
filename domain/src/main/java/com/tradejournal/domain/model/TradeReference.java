package com.tradejournal.domain.model;

import com.tradejournal.domain.event.TradeEventPayload;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Bare trade id. Payload of a TradeDeleted event.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TradeReference implements TradeEventPayload {
    private String id;
}
