package com.tradejournal.domain.exception;

public class TradeNotFoundException extends TradeRelayException {

    private final String tradeId;

    public TradeNotFoundException(String tradeId) {
        super("Trade not found: " + tradeId);
        this.tradeId = tradeId;
    }

    public String getTradeId() {
        return tradeId;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
