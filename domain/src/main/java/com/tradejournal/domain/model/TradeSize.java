package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position sizing bucket, expressed as a share of a full allocation.
 */
public enum TradeSize {
    QUARTER("Qtr 6.25%"),
    HALF("Half 12.50%"),
    FULL("Full 25%"),
    DOUBLE_FULL("2X Full 50%");

    private final String displayName;

    TradeSize(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static TradeSize fromDisplayName(String value) {
        for (TradeSize size : values()) {
            if (size.displayName.equals(value)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown trade size: " + value);
    }
}
