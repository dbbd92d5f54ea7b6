package com.tradejournal.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a trade relates to the position it belongs to.
 */
public enum TradeType {
    INITIAL("Initial"),
    FREE_ROLL("Free Roll"),
    REDUCED("Reduced"),
    ADDED("Added");

    private final String displayName;

    TradeType(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static TradeType fromDisplayName(String value) {
        for (TradeType type : values()) {
            if (type.displayName.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown trade type: " + value);
    }
}
