package com.perptrader.backend.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PositionSide {
    LONG("long"),
    SHORT("short");

    private final String value;

    PositionSide(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Exchange-style upper-case name, e.g. Binance positionSide. */
    public String getExchangeName() {
        return name();
    }

    @JsonCreator
    public static PositionSide fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (PositionSide side : values()) {
            if (side.value.equalsIgnoreCase(value)) {
                return side;
            }
        }
        throw new IllegalArgumentException("Unknown position side: " + value);
    }
}
