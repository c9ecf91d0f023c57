package com.trade.coinbase.core;

/**
 * Canonical order type reported back to the engine.
 */
public enum OrderType {
    MARKET("market"),
    LIMIT("limit"),
    STOP_LOSS("stop_loss");

    private final String value;

    OrderType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static OrderType fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (OrderType type : values()) {
            if (type.value.equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        return null;
    }
}
