package com.trade.coinbase.core;

import java.util.Locale;

/**
 * 订单方向
 */
public enum Side {
    BUY("buy"),
    SELL("sell");

    private final String value;

    Side(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * @return matching side, or null for blank / unknown input
     */
    public static Side fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Side side : values()) {
            if (side.value.equals(normalized)) {
                return side;
            }
        }
        return null;
    }
}
