package com.trade.coinbase.core;

/**
 * 订单状态（统一格式）
 */
public enum OrderStatus {
    OPEN("open"),
    CLOSED("closed"),                      // 完全成交
    CANCELED("canceled"),
    EXPIRED("expired"),
    REJECTED("rejected"),
    PENDING_CREATION("pending_creation"),  // 已提交，交易所尚未确认
    PENDING_CANCEL("pending_cancel"),      // 撤单排队中
    UNKNOWN("unknown");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Maps a canonical status string; raw exchange values that are not canonical map to {@link #UNKNOWN}.
     */
    public static OrderStatus fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        for (OrderStatus status : values()) {
            if (status.value.equals(raw)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
