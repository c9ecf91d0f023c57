package com.trade.coinbase.core;

/**
 * K线周期（Coinbase 支持的粒度）
 */
public enum TimeFrame {
    ONE_MINUTE("1m", 1, "ONE_MINUTE"),
    FIVE_MINUTES("5m", 5, "FIVE_MINUTE"),
    FIFTEEN_MINUTES("15m", 15, "FIFTEEN_MINUTE"),
    THIRTY_MINUTES("30m", 30, "THIRTY_MINUTE"),
    ONE_HOUR("1h", 60, "ONE_HOUR"),
    TWO_HOURS("2h", 120, "TWO_HOUR"),
    SIX_HOURS("6h", 360, "SIX_HOUR"),
    ONE_DAY("1d", 1440, "ONE_DAY");

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final String code;
    private final int minutes;
    private final String granularity;

    TimeFrame(String code, int minutes, String granularity) {
        this.code = code;
        this.minutes = minutes;
        this.granularity = granularity;
    }

    public String getCode() {
        return code;
    }

    public int getMinutes() {
        return minutes;
    }

    public long toMillis() {
        return minutes * MILLIS_PER_MINUTE;
    }

    /**
     * Coinbase candle granularity name.
     */
    public String getGranularity() {
        return granularity;
    }

    public static TimeFrame fromCode(String code) {
        for (TimeFrame timeFrame : values()) {
            if (timeFrame.code.equals(code)) {
                return timeFrame;
            }
        }
        throw new IllegalArgumentException("Unsupported time frame: " + code);
    }
}
