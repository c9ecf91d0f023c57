package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * K线数据
 * 不可变对象
 */
public class Candle {
    private final Instant openTime;
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final BigDecimal volume;    // 成交量（基础货币）

    public Candle(Instant openTime, BigDecimal open, BigDecimal high,
                  BigDecimal low, BigDecimal close, BigDecimal volume) {
        this.openTime = openTime;
        this.open = open;
        this.high = high;
        this.low = low;
        this.close = close;
        this.volume = volume;
    }

    public Instant getOpenTime() { return openTime; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }

    public long getOpenTimeMillis() {
        return openTime.toEpochMilli();
    }

    @Override
    public String toString() {
        return String.format("Candle{time=%s, O=%s, H=%s, L=%s, C=%s, V=%s}",
                openTime, open, high, low, close, volume);
    }
}
