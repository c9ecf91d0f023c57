package com.trade.coinbase.core;

import java.math.BigDecimal;

/**
 * 实时行情快照
 */
public class Ticker {
    private final String symbol;
    private final BigDecimal bidPrice;       // 最优买一价
    private final BigDecimal askPrice;       // 最优卖一价
    private final BigDecimal lastPrice;      // 最新成交价
    private final BigDecimal baseVolume;     // 24h成交量
    private final BigDecimal high24h;        // 24h最高价
    private final BigDecimal low24h;         // 24h最低价
    private final Long timestamp;            // 时间戳（毫秒）

    public Ticker(String symbol, BigDecimal bidPrice, BigDecimal askPrice,
                  BigDecimal lastPrice, BigDecimal baseVolume,
                  BigDecimal high24h, BigDecimal low24h, Long timestamp) {
        this.symbol = symbol;
        this.bidPrice = bidPrice;
        this.askPrice = askPrice;
        this.lastPrice = lastPrice;
        this.baseVolume = baseVolume;
        this.high24h = high24h;
        this.low24h = low24h;
        this.timestamp = timestamp;
    }

    public String getSymbol() { return symbol; }
    public BigDecimal getBidPrice() { return bidPrice; }
    public BigDecimal getAskPrice() { return askPrice; }
    public BigDecimal getLastPrice() { return lastPrice; }
    public BigDecimal getBaseVolume() { return baseVolume; }
    public BigDecimal getHigh24h() { return high24h; }
    public BigDecimal getLow24h() { return low24h; }
    public Long getTimestamp() { return timestamp; }

    /**
     * 获取中间价
     */
    public BigDecimal getMidPrice() {
        if (bidPrice == null || askPrice == null) {
            return lastPrice;
        }
        return bidPrice.add(askPrice).divide(BigDecimal.valueOf(2), 8, java.math.RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return String.format("Ticker{symbol=%s, bid=%s, ask=%s, last=%s}", symbol, bidPrice, askPrice, lastPrice);
    }
}
