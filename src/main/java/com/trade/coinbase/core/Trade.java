package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.util.List;

/**
 * 成交记录（统一格式）
 * 成交是历史事实，状态恒为 closed
 */
public class Trade {
    private final String id;                // 成交ID
    private final String orderId;           // 订单ID
    private final Long timestamp;           // 成交时间（毫秒）
    private final String symbol;            // 交易对
    private final Side side;                // 方向
    private final OrderType type;           // 订单类型（可能未知）
    private final BigDecimal price;         // 成交价格
    private final BigDecimal amount;        // 成交数量（基础货币）
    private final BigDecimal cost;          // 成交额（报价货币）
    private final List<Fee> fees;           // 手续费

    public Trade(String id, String orderId, Long timestamp, String symbol, Side side, OrderType type,
                 BigDecimal price, BigDecimal amount, BigDecimal cost, List<Fee> fees) {
        this.id = id;
        this.orderId = orderId;
        this.timestamp = timestamp;
        this.symbol = symbol;
        this.side = side;
        this.type = type;
        this.price = price;
        this.amount = amount;
        this.cost = cost;
        this.fees = fees == null ? List.of() : List.copyOf(fees);
    }

    public String getId() { return id; }
    public String getOrderId() { return orderId; }
    public Long getTimestamp() { return timestamp; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getCost() { return cost; }
    public List<Fee> getFees() { return fees; }

    public OrderStatus getStatus() {
        return OrderStatus.CLOSED;
    }

    @Override
    public String toString() {
        return String.format("Trade{id=%s, symbol=%s, side=%s, price=%s, amount=%s, cost=%s, fees=%s}",
                id, symbol, side, price, amount, cost, fees);
    }
}
