package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.util.List;

/**
 * 订单（统一格式）
 * 由交易所响应归一化后构造，构造后不可变
 */
public class Order {
    private final String id;                // 交易所订单ID
    private final String clientOrderId;     // 客户端订单ID
    private final Long timestamp;           // 创建时间（毫秒）
    private final String symbol;            // 交易对，如 AAVE/USD
    private final Side side;                // 方向
    private final OrderType type;           // 订单类型（归一化后必有值）
    private final OrderStatus status;       // 状态
    private final BigDecimal price;         // 价格（市价单为空）
    private final BigDecimal stopPrice;     // 触发价
    private final BigDecimal amount;        // 数量（基础货币）
    private final BigDecimal filled;        // 已成交数量
    private final BigDecimal remaining;     // 剩余数量
    private final BigDecimal cost;          // 成交额（报价货币）
    private final List<Fee> fees;           // 手续费

    private Order(Builder builder) {
        this.id = builder.id;
        this.clientOrderId = builder.clientOrderId;
        this.timestamp = builder.timestamp;
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.type = builder.type;
        this.status = builder.status == null ? OrderStatus.UNKNOWN : builder.status;
        this.price = builder.price;
        this.stopPrice = builder.stopPrice;
        this.amount = builder.amount;
        this.filled = builder.filled;
        this.remaining = builder.remaining;
        this.cost = builder.cost;
        this.fees = builder.fees == null ? List.of() : List.copyOf(builder.fees);
    }

    public String getId() { return id; }
    public String getClientOrderId() { return clientOrderId; }
    public Long getTimestamp() { return timestamp; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public OrderType getType() { return type; }
    public OrderStatus getStatus() { return status; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStopPrice() { return stopPrice; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getFilled() { return filled; }
    public BigDecimal getRemaining() { return remaining; }
    public BigDecimal getCost() { return cost; }
    public List<Fee> getFees() { return fees; }

    public boolean isOpen() {
        return status == OrderStatus.OPEN || status == OrderStatus.PENDING_CREATION;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String clientOrderId;
        private Long timestamp;
        private String symbol;
        private Side side;
        private OrderType type;
        private OrderStatus status;
        private BigDecimal price;
        private BigDecimal stopPrice;
        private BigDecimal amount;
        private BigDecimal filled;
        private BigDecimal remaining;
        private BigDecimal cost;
        private List<Fee> fees;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public Builder timestamp(Long timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder type(OrderType type) {
            this.type = type;
            return this;
        }

        public Builder status(OrderStatus status) {
            this.status = status;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder stopPrice(BigDecimal stopPrice) {
            this.stopPrice = stopPrice;
            return this;
        }

        public Builder amount(BigDecimal amount) {
            this.amount = amount;
            return this;
        }

        public Builder filled(BigDecimal filled) {
            this.filled = filled;
            return this;
        }

        public Builder remaining(BigDecimal remaining) {
            this.remaining = remaining;
            return this;
        }

        public Builder cost(BigDecimal cost) {
            this.cost = cost;
            return this;
        }

        public Builder fees(List<Fee> fees) {
            this.fees = fees;
            return this;
        }

        public Order build() {
            if (type == null) {
                throw new IllegalStateException("order type must be resolved before building order " + id);
            }
            return new Order(this);
        }
    }

    @Override
    public String toString() {
        return String.format("Order{id=%s, symbol=%s, side=%s, type=%s, status=%s, price=%s, stopPrice=%s, "
                        + "amount=%s, filled=%s, remaining=%s, cost=%s, fees=%s}",
                id, symbol, side, type, status, price, stopPrice, amount, filled, remaining, cost, fees);
    }
}
