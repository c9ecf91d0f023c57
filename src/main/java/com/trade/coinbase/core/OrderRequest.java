package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 下单请求
 * 引擎侧的交易意图，数量以基础货币计
 */
public class OrderRequest {
    private final TraderOrderType orderType;    // 订单意图
    private final String symbol;                // 交易对
    private final BigDecimal quantity;          // 数量（基础货币）
    private final BigDecimal price;             // 限价
    private final BigDecimal stopPrice;         // 触发价
    private final Side side;                    // 方向，为空时取 orderType 的方向
    private final BigDecimal currentPrice;      // 当前价格（市价买单必填）
    private final boolean reduceOnly;
    private final Map<String, Object> params;   // 透传参数

    private OrderRequest(Builder builder) {
        this.orderType = builder.orderType;
        this.symbol = builder.symbol;
        this.quantity = builder.quantity;
        this.price = builder.price;
        this.stopPrice = builder.stopPrice;
        this.side = builder.side == null ? builder.orderType.getSide() : builder.side;
        this.currentPrice = builder.currentPrice;
        this.reduceOnly = builder.reduceOnly;
        this.params = builder.params == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
    }

    public TraderOrderType getOrderType() { return orderType; }
    public String getSymbol() { return symbol; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStopPrice() { return stopPrice; }
    public Side getSide() { return side; }
    public BigDecimal getCurrentPrice() { return currentPrice; }
    public boolean isReduceOnly() { return reduceOnly; }
    public Map<String, Object> getParams() { return params; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TraderOrderType orderType;
        private String symbol;
        private BigDecimal quantity;
        private BigDecimal price;
        private BigDecimal stopPrice;
        private Side side;
        private BigDecimal currentPrice;
        private boolean reduceOnly;
        private Map<String, Object> params;

        public Builder orderType(TraderOrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
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

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder currentPrice(BigDecimal currentPrice) {
            this.currentPrice = currentPrice;
            return this;
        }

        public Builder reduceOnly(boolean reduceOnly) {
            this.reduceOnly = reduceOnly;
            return this;
        }

        public Builder params(Map<String, Object> params) {
            this.params = params;
            return this;
        }

        public OrderRequest build() {
            if (orderType == null || symbol == null) {
                throw new IllegalStateException("orderType and symbol must be set");
            }
            if (quantity == null || quantity.compareTo(BigDecimal.ZERO) <= 0) {
                throw new IllegalStateException("quantity must be positive");
            }
            if (orderType.getOrderType() == OrderType.LIMIT && price == null) {
                throw new IllegalStateException("limit orders need a price");
            }
            if (orderType.getOrderType() == OrderType.STOP_LOSS && stopPrice == null) {
                throw new IllegalStateException("stop loss orders need a stop price");
            }
            return new OrderRequest(this);
        }
    }

    @Override
    public String toString() {
        return String.format("OrderRequest{type=%s, symbol=%s, side=%s, qty=%s, price=%s, stopPrice=%s, currentPrice=%s}",
                orderType, symbol, side, quantity, price, stopPrice, currentPrice);
    }
}
