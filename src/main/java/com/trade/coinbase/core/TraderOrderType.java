package com.trade.coinbase.core;

/**
 * Order intent as requested by the engine (side and order type combined).
 */
public enum TraderOrderType {
    BUY_MARKET(Side.BUY, OrderType.MARKET),
    BUY_LIMIT(Side.BUY, OrderType.LIMIT),
    SELL_MARKET(Side.SELL, OrderType.MARKET),
    SELL_LIMIT(Side.SELL, OrderType.LIMIT),
    STOP_LOSS(Side.SELL, OrderType.STOP_LOSS);

    private final Side side;
    private final OrderType orderType;

    TraderOrderType(Side side, OrderType orderType) {
        this.side = side;
        this.orderType = orderType;
    }

    public Side getSide() {
        return side;
    }

    public OrderType getOrderType() {
        return orderType;
    }
}
