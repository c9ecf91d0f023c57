package com.trade.coinbase.core;

/**
 * Field names of the canonical order / trade / fee records exchanged with the engine.
 */
public final class OrderColumns {

    private OrderColumns() {}

    public static final String ID = "id";
    public static final String ORDER = "order";
    public static final String CLIENT_ORDER_ID = "clientOrderId";
    public static final String TIMESTAMP = "timestamp";
    public static final String SYMBOL = "symbol";
    public static final String TYPE = "type";
    public static final String SIDE = "side";
    public static final String STATUS = "status";
    public static final String PRICE = "price";
    public static final String STOP_PRICE = "stopPrice";
    public static final String AMOUNT = "amount";
    public static final String FILLED = "filled";
    public static final String REMAINING = "remaining";
    public static final String COST = "cost";
    public static final String FEE = "fee";
    public static final String FEES = "fees";
    public static final String INFO = "info";

    public static final String FEE_COST = "cost";
    public static final String FEE_CURRENCY = "currency";
}
