package com.trade.coinbase.exchange;

/**
 * Argument names of {@link Transport#request}.
 */
public final class TransportArgs {

    private TransportArgs() {}

    public static final String SYMBOL = "symbol";
    public static final String TIME_FRAME = "timeFrame";
    public static final String SINCE = "since";
    public static final String LIMIT = "limit";
    public static final String ORDER_ID = "orderId";
    public static final String TYPE = "type";
    public static final String SIDE = "side";
    public static final String AMOUNT = "amount";
    public static final String PRICE = "price";
    public static final String STOP_PRICE = "stopPrice";
    public static final String CURRENT_PRICE = "currentPrice";
    public static final String REDUCE_ONLY = "reduceOnly";
    public static final String CLIENT_ORDER_ID = "clientOrderId";
    public static final String PARAMS = "params";
    /**
     * Balance mode flag: v3 accounts report free and total amounts, v2 only free amounts.
     */
    public static final String V3 = "v3";
}
