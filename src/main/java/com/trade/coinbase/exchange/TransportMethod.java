package com.trade.coinbase.exchange;

/**
 * Unified calls understood by a {@link Transport}.
 */
public enum TransportMethod {
    FETCH_USER,
    FETCH_OHLCV,
    FETCH_TRADES,
    FETCH_TICKER,
    FETCH_TICKERS,
    CREATE_ORDER,
    CANCEL_ORDER,
    FETCH_BALANCE,
    FETCH_OPEN_ORDERS,
    FETCH_ORDER
}
