package com.trade.coinbase.error;

/**
 * Canonical error categories consumed by the engine's recovery logic.
 */
public enum ErrorCategory {
    ORDER_NOT_FOUND,
    PERMISSION_DENIED,
    SYMBOL_NOT_TRADABLE,    // account can't trade this pair
    ACCOUNT_SYNC_PENDING,   // portfolio not yet up to date on the exchange side
    INSUFFICIENT_FUNDS,
    UNCLASSIFIED
}
