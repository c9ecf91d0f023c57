package com.trade.coinbase.retry;

import com.trade.coinbase.exchange.ExchangeException;

/**
 * A remote operation that can be wrapped by {@link RetryPolicy}.
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T execute() throws ExchangeException;
}
