package com.trade.coinbase.exchange;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Low level REST access to the exchange.
 * <p>
 * Responses are loosely normalized: field names follow {@link com.trade.coinbase.core.OrderColumns},
 * values are still exchange controlled and may be missing or non canonical.
 * Implementations own connection reuse and native rate limiting and must be safe for concurrent calls.
 */
public interface Transport {

    /**
     * Loads (or reloads) market definitions.
     */
    void loadMarkets(boolean reload) throws ExchangeException;

    /**
     * Executes one unified call.
     *
     * @param method unified call
     * @param args   call arguments, see the argument name constants of the implementation
     * @return loosely normalized response
     */
    JsonNode request(TransportMethod method, Map<String, Object> args) throws ExchangeException;

    /**
     * Current time as seen by the exchange, in milliseconds.
     */
    long serverTimeMillis();

    /**
     * Exchange native market record of a loaded symbol, or a missing node when unknown.
     */
    JsonNode marketInfo(String symbol);
}
