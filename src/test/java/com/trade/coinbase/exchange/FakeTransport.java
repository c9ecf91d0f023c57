package com.trade.coinbase.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted transport: each call pops the next queued response (or error) of its method.
 */
class FakeTransport implements Transport {

    static final class Call {
        final TransportMethod method;
        final Map<String, Object> args;

        Call(TransportMethod method, Map<String, Object> args) {
            this.method = method;
            this.args = args;
        }
    }

    private final Map<TransportMethod, Deque<Object>> responses = new EnumMap<>(TransportMethod.class);
    private final Map<String, JsonNode> markets = new HashMap<>();
    private final List<Call> calls = new ArrayList<>();
    private long serverTime = 1_000_000L;
    private int loadMarketsCalls;
    private final Deque<ExchangeException> loadMarketsErrors = new ArrayDeque<>();

    FakeTransport respond(TransportMethod method, JsonNode response) {
        responses.computeIfAbsent(method, m -> new ArrayDeque<>()).add(response);
        return this;
    }

    FakeTransport fail(TransportMethod method, ExchangeException error) {
        responses.computeIfAbsent(method, m -> new ArrayDeque<>()).add(error);
        return this;
    }

    FakeTransport failLoadMarkets(ExchangeException error) {
        loadMarketsErrors.add(error);
        return this;
    }

    FakeTransport market(String symbol, JsonNode info) {
        markets.put(symbol, info);
        return this;
    }

    FakeTransport serverTime(long serverTime) {
        this.serverTime = serverTime;
        return this;
    }

    List<Call> calls() {
        return calls;
    }

    int callCount(TransportMethod method) {
        int count = 0;
        for (Call call : calls) {
            if (call.method == method) {
                count++;
            }
        }
        return count;
    }

    Call lastCall() {
        return calls.get(calls.size() - 1);
    }

    int loadMarketsCalls() {
        return loadMarketsCalls;
    }

    @Override
    public void loadMarkets(boolean reload) throws ExchangeException {
        loadMarketsCalls++;
        ExchangeException error = loadMarketsErrors.poll();
        if (error != null) {
            throw error;
        }
    }

    @Override
    public JsonNode request(TransportMethod method, Map<String, Object> args) throws ExchangeException {
        calls.add(new Call(method, new LinkedHashMap<>(args)));
        Deque<Object> queue = responses.get(method);
        Object next = queue == null ? null : queue.poll();
        if (next == null) {
            throw new IllegalStateException("No scripted response for " + method);
        }
        if (next instanceof ExchangeException error) {
            throw error;
        }
        // hand out a copy, normalization works in place
        return ((JsonNode) next).deepCopy();
    }

    @Override
    public long serverTimeMillis() {
        return serverTime;
    }

    @Override
    public JsonNode marketInfo(String symbol) {
        JsonNode info = markets.get(symbol);
        return info == null ? MissingNode.getInstance() : info;
    }
}
