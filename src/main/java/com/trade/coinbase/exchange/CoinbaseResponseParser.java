package com.trade.coinbase.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trade.coinbase.core.OrderColumns;
import com.trade.coinbase.core.OrderStatus;
import com.trade.coinbase.core.OrderType;
import com.trade.coinbase.core.Symbol;
import com.trade.coinbase.normalize.JsonFields;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Translates Coinbase Advanced Trade payloads into loosely normalized records.
 * <p>
 * Only field names and formats are aligned here. Values Coinbase leaves out or reports in
 * its own vocabulary (unknown order type, PENDING / CANCEL_QUEUED statuses, fee currency,
 * quote sized fills) are kept as is for the {@link com.trade.coinbase.normalize.ResponseNormalizer}.
 */
public class CoinbaseResponseParser {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private static final Map<String, String> ORDER_STATUSES = Map.of(
            "OPEN", OrderStatus.OPEN.getValue(),
            "FILLED", OrderStatus.CLOSED.getValue(),
            "CANCELLED", OrderStatus.CANCELED.getValue(),
            "EXPIRED", OrderStatus.EXPIRED.getValue(),
            "FAILED", OrderStatus.REJECTED.getValue()
    );

    private static final Map<String, String> ORDER_TYPES = Map.of(
            "MARKET", OrderType.MARKET.getValue(),
            "LIMIT", OrderType.LIMIT.getValue(),
            "STOP", OrderType.STOP_LOSS.getValue(),
            "STOP_LIMIT", OrderType.STOP_LOSS.getValue()
    );

    /**
     * Parses a historical order: {"order_id": .., "product_id": "AAVE-USD", "order_configuration": {..}, ..}.
     */
    public ObjectNode parseOrder(JsonNode raw) {
        ObjectNode order = NODES.objectNode();
        order.put(OrderColumns.ID, JsonFields.text(raw, "order_id"));
        order.put(OrderColumns.CLIENT_ORDER_ID, JsonFields.text(raw, "client_order_id"));
        order.put(OrderColumns.TIMESTAMP, parseTime(JsonFields.text(raw, "created_time")));
        order.put(OrderColumns.SYMBOL, toSymbol(JsonFields.text(raw, "product_id")));
        order.put(OrderColumns.SIDE, lower(JsonFields.text(raw, "side")));

        String nativeStatus = JsonFields.text(raw, "status");
        order.put(OrderColumns.STATUS, nativeStatus == null ? null : ORDER_STATUSES.getOrDefault(nativeStatus, nativeStatus));
        // UNKNOWN_ORDER_TYPE and other unlisted values stay unset
        order.put(OrderColumns.TYPE, ORDER_TYPES.get(JsonFields.text(raw, "order_type")));

        JsonNode configuration = firstConfiguration(raw.path("order_configuration"));
        BigDecimal price = JsonFields.decimal(configuration, "limit_price");
        BigDecimal stopPrice = JsonFields.decimal(configuration, "stop_price");
        BigDecimal amount = JsonFields.decimal(configuration, "base_size");
        BigDecimal filled = JsonFields.decimal(raw, "filled_size");
        order.put(OrderColumns.PRICE, price);
        order.put(OrderColumns.STOP_PRICE, stopPrice);
        order.put(OrderColumns.AMOUNT, amount);
        order.put(OrderColumns.FILLED, filled);
        order.put(OrderColumns.REMAINING, amount != null && filled != null ? amount.subtract(filled) : null);
        order.put(OrderColumns.COST, JsonFields.decimal(raw, "filled_value"));

        BigDecimal totalFees = JsonFields.decimal(raw, "total_fees");
        if (totalFees != null) {
            ObjectNode fee = feeNode(totalFees);
            order.set(OrderColumns.FEE, fee);
            order.set(OrderColumns.FEES, NODES.arrayNode().add(fee.deepCopy()));
        }
        order.set(OrderColumns.INFO, raw);
        return order;
    }

    public ArrayNode parseOrders(JsonNode rawOrders) {
        ArrayNode orders = NODES.arrayNode();
        if (rawOrders != null && rawOrders.isArray()) {
            for (JsonNode raw : rawOrders) {
                orders.add(parseOrder(raw));
            }
        }
        return orders;
    }

    /**
     * Parses a create order response. The exchange only acknowledges the submission,
     * the order is reported as PENDING until it shows up in the book.
     */
    public ObjectNode parseCreatedOrder(JsonNode response, JsonNode requestBody) throws ExchangeException {
        if (!response.path("success").asBoolean(false)) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "coinbase " + response.path("error_response"));
        }
        JsonNode success = response.path("success_response");
        ObjectNode raw = NODES.objectNode();
        raw.put("order_id", JsonFields.text(success, "order_id"));
        raw.put("client_order_id", JsonFields.text(success, "client_order_id"));
        raw.put("product_id", JsonFields.text(success, "product_id"));
        raw.put("side", JsonFields.text(success, "side"));
        raw.put("status", "PENDING");
        raw.set("order_configuration", requestBody.path("order_configuration").deepCopy());
        ObjectNode order = parseOrder(raw);
        order.put(OrderColumns.FILLED, BigDecimal.ZERO);
        order.set(OrderColumns.INFO, response);
        return order;
    }

    /**
     * Parses a batch cancel response of a single order.
     */
    public ObjectNode parseCancelledOrder(JsonNode response, String orderId) throws ExchangeException {
        JsonNode results = response.path("results");
        if (!results.isArray() || results.isEmpty()) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "coinbase empty cancel response for order " + orderId + ": " + response);
        }
        JsonNode result = results.get(0);
        if (!result.path("success").asBoolean(false)) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "coinbase cancel failed for order " + orderId + ": " + result.path("failure_reason").asText("unknown"));
        }
        ObjectNode order = NODES.objectNode();
        order.put(OrderColumns.ID, JsonFields.text(result, "order_id"));
        order.put(OrderColumns.STATUS, OrderStatus.CANCELED.getValue());
        order.set(OrderColumns.INFO, result);
        return order;
    }

    /**
     * Parses public trades or user fills. Fills sized in quote currency only carry a cost.
     */
    public ObjectNode parseTrade(JsonNode raw) {
        ObjectNode trade = NODES.objectNode();
        trade.put(OrderColumns.ID, JsonFields.text(raw, "trade_id"));
        trade.put(OrderColumns.ORDER, JsonFields.text(raw, "order_id"));
        String time = JsonFields.text(raw, "trade_time");
        trade.put(OrderColumns.TIMESTAMP, parseTime(time != null ? time : JsonFields.text(raw, "time")));
        trade.put(OrderColumns.SYMBOL, toSymbol(JsonFields.text(raw, "product_id")));
        trade.put(OrderColumns.SIDE, lower(JsonFields.text(raw, "side")));
        trade.putNull(OrderColumns.TYPE);

        BigDecimal price = JsonFields.decimal(raw, "price");
        BigDecimal size = JsonFields.decimal(raw, "size");
        trade.put(OrderColumns.PRICE, price);
        if (raw.path("size_in_quote").asBoolean(false)) {
            trade.putNull(OrderColumns.AMOUNT);
            trade.put(OrderColumns.COST, size);
        } else {
            trade.put(OrderColumns.AMOUNT, size);
            trade.put(OrderColumns.COST, price != null && size != null ? price.multiply(size) : null);
        }

        BigDecimal commission = JsonFields.decimal(raw, "commission");
        if (commission != null) {
            ObjectNode fee = feeNode(commission);
            trade.set(OrderColumns.FEE, fee);
            trade.set(OrderColumns.FEES, NODES.arrayNode().add(fee.deepCopy()));
        }
        trade.set(OrderColumns.INFO, raw);
        return trade;
    }

    public ArrayNode parseTrades(JsonNode rawTrades) {
        ArrayNode trades = NODES.arrayNode();
        if (rawTrades != null && rawTrades.isArray()) {
            for (JsonNode raw : rawTrades) {
                trades.add(parseTrade(raw));
            }
        }
        return trades;
    }

    /**
     * Candles come newest first as {"start": seconds, "open": .., ...}; returns ascending
     * [millis, open, high, low, close, volume] rows.
     */
    public ArrayNode parseCandles(JsonNode rawCandles) {
        List<ArrayNode> rows = new ArrayList<>();
        if (rawCandles != null && rawCandles.isArray()) {
            for (JsonNode raw : rawCandles) {
                Long start = JsonFields.longValue(raw, "start");
                if (start == null) {
                    continue;
                }
                ArrayNode row = NODES.arrayNode();
                row.add(start * 1000L);
                row.add(JsonFields.decimal(raw, "open"));
                row.add(JsonFields.decimal(raw, "high"));
                row.add(JsonFields.decimal(raw, "low"));
                row.add(JsonFields.decimal(raw, "close"));
                row.add(JsonFields.decimal(raw, "volume"));
                rows.add(row);
            }
        }
        rows.sort((a, b) -> Long.compare(a.get(0).asLong(), b.get(0).asLong()));
        ArrayNode result = NODES.arrayNode();
        rows.forEach(result::add);
        return result;
    }

    /**
     * Parses the product ticker endpoint: best bid / ask plus the latest trades.
     */
    public ObjectNode parseTicker(String symbol, JsonNode raw) {
        ObjectNode ticker = NODES.objectNode();
        ticker.put(OrderColumns.SYMBOL, symbol);
        ticker.put("bid", JsonFields.decimal(raw, "best_bid"));
        ticker.put("ask", JsonFields.decimal(raw, "best_ask"));
        JsonNode trades = raw.path("trades");
        JsonNode latest = trades.isArray() && !trades.isEmpty() ? trades.get(0) : null;
        ticker.put("last", JsonFields.decimal(latest, "price"));
        ticker.put(OrderColumns.TIMESTAMP, parseTime(JsonFields.text(latest, "time")));
        ticker.set(OrderColumns.INFO, raw);
        return ticker;
    }

    /**
     * Parses a product listing into tickers keyed by symbol.
     */
    public ObjectNode parseProductTickers(JsonNode products) {
        ObjectNode tickers = NODES.objectNode();
        if (products == null || !products.isArray()) {
            return tickers;
        }
        for (JsonNode product : products) {
            String symbol = toSymbol(JsonFields.text(product, "product_id"));
            if (symbol == null) {
                continue;
            }
            ObjectNode ticker = NODES.objectNode();
            ticker.put(OrderColumns.SYMBOL, symbol);
            ticker.put("last", JsonFields.decimal(product, "price"));
            ticker.put("baseVolume", JsonFields.decimal(product, "volume_24h"));
            ticker.set(OrderColumns.INFO, product);
            tickers.set(symbol, ticker);
        }
        return tickers;
    }

    /**
     * Parses v3 brokerage accounts: free, used (hold) and total per currency.
     */
    public ObjectNode parseV3Balances(JsonNode accounts) {
        Map<String, BigDecimal[]> sums = new LinkedHashMap<>();
        if (accounts != null && accounts.isArray()) {
            for (JsonNode account : accounts) {
                String currency = JsonFields.text(account, "currency");
                if (currency == null) {
                    continue;
                }
                BigDecimal free = orZero(JsonFields.decimal(account.path("available_balance"), "value"));
                BigDecimal used = orZero(JsonFields.decimal(account.path("hold"), "value"));
                BigDecimal[] sum = sums.computeIfAbsent(currency, k -> new BigDecimal[]{BigDecimal.ZERO, BigDecimal.ZERO});
                sum[0] = sum[0].add(free);
                sum[1] = sum[1].add(used);
            }
        }
        ObjectNode balances = NODES.objectNode();
        for (Map.Entry<String, BigDecimal[]> entry : sums.entrySet()) {
            ObjectNode balance = NODES.objectNode();
            balance.put("free", entry.getValue()[0]);
            balance.put("used", entry.getValue()[1]);
            balance.put("total", entry.getValue()[0].add(entry.getValue()[1]));
            balances.set(entry.getKey(), balance);
        }
        return balances;
    }

    /**
     * Parses v2 accounts, which only report free amounts.
     */
    public ObjectNode parseV2Balances(JsonNode accounts) {
        ObjectNode balances = NODES.objectNode();
        if (accounts == null || !accounts.isArray()) {
            return balances;
        }
        for (JsonNode account : accounts) {
            JsonNode balance = account.path("balance");
            String currency = JsonFields.text(balance, "currency");
            if (currency == null) {
                continue;
            }
            BigDecimal amount = orZero(JsonFields.decimal(balance, "amount"));
            JsonNode existing = balances.get(currency);
            if (existing != null) {
                amount = amount.add(orZero(JsonFields.decimal(existing, "free")));
            }
            ObjectNode entry = NODES.objectNode();
            entry.put("free", amount);
            entry.putNull("used");
            entry.putNull("total");
            balances.set(currency, entry);
        }
        return balances;
    }

    /**
     * Indexes products by unified symbol.
     */
    public Map<String, JsonNode> parseMarkets(JsonNode products) {
        Map<String, JsonNode> markets = new LinkedHashMap<>();
        if (products == null || !products.isArray()) {
            return markets;
        }
        Iterator<JsonNode> iterator = products.elements();
        while (iterator.hasNext()) {
            JsonNode product = iterator.next();
            String symbol = toSymbol(JsonFields.text(product, "product_id"));
            if (symbol != null) {
                markets.put(symbol, product);
            }
        }
        return markets;
    }

    static Long parseTime(String iso) {
        if (iso == null || iso.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(iso).toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String toSymbol(String productId) {
        if (productId == null) {
            return null;
        }
        try {
            return Symbol.fromProductId(productId).toPairString();
        } catch (IllegalArgumentException e) {
            return productId;
        }
    }

    private static JsonNode firstConfiguration(JsonNode configuration) {
        if (configuration == null || !configuration.isObject()) {
            return null;
        }
        Iterator<JsonNode> values = configuration.elements();
        return values.hasNext() ? values.next() : null;
    }

    private static ObjectNode feeNode(BigDecimal cost) {
        ObjectNode fee = NODES.objectNode();
        fee.put(OrderColumns.FEE_COST, cost);
        // Coinbase gives no fee currency
        fee.putNull(OrderColumns.FEE_CURRENCY);
        return fee;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    private static String lower(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }
}
