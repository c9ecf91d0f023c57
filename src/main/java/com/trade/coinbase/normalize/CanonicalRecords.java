package com.trade.coinbase.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.trade.coinbase.core.Balance;
import com.trade.coinbase.core.Candle;
import com.trade.coinbase.core.Decimal;
import com.trade.coinbase.core.Fee;
import com.trade.coinbase.core.Order;
import com.trade.coinbase.core.OrderColumns;
import com.trade.coinbase.core.OrderStatus;
import com.trade.coinbase.core.OrderType;
import com.trade.coinbase.core.Side;
import com.trade.coinbase.core.Ticker;
import com.trade.coinbase.core.Trade;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds typed canonical results from normalized records.
 */
public final class CanonicalRecords {

    private CanonicalRecords() {}

    public static Order toOrder(JsonNode node) {
        OrderType type = OrderType.fromValue(JsonFields.text(node, OrderColumns.TYPE));
        if (type == null) {
            type = ResponseNormalizer.inferType(
                    JsonFields.isSet(node, OrderColumns.STOP_PRICE),
                    JsonFields.isSet(node, OrderColumns.PRICE));
        }
        return Order.builder()
                .id(JsonFields.text(node, OrderColumns.ID))
                .clientOrderId(JsonFields.text(node, OrderColumns.CLIENT_ORDER_ID))
                .timestamp(JsonFields.longValue(node, OrderColumns.TIMESTAMP))
                .symbol(JsonFields.text(node, OrderColumns.SYMBOL))
                .side(Side.fromValue(JsonFields.text(node, OrderColumns.SIDE)))
                .type(type)
                .status(OrderStatus.fromValue(JsonFields.text(node, OrderColumns.STATUS)))
                .price(JsonFields.decimal(node, OrderColumns.PRICE))
                .stopPrice(JsonFields.decimal(node, OrderColumns.STOP_PRICE))
                .amount(JsonFields.decimal(node, OrderColumns.AMOUNT))
                .filled(JsonFields.decimal(node, OrderColumns.FILLED))
                .remaining(JsonFields.decimal(node, OrderColumns.REMAINING))
                .cost(JsonFields.decimal(node, OrderColumns.COST))
                .fees(toFees(node))
                .build();
    }

    public static List<Order> toOrders(JsonNode nodes) {
        List<Order> orders = new ArrayList<>();
        if (nodes == null || !nodes.isArray()) {
            return orders;
        }
        for (JsonNode node : nodes) {
            orders.add(toOrder(node));
        }
        return orders;
    }

    public static Trade toTrade(JsonNode node) {
        return new Trade(
                JsonFields.text(node, OrderColumns.ID),
                JsonFields.text(node, OrderColumns.ORDER),
                JsonFields.longValue(node, OrderColumns.TIMESTAMP),
                JsonFields.text(node, OrderColumns.SYMBOL),
                Side.fromValue(JsonFields.text(node, OrderColumns.SIDE)),
                OrderType.fromValue(JsonFields.text(node, OrderColumns.TYPE)),
                JsonFields.decimal(node, OrderColumns.PRICE),
                JsonFields.decimal(node, OrderColumns.AMOUNT),
                JsonFields.decimal(node, OrderColumns.COST),
                toFees(node)
        );
    }

    public static List<Trade> toTrades(JsonNode nodes) {
        List<Trade> trades = new ArrayList<>();
        if (nodes == null || !nodes.isArray()) {
            return trades;
        }
        for (JsonNode node : nodes) {
            trades.add(toTrade(node));
        }
        return trades;
    }

    /**
     * Uses the fee list when present, the single fee otherwise.
     */
    public static List<Fee> toFees(JsonNode node) {
        List<Fee> fees = new ArrayList<>();
        JsonNode feeList = node == null ? null : node.get(OrderColumns.FEES);
        if (feeList != null && feeList.isArray() && !feeList.isEmpty()) {
            for (JsonNode entry : feeList) {
                fees.add(toFee(entry));
            }
            return fees;
        }
        JsonNode fee = node == null ? null : node.get(OrderColumns.FEE);
        if (fee != null && fee.isObject()) {
            fees.add(toFee(fee));
        }
        return fees;
    }

    private static Fee toFee(JsonNode entry) {
        return new Fee(JsonFields.decimal(entry, OrderColumns.FEE_COST),
                JsonFields.text(entry, OrderColumns.FEE_CURRENCY));
    }

    /**
     * Rows are [timestamp, open, high, low, close, volume]; malformed rows are skipped.
     */
    public static List<Candle> toCandles(JsonNode rows) {
        List<Candle> candles = new ArrayList<>();
        if (rows == null || !rows.isArray()) {
            return candles;
        }
        for (JsonNode row : rows) {
            if (!row.isArray() || row.size() < 6 || !row.get(0).canConvertToLong()) {
                continue;
            }
            BigDecimal open = decimalAt(row, 1);
            BigDecimal high = decimalAt(row, 2);
            BigDecimal low = decimalAt(row, 3);
            BigDecimal close = decimalAt(row, 4);
            BigDecimal volume = decimalAt(row, 5);
            if (open == null || high == null || low == null || close == null) {
                continue;
            }
            candles.add(new Candle(Instant.ofEpochMilli(row.get(0).asLong()), open, high, low, close,
                    volume == null ? BigDecimal.ZERO : volume));
        }
        return candles;
    }

    public static Ticker toTicker(JsonNode node) {
        return new Ticker(
                JsonFields.text(node, OrderColumns.SYMBOL),
                JsonFields.decimal(node, "bid"),
                JsonFields.decimal(node, "ask"),
                JsonFields.decimal(node, "last"),
                JsonFields.decimal(node, "baseVolume"),
                JsonFields.decimal(node, "high"),
                JsonFields.decimal(node, "low"),
                JsonFields.longValue(node, OrderColumns.TIMESTAMP)
        );
    }

    /**
     * Tickers keyed by symbol: {"BTC/USD": {...}, ...}.
     */
    public static Map<String, Ticker> toTickers(JsonNode node) {
        Map<String, Ticker> tickers = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return tickers;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isObject()) {
                tickers.put(entry.getKey(), toTicker(entry.getValue()));
            }
        }
        return tickers;
    }

    /**
     * Balance response shape: {"BTC": {"free": .., "used": .., "total": ..}, ...}.
     */
    public static Map<String, Balance> toBalances(JsonNode node) {
        Map<String, Balance> balances = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return balances;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (!value.isObject()) {
                continue;
            }
            balances.put(entry.getKey(), new Balance(entry.getKey(),
                    JsonFields.decimal(value, "free"),
                    JsonFields.decimal(value, "used"),
                    JsonFields.decimal(value, "total")));
        }
        return balances;
    }

    private static BigDecimal decimalAt(JsonNode row, int index) {
        JsonNode value = row.get(index);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        return Decimal.parseOrNull(value.asText());
    }
}
