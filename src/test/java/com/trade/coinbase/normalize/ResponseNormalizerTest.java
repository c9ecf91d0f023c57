package com.trade.coinbase.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trade.coinbase.core.Fee;
import com.trade.coinbase.core.Order;
import com.trade.coinbase.core.OrderColumns;
import com.trade.coinbase.core.OrderStatus;
import com.trade.coinbase.core.OrderType;
import com.trade.coinbase.core.Trade;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ResponseNormalizer normalizer = new ResponseNormalizer();

    @Test
    void missingTypeWithStopPriceIsStopLoss() {
        ObjectNode order = order("AAVE/USD");
        order.putNull(OrderColumns.TYPE);
        order.put(OrderColumns.STOP_PRICE, 100);
        order.put(OrderColumns.PRICE, 110.92);

        normalizer.normalizeOrder(order);

        assertEquals(OrderType.STOP_LOSS.getValue(), order.get(OrderColumns.TYPE).asText());
    }

    @Test
    void missingTypeWithoutPriceIsMarket() {
        ObjectNode order = order("AAVE/USD");
        order.putNull(OrderColumns.TYPE);
        order.putNull(OrderColumns.STOP_PRICE);
        order.putNull(OrderColumns.PRICE);

        normalizer.normalizeOrder(order);

        assertEquals(OrderType.MARKET.getValue(), order.get(OrderColumns.TYPE).asText());
    }

    @Test
    void missingTypeWithPriceIsLimit() {
        ObjectNode order = order("AAVE/USD");
        order.put(OrderColumns.PRICE, "110.92");

        normalizer.normalizeOrder(order);

        assertEquals(OrderType.LIMIT.getValue(), order.get(OrderColumns.TYPE).asText());
    }

    @Test
    void knownTypeIsKept() {
        ObjectNode order = order("AAVE/USD");
        order.put(OrderColumns.TYPE, "limit");
        order.put(OrderColumns.STOP_PRICE, 100);

        normalizer.normalizeOrder(order);

        assertEquals("limit", order.get(OrderColumns.TYPE).asText());
    }

    @Test
    void remapsNativePendingStatuses() {
        ObjectNode pending = order("AAVE/USD");
        pending.put(OrderColumns.STATUS, "PENDING");
        ObjectNode cancelQueued = order("AAVE/USD");
        cancelQueued.put(OrderColumns.STATUS, "CANCEL_QUEUED");
        ObjectNode open = order("AAVE/USD");
        open.put(OrderColumns.STATUS, "open");

        normalizer.normalizeOrder(pending);
        normalizer.normalizeOrder(cancelQueued);
        normalizer.normalizeOrder(open);

        assertEquals(OrderStatus.PENDING_CREATION.getValue(), pending.get(OrderColumns.STATUS).asText());
        assertEquals(OrderStatus.PENDING_CANCEL.getValue(), cancelQueued.get(OrderColumns.STATUS).asText());
        assertEquals("open", open.get(OrderColumns.STATUS).asText());
    }

    @Test
    void amountFallsBackToFilled() {
        ObjectNode zeroAmount = order("AAVE/USD");
        zeroAmount.put(OrderColumns.AMOUNT, 0);
        zeroAmount.put(OrderColumns.FILLED, "6.798");
        ObjectNode nothingFilled = order("AAVE/USD");
        nothingFilled.putNull(OrderColumns.AMOUNT);
        nothingFilled.put(OrderColumns.FILLED, 0);

        normalizer.normalizeOrder(zeroAmount);
        normalizer.normalizeOrder(nothingFilled);

        assertEquals(0, new BigDecimal("6.798").compareTo(JsonFields.decimal(zeroAmount, OrderColumns.AMOUNT)));
        assertTrue(nothingFilled.get(OrderColumns.AMOUNT).isNull());
    }

    @Test
    void backfillsFeeCurrencyWithQuote() {
        ObjectNode order = order("AAVE/USD");
        ObjectNode fee = order.putObject(OrderColumns.FEE);
        fee.put(OrderColumns.FEE_COST, "0.5");
        fee.putNull(OrderColumns.FEE_CURRENCY);
        ArrayNode fees = order.putArray(OrderColumns.FEES);
        fees.addObject().put(OrderColumns.FEE_COST, "0.5").put(OrderColumns.FEE_CURRENCY, "");
        fees.addObject().put(OrderColumns.FEE_COST, "0.1");
        fees.addObject().put(OrderColumns.FEE_COST, "0.2").put(OrderColumns.FEE_CURRENCY, "AAVE");

        normalizer.normalizeOrder(order);

        assertEquals("USD", order.get(OrderColumns.FEE).get(OrderColumns.FEE_CURRENCY).asText());
        assertEquals("USD", fees.get(0).get(OrderColumns.FEE_CURRENCY).asText());
        assertEquals("USD", fees.get(1).get(OrderColumns.FEE_CURRENCY).asText());
        assertEquals("AAVE", fees.get(2).get(OrderColumns.FEE_CURRENCY).asText());
    }

    @Test
    void feeBackfillSkipsUnparsableSymbol() {
        ObjectNode order = order("not a symbol");
        order.putObject(OrderColumns.FEE).put(OrderColumns.FEE_COST, "0.5");
        order.put(OrderColumns.PRICE, "1");

        normalizer.normalizeOrder(order);

        assertFalse(order.get(OrderColumns.FEE).has(OrderColumns.FEE_CURRENCY));
        // the other passes still ran
        assertEquals("limit", order.get(OrderColumns.TYPE).asText());
    }

    @Test
    void tradeAmountDerivedFromQuoteCost() {
        ObjectNode trade = order("AAVE/USD");
        trade.putNull(OrderColumns.AMOUNT);
        trade.put(OrderColumns.COST, "757.05");
        trade.put(OrderColumns.PRICE, "111.34");
        trade.put(OrderColumns.STATUS, "open");

        normalizer.normalizeTrade(trade);

        BigDecimal amount = JsonFields.decimal(trade, OrderColumns.AMOUNT);
        assertEquals(0, new BigDecimal("6.79944315").compareTo(amount.setScale(8, RoundingMode.HALF_UP)));
        assertEquals(OrderStatus.CLOSED.getValue(), trade.get(OrderColumns.STATUS).asText());
    }

    @Test
    void smallQuoteSizedFillKeepsSignificantDigits() {
        ObjectNode trade = order("BTC/USD");
        trade.putNull(OrderColumns.AMOUNT);
        trade.put(OrderColumns.COST, new BigDecimal("0.01"));
        trade.put(OrderColumns.PRICE, new BigDecimal("95000"));

        normalizer.normalizeTrade(trade);

        BigDecimal amount = JsonFields.decimal(trade, OrderColumns.AMOUNT);
        BigDecimal expected = new BigDecimal("0.01").divide(new BigDecimal("95000"), MathContext.DECIMAL128);
        BigDecimal relativeError = amount.subtract(expected).abs().divide(expected, MathContext.DECIMAL64);
        assertTrue(relativeError.compareTo(new BigDecimal("1E-12")) < 0, "amount " + amount);
        assertEquals(0, amount.multiply(new BigDecimal("95000")).round(MathContext.DECIMAL64)
                .compareTo(new BigDecimal("0.01")));
    }

    @Test
    void tradeAmountNotDerivedFromZeroPrice() {
        ObjectNode trade = order("AAVE/USD");
        trade.put(OrderColumns.COST, "757.05");
        trade.put(OrderColumns.PRICE, "0");

        normalizer.normalizeTrade(trade);

        assertFalse(JsonFields.isSet(trade, OrderColumns.AMOUNT));
    }

    @Test
    void malformedFieldsNeverFailNormalization() {
        ObjectNode trade = order("AAVE/USD");
        trade.put(OrderColumns.COST, "not a number");
        trade.put(OrderColumns.PRICE, "111.34");
        trade.put(OrderColumns.FEE, "weird");
        trade.putArray(OrderColumns.FEES).add("weird");

        normalizer.normalizeTrade(trade);

        assertFalse(JsonFields.isSet(trade, OrderColumns.AMOUNT));
        assertEquals(OrderStatus.CLOSED.getValue(), trade.get(OrderColumns.STATUS).asText());
    }

    @Test
    void normalizationIsIdempotent() {
        ObjectNode order = order("AAVE/USD");
        order.putNull(OrderColumns.TYPE);
        order.put(OrderColumns.PRICE, "110.92");
        order.put(OrderColumns.STATUS, "PENDING");
        order.putNull(OrderColumns.AMOUNT);
        order.put(OrderColumns.FILLED, "1.5");
        order.putObject(OrderColumns.FEE).put(OrderColumns.FEE_COST, "0.1").putNull(OrderColumns.FEE_CURRENCY);

        normalizer.normalizeOrder(order);
        JsonNode once = order.deepCopy();
        normalizer.normalizeOrder(order);

        assertEquals(once, order);
    }

    @Test
    void normalizedTradesBecomeClosedTypedTrades() {
        ArrayNode trades = mapper.createArrayNode();
        ObjectNode trade = trades.addObject();
        trade.put(OrderColumns.ID, "t-1");
        trade.put(OrderColumns.ORDER, "o-1");
        trade.put(OrderColumns.SYMBOL, "AAVE/USD");
        trade.put(OrderColumns.SIDE, "buy");
        trade.put(OrderColumns.PRICE, "111.34");
        trade.put(OrderColumns.COST, "757.05");
        trade.putArray(OrderColumns.FEES).addObject().put(OrderColumns.FEE_COST, "4.5423").putNull(OrderColumns.FEE_CURRENCY);

        List<Trade> typed = CanonicalRecords.toTrades(normalizer.normalizeTrades(trades));

        assertEquals(1, typed.size());
        assertEquals(OrderStatus.CLOSED, typed.get(0).getStatus());
        assertEquals("o-1", typed.get(0).getOrderId());
        assertEquals(new Fee(new BigDecimal("4.5423"), "USD"), typed.get(0).getFees().get(0));
        assertEquals(0, new BigDecimal("6.79944315").compareTo(typed.get(0).getAmount().setScale(8, RoundingMode.HALF_UP)));
    }

    @Test
    void typedOrderAlwaysHasType() {
        ObjectNode order = order("AAVE/USD");
        order.put(OrderColumns.TYPE, "UNKNOWN_ORDER_TYPE");
        order.put(OrderColumns.STATUS, "open");

        Order typed = CanonicalRecords.toOrder(order);

        assertEquals(OrderType.MARKET, typed.getType());
        assertEquals(OrderStatus.OPEN, typed.getStatus());
        assertNull(typed.getPrice());
    }

    private ObjectNode order(String symbol) {
        ObjectNode order = mapper.createObjectNode();
        order.put(OrderColumns.ID, "d7471b4e-960e-4c92-bdbf-755cb92e176b");
        order.put(OrderColumns.SYMBOL, symbol);
        return order;
    }
}
