package com.trade.coinbase.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trade.coinbase.core.Decimal;
import com.trade.coinbase.core.OrderColumns;
import com.trade.coinbase.core.OrderStatus;
import com.trade.coinbase.core.OrderType;
import com.trade.coinbase.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;

/**
 * Repairs Coinbase order and trade records into the canonical shape.
 * <p>
 * Field names are already canonical when records reach this class, only values are fixed.
 * Every pass is idempotent and works in place. A pass that meets a malformed field leaves
 * the record untouched for that pass and never fails the whole response.
 */
public class ResponseNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final String NATIVE_PENDING = "PENDING";
    static final String NATIVE_CANCEL_QUEUED = "CANCEL_QUEUED";

    /**
     * Applies the fee, type, status and amount passes to an order.
     */
    public ObjectNode normalizeOrder(ObjectNode order) {
        if (order == null) {
            return null;
        }
        backfillFeeCurrency(order);
        inferOrderType(order);
        remapOrderStatus(order);
        backfillOrderAmount(order);
        return order;
    }

    /**
     * Applies the fee, status and amount passes to every trade of the list.
     */
    public JsonNode normalizeTrades(JsonNode trades) {
        if (trades == null || !trades.isArray()) {
            return trades;
        }
        for (JsonNode trade : trades) {
            if (trade instanceof ObjectNode objectNode) {
                normalizeTrade(objectNode);
            }
        }
        return trades;
    }

    public ObjectNode normalizeTrade(ObjectNode trade) {
        if (trade == null) {
            return null;
        }
        backfillFeeCurrency(trade);
        forceTradeClosed(trade);
        backfillTradeAmount(trade);
        return trade;
    }

    /**
     * Coinbase does not report fee currencies: fees are always paid in the quote asset.
     */
    public void backfillFeeCurrency(ObjectNode orderOrTrade) {
        try {
            String symbol = JsonFields.text(orderOrTrade, OrderColumns.SYMBOL);
            if (symbol == null) {
                return;
            }
            JsonNode fee = orderOrTrade.get(OrderColumns.FEE);
            JsonNode fees = orderOrTrade.get(OrderColumns.FEES);
            boolean feeNeedsCurrency = fee instanceof ObjectNode && JsonFields.isBlankText(fee, OrderColumns.FEE_CURRENCY);
            boolean feesNeedCurrency = false;
            if (fees != null && fees.isArray()) {
                for (JsonNode entry : fees) {
                    if (entry instanceof ObjectNode && JsonFields.isBlankText(entry, OrderColumns.FEE_CURRENCY)) {
                        feesNeedCurrency = true;
                    }
                }
            }
            if (!feeNeedsCurrency && !feesNeedCurrency) {
                return;
            }
            String quote = Symbol.of(symbol).getQuote();
            if (feeNeedsCurrency) {
                ((ObjectNode) fee).put(OrderColumns.FEE_CURRENCY, quote);
            }
            if (feesNeedCurrency) {
                for (JsonNode entry : fees) {
                    if (entry instanceof ObjectNode entryNode && JsonFields.isBlankText(entry, OrderColumns.FEE_CURRENCY)) {
                        entryNode.put(OrderColumns.FEE_CURRENCY, quote);
                    }
                }
            }
        } catch (RuntimeException e) {
            logger.debug("Skipping fee currency backfill: {} ({})", e.getMessage(), e.getClass().getSimpleName());
        }
    }

    /**
     * Resolves a missing order type: stop price set means stop loss, no price means market, otherwise limit.
     */
    public void inferOrderType(ObjectNode order) {
        try {
            if (JsonFields.isSet(order, OrderColumns.TYPE)) {
                return;
            }
            OrderType inferred = inferType(
                    JsonFields.isSet(order, OrderColumns.STOP_PRICE),
                    JsonFields.isSet(order, OrderColumns.PRICE));
            order.put(OrderColumns.TYPE, inferred.getValue());
        } catch (RuntimeException e) {
            logger.debug("Skipping order type inference: {} ({})", e.getMessage(), e.getClass().getSimpleName());
        }
    }

    /**
     * Priority chain: a stop price always wins over a missing price.
     */
    public static OrderType inferType(boolean hasStopPrice, boolean hasPrice) {
        if (hasStopPrice) {
            return OrderType.STOP_LOSS;
        }
        if (!hasPrice) {
            return OrderType.MARKET;
        }
        return OrderType.LIMIT;
    }

    public void remapOrderStatus(ObjectNode order) {
        try {
            String status = JsonFields.text(order, OrderColumns.STATUS);
            if (NATIVE_PENDING.equals(status)) {
                order.put(OrderColumns.STATUS, OrderStatus.PENDING_CREATION.getValue());
            } else if (NATIVE_CANCEL_QUEUED.equals(status)) {
                order.put(OrderColumns.STATUS, OrderStatus.PENDING_CANCEL.getValue());
            }
        } catch (RuntimeException e) {
            logger.debug("Skipping order status remap: {} ({})", e.getMessage(), e.getClass().getSimpleName());
        }
    }

    /**
     * A reported trade is a completed fill whatever status the exchange attached to it.
     */
    public void forceTradeClosed(ObjectNode trade) {
        trade.put(OrderColumns.STATUS, OrderStatus.CLOSED.getValue());
    }

    /**
     * Sometimes amount is not set on orders: use the filled quantity.
     */
    public void backfillOrderAmount(ObjectNode order) {
        try {
            BigDecimal amount = JsonFields.decimal(order, OrderColumns.AMOUNT);
            BigDecimal filled = JsonFields.decimal(order, OrderColumns.FILLED);
            if (Decimal.isUnsetOrZero(amount) && !Decimal.isUnsetOrZero(filled)) {
                order.put(OrderColumns.AMOUNT, filled);
            }
        } catch (RuntimeException e) {
            logger.debug("Skipping order amount backfill: {} ({})", e.getMessage(), e.getClass().getSimpleName());
        }
    }

    /**
     * Trades sized in quote currency only carry a cost: convert it to a base asset amount.
     */
    public void backfillTradeAmount(ObjectNode trade) {
        try {
            if (JsonFields.isSet(trade, OrderColumns.AMOUNT)) {
                return;
            }
            BigDecimal cost = JsonFields.decimal(trade, OrderColumns.COST);
            BigDecimal price = JsonFields.decimal(trade, OrderColumns.PRICE);
            if (Decimal.isUnsetOrZero(cost) || Decimal.isUnsetOrZero(price)) {
                return;
            }
            trade.put(OrderColumns.AMOUNT, Decimal.divideExact(cost, price));
        } catch (RuntimeException e) {
            logger.debug("Skipping trade amount backfill: {} ({})", e.getMessage(), e.getClass().getSimpleName());
        }
    }
}
