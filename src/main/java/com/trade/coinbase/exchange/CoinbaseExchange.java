package com.trade.coinbase.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trade.coinbase.core.*;
import com.trade.coinbase.error.ErrorCategory;
import com.trade.coinbase.error.ErrorClassifier;
import com.trade.coinbase.market.PageWindow;
import com.trade.coinbase.market.PaginationWindower;
import com.trade.coinbase.normalize.CanonicalRecords;
import com.trade.coinbase.normalize.JsonFields;
import com.trade.coinbase.normalize.ResponseNormalizer;
import com.trade.coinbase.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coinbase implementation of {@link Exchange}.
 * <p>
 * Every remote call goes through the {@link RetryPolicy}, order and trade responses through the
 * {@link ResponseNormalizer}. Instances hold no per call state and can serve concurrent calls.
 */
public class CoinbaseExchange implements Exchange {

    private static final Logger logger = LoggerFactory.getLogger(CoinbaseExchange.class);

    public static final String NAME = "coinbase";
    public static final String DEFAULT_ACCOUNT_ID = "default_account_id";
    public static final int DEFAULT_RECENT_TRADES_LIMIT = 50;
    public static final boolean REQUIRES_AUTHENTICATION = true;
    public static final boolean IS_SKIPPING_EMPTY_CANDLES_IN_OHLCV_FETCH = true;

    private static final String LIMIT_ONLY = "limit_only";
    private static final String CANCEL_ONLY = "cancel_only";

    private final Transport transport;
    private final RetryPolicy retryPolicy;
    private final ResponseNormalizer normalizer;
    private final PaginationWindower windower;
    private final ErrorClassifier errorClassifier;

    public CoinbaseExchange(Transport transport) {
        this(transport, new RetryPolicy(NAME), new ResponseNormalizer(),
                new PaginationWindower(transport::serverTimeMillis), ErrorClassifier.defaults());
    }

    public CoinbaseExchange(Transport transport,
                            RetryPolicy retryPolicy,
                            ResponseNormalizer normalizer,
                            PaginationWindower windower,
                            ErrorClassifier errorClassifier) {
        this.transport = transport;
        this.retryPolicy = retryPolicy;
        this.normalizer = normalizer;
        this.windower = windower;
        this.errorClassifier = errorClassifier;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void loadMarkets(boolean reload) throws ExchangeException {
        retryPolicy.call("loadMarkets", Map.of("reload", reload), () -> {
            transport.loadMarkets(reload);
            return null;
        });
    }

    @Override
    public String getAccountId() throws ExchangeException {
        try {
            // the v2 user endpoint may get deprecated
            JsonNode user = transport.request(TransportMethod.FETCH_USER, Map.of());
            String accountId = JsonFields.text(user.path("data"), "id");
            if (accountId == null) {
                logger.warn("No account id in {} user response, using {} instead", NAME, DEFAULT_ACCOUNT_ID);
                return DEFAULT_ACCOUNT_ID;
            }
            return accountId;
        } catch (ExchangeException e) {
            if (!e.isRemote()) {
                throw e;
            }
            logger.warn("Error when fetching {} account id: {} ({}). This is not normal, endpoint might be "
                            + "deprecated, see https://docs.cloud.coinbase.com/sign-in-with-coinbase/docs/api-users. "
                            + "Using {} instead", NAME, e.getMessage(), e.getErrorCode(), DEFAULT_ACCOUNT_ID, e);
            return DEFAULT_ACCOUNT_ID;
        }
    }

    @Override
    public List<Candle> getSymbolPrices(String symbol, TimeFrame timeFrame, Integer limit, Long since)
            throws ExchangeException {
        PageWindow window = windower.window(timeFrame, limit, since);
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.SYMBOL, symbol);
        args.put(TransportArgs.TIME_FRAME, timeFrame);
        args.put(TransportArgs.SINCE, window.getSince());
        args.put(TransportArgs.LIMIT, window.getLimit());
        JsonNode rows = retryPolicy.call("getSymbolPrices", args,
                () -> transport.request(TransportMethod.FETCH_OHLCV, args));
        return CanonicalRecords.toCandles(rows);
    }

    @Override
    public List<Trade> getRecentTrades(String symbol, int limit) throws ExchangeException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.SYMBOL, symbol);
        args.put(TransportArgs.LIMIT, limit);
        JsonNode trades = retryPolicy.call("getRecentTrades", args,
                () -> transport.request(TransportMethod.FETCH_TRADES, args));
        return CanonicalRecords.toTrades(normalizer.normalizeTrades(trades));
    }

    @Override
    public Ticker getPriceTicker(String symbol) throws ExchangeException {
        Map<String, Object> args = Map.of(TransportArgs.SYMBOL, symbol);
        JsonNode ticker = retryPolicy.call("getPriceTicker", args,
                () -> transport.request(TransportMethod.FETCH_TICKER, args));
        return CanonicalRecords.toTicker(ticker);
    }

    @Override
    public Map<String, Ticker> getAllCurrenciesPriceTicker() throws ExchangeException {
        JsonNode tickers = retryPolicy.call("getAllCurrenciesPriceTicker", Map.of(),
                () -> transport.request(TransportMethod.FETCH_TICKERS, Map.of()));
        return CanonicalRecords.toTickers(tickers);
    }

    /**
     * Market buy quantities are converted with the price on the transport side: the current price is mandatory.
     */
    @Override
    public Order createOrder(OrderRequest request) throws ExchangeException {
        if (request.getOrderType() == TraderOrderType.BUY_MARKET && !Decimal.isPositive(request.getCurrentPrice())) {
            throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                    "current_price is required for " + request.getOrderType() + " orders");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.SYMBOL, request.getSymbol());
        args.put(TransportArgs.TYPE, request.getOrderType().getOrderType());
        args.put(TransportArgs.SIDE, request.getSide());
        args.put(TransportArgs.AMOUNT, request.getQuantity());
        args.put(TransportArgs.PRICE, request.getPrice());
        args.put(TransportArgs.STOP_PRICE, request.getStopPrice());
        args.put(TransportArgs.CURRENT_PRICE, request.getCurrentPrice());
        args.put(TransportArgs.REDUCE_ONLY, request.isReduceOnly());
        args.put(TransportArgs.PARAMS, request.getParams());
        JsonNode created = retryPolicy.call("createOrder", args,
                () -> transport.request(TransportMethod.CREATE_ORDER, args));
        return CanonicalRecords.toOrder(normalizeOrderNode(created));
    }

    @Override
    public OrderStatus cancelOrder(String exchangeOrderId, String symbol, TraderOrderType orderType)
            throws ExchangeException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.ORDER_ID, exchangeOrderId);
        args.put(TransportArgs.SYMBOL, symbol);
        args.put(TransportArgs.TYPE, orderType);
        JsonNode cancelled = retryPolicy.call("cancelOrder", args,
                () -> transport.request(TransportMethod.CANCEL_ORDER, args));
        ObjectNode order = normalizeOrderNode(cancelled);
        return OrderStatus.fromValue(JsonFields.text(order, OrderColumns.STATUS));
    }

    /**
     * Requests v3 balances unless the caller chose a mode: v2 only reports free amounts.
     */
    @Override
    public Map<String, Balance> getBalance(Map<String, Object> params) throws ExchangeException {
        Map<String, Object> args = params == null ? new LinkedHashMap<>() : new LinkedHashMap<>(params);
        args.putIfAbsent(TransportArgs.V3, Boolean.TRUE);
        JsonNode balances = retryPolicy.call("getBalance", args,
                () -> transport.request(TransportMethod.FETCH_BALANCE, args));
        return CanonicalRecords.toBalances(balances);
    }

    @Override
    public List<Order> getOpenOrders(String symbol, Long since, Integer limit) throws ExchangeException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.SYMBOL, symbol);
        args.put(TransportArgs.SINCE, since);
        args.put(TransportArgs.LIMIT, limit);
        JsonNode orders = retryPolicy.call("getOpenOrders", args,
                () -> transport.request(TransportMethod.FETCH_OPEN_ORDERS, args));
        if (orders != null && orders.isArray()) {
            for (JsonNode order : orders) {
                if (order instanceof ObjectNode objectNode) {
                    normalizer.normalizeOrder(objectNode);
                }
            }
        }
        return CanonicalRecords.toOrders(orders);
    }

    @Override
    public Order getOrder(String exchangeOrderId, String symbol) throws ExchangeException {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(TransportArgs.ORDER_ID, exchangeOrderId);
        args.put(TransportArgs.SYMBOL, symbol);
        JsonNode order = retryPolicy.call("getOrder", args,
                () -> transport.request(TransportMethod.FETCH_ORDER, args));
        return CanonicalRecords.toOrder(normalizeOrderNode(order));
    }

    @Override
    public boolean isMarketOpenForOrderType(String symbol, TraderOrderType orderType) {
        JsonNode marketInfo = transport.marketInfo(symbol);
        OrderType tradeOrderType = orderType.getOrderType();
        String flag;
        if (tradeOrderType == OrderType.MARKET) {
            flag = LIMIT_ONLY;
        } else if (tradeOrderType == OrderType.LIMIT) {
            flag = CANCEL_ONLY;
        } else {
            return true;
        }
        JsonNode value = marketInfo == null ? null : marketInfo.get(flag);
        if (value == null || !value.isBoolean()) {
            logger.warn("Can't check {} market opens status for order type: missing {} in market status info. "
                    + "{} API probably changed. Considering market as open. market_status_info: {}",
                    NAME, flag, NAME, marketInfo);
            return true;
        }
        return !value.asBoolean();
    }

    @Override
    public ErrorCategory classifyError(Throwable error) {
        return errorClassifier.classify(error);
    }

    private ObjectNode normalizeOrderNode(JsonNode order) throws ExchangeException {
        if (!(order instanceof ObjectNode objectNode)) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Unexpected " + NAME + " order response: " + order);
        }
        return normalizer.normalizeOrder(objectNode);
    }
}
