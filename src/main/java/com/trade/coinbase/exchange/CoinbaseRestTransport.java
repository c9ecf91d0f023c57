package com.trade.coinbase.exchange;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.trade.coinbase.core.AdapterConfig;
import com.trade.coinbase.core.OrderType;
import com.trade.coinbase.core.Side;
import com.trade.coinbase.core.Symbol;
import com.trade.coinbase.core.TimeFrame;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.net.SocketTimeoutException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Coinbase Advanced Trade REST transport.
 * <p>
 * Market data goes through the public market endpoints, account and order calls are signed
 * by {@link CoinbaseRequestSigner}. HTTP failures are mapped to {@link ExchangeException} codes,
 * a 429 keeps the status code in its message so the retry policy can recognize it.
 */
public class CoinbaseRestTransport implements Transport {

    private static final Logger logger = LoggerFactory.getLogger(CoinbaseRestTransport.class);

    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    static final String MARKET_PRODUCTS_PATH = "/api/v3/brokerage/market/products";
    static final String SERVER_TIME_PATH = "/api/v3/brokerage/time";
    static final String ORDERS_PATH = "/api/v3/brokerage/orders";
    static final String BATCH_CANCEL_PATH = "/api/v3/brokerage/orders/batch_cancel";
    static final String HISTORICAL_ORDERS_PATH = "/api/v3/brokerage/orders/historical";
    static final String V3_ACCOUNTS_PATH = "/api/v3/brokerage/accounts";
    static final String V2_ACCOUNTS_PATH = "/v2/accounts";
    static final String V2_USER_PATH = "/v2/user";

    private static final int ACCOUNTS_PAGE_SIZE = 250;
    private static final int MAX_ACCOUNT_PAGES = 20;

    private final String restBaseUrl;
    private final String host;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final CoinbaseRequestSigner signer;
    private final CoinbaseResponseParser parser;
    private final Clock clock;

    private volatile Map<String, JsonNode> markets = Collections.emptyMap();
    private volatile long serverTimeOffsetMillis;

    public CoinbaseRestTransport(AdapterConfig config, Credentials credentials) {
        this(config.getRestBaseUrl(), new OkHttpClient.Builder()
                        .connectTimeout(config.getHttpTimeoutSeconds(), TimeUnit.SECONDS)
                        .readTimeout(config.getHttpTimeoutSeconds(), TimeUnit.SECONDS)
                        .writeTimeout(config.getHttpTimeoutSeconds(), TimeUnit.SECONDS)
                        .build(),
                credentials, Clock.systemUTC());
    }

    CoinbaseRestTransport(String restBaseUrl, OkHttpClient httpClient, Credentials credentials, Clock clock) {
        this.restBaseUrl = restBaseUrl.endsWith("/") ? restBaseUrl.substring(0, restBaseUrl.length() - 1) : restBaseUrl;
        HttpUrl parsed = HttpUrl.parse(this.restBaseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid coinbase REST base url: " + restBaseUrl);
        }
        this.host = parsed.host();
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        this.signer = new CoinbaseRequestSigner(credentials);
        this.parser = new CoinbaseResponseParser();
        this.clock = clock;
    }

    @Override
    public void loadMarkets(boolean reload) throws ExchangeException {
        if (!reload && !markets.isEmpty()) {
            return;
        }
        JsonNode root = execute("GET", MARKET_PRODUCTS_PATH, null, null, false);
        markets = Collections.unmodifiableMap(parser.parseMarkets(root.path("products")));
        logger.info("Loaded {} coinbase markets", markets.size());
        syncServerTime();
    }

    @Override
    public JsonNode marketInfo(String symbol) {
        JsonNode market;
        try {
            market = markets.get(Symbol.of(symbol).toPairString());
        } catch (IllegalArgumentException e) {
            logger.debug("No coinbase market for symbol {}: {}", symbol, e.getMessage());
            return MissingNode.getInstance();
        }
        return market == null ? MissingNode.getInstance() : market;
    }

    @Override
    public long serverTimeMillis() {
        return clock.millis() + serverTimeOffsetMillis;
    }

    @Override
    public JsonNode request(TransportMethod method, Map<String, Object> args) throws ExchangeException {
        return switch (method) {
            case FETCH_USER -> execute("GET", V2_USER_PATH, null, null, true);
            case FETCH_OHLCV -> fetchCandles(args);
            case FETCH_TRADES -> {
                JsonNode root = execute("GET", productPath(args) + "/ticker",
                        Map.of("limit", String.valueOf(args.get(TransportArgs.LIMIT))), null, false);
                yield parser.parseTrades(root.path("trades"));
            }
            case FETCH_TICKER -> {
                String symbol = (String) args.get(TransportArgs.SYMBOL);
                JsonNode root = execute("GET", productPath(args) + "/ticker", Map.of("limit", "1"), null, false);
                yield parser.parseTicker(parseSymbol(symbol).toPairString(), root);
            }
            case FETCH_TICKERS -> parser.parseProductTickers(
                    execute("GET", MARKET_PRODUCTS_PATH, null, null, false).path("products"));
            case CREATE_ORDER -> {
                ObjectNode body = buildOrderBody(args);
                yield parser.parseCreatedOrder(execute("POST", ORDERS_PATH, null, body, true), body);
            }
            case CANCEL_ORDER -> {
                String orderId = (String) args.get(TransportArgs.ORDER_ID);
                ObjectNode body = objectMapper.createObjectNode();
                body.putArray("order_ids").add(orderId);
                yield parser.parseCancelledOrder(execute("POST", BATCH_CANCEL_PATH, null, body, true), orderId);
            }
            case FETCH_BALANCE -> Boolean.FALSE.equals(args.get(TransportArgs.V3))
                    ? parser.parseV2Balances(execute("GET", V2_ACCOUNTS_PATH, Map.of("limit", "100"), null, true).path("data"))
                    : parser.parseV3Balances(fetchV3Accounts());
            case FETCH_OPEN_ORDERS -> parser.parseOrders(fetchOpenOrders(args).path("orders"));
            case FETCH_ORDER -> {
                String orderId = (String) args.get(TransportArgs.ORDER_ID);
                JsonNode root = execute("GET", HISTORICAL_ORDERS_PATH + "/" + urlEncode(orderId), null, null, true);
                if (!root.path("order").isObject()) {
                    throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                            "coinbase returned no order for " + orderId + ": " + root);
                }
                yield parser.parseOrder(root.path("order"));
            }
        };
    }

    private JsonNode fetchCandles(Map<String, Object> args) throws ExchangeException {
        TimeFrame timeFrame = (TimeFrame) args.get(TransportArgs.TIME_FRAME);
        long since = ((Number) args.get(TransportArgs.SINCE)).longValue();
        int limit = ((Number) args.get(TransportArgs.LIMIT)).intValue();
        long start = since / 1000L;
        long end = start + timeFrame.toMillis() / 1000L * limit;
        Map<String, String> query = new LinkedHashMap<>();
        query.put("start", String.valueOf(start));
        query.put("end", String.valueOf(end));
        query.put("granularity", timeFrame.getGranularity());
        query.put("limit", String.valueOf(limit));
        JsonNode root = execute("GET", productPath(args) + "/candles", query, null, false);
        return parser.parseCandles(root.path("candles"));
    }

    private JsonNode fetchOpenOrders(Map<String, Object> args) throws ExchangeException {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("order_status", "OPEN");
        Object symbol = args.get(TransportArgs.SYMBOL);
        if (symbol != null) {
            query.put("product_ids", parseSymbol(symbol).toProductId());
        }
        Object since = args.get(TransportArgs.SINCE);
        if (since != null) {
            query.put("start_date", Instant.ofEpochMilli(((Number) since).longValue()).toString());
        }
        Object limit = args.get(TransportArgs.LIMIT);
        if (limit != null) {
            query.put("limit", String.valueOf(limit));
        }
        return execute("GET", HISTORICAL_ORDERS_PATH + "/batch", query, null, true);
    }

    private ArrayNode fetchV3Accounts() throws ExchangeException {
        ArrayNode accounts = objectMapper.createArrayNode();
        String cursor = null;
        for (int page = 0; page < MAX_ACCOUNT_PAGES; page++) {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("limit", String.valueOf(ACCOUNTS_PAGE_SIZE));
            if (cursor != null) {
                query.put("cursor", cursor);
            }
            JsonNode root = execute("GET", V3_ACCOUNTS_PATH, query, null, true);
            JsonNode pageAccounts = root.path("accounts");
            if (pageAccounts.isArray()) {
                accounts.addAll((ArrayNode) pageAccounts);
            }
            cursor = root.path("cursor").asText("");
            if (!root.path("has_next").asBoolean(false) || cursor.isEmpty()) {
                return accounts;
            }
        }
        logger.warn("Stopped reading coinbase accounts after {} pages", MAX_ACCOUNT_PAGES);
        return accounts;
    }

    /**
     * Builds the create order payload. Market buys are sized in quote currency: amount * current price.
     */
    ObjectNode buildOrderBody(Map<String, Object> args) throws ExchangeException {
        OrderType type = (OrderType) args.get(TransportArgs.TYPE);
        Side side = (Side) args.get(TransportArgs.SIDE);
        BigDecimal amount = (BigDecimal) args.get(TransportArgs.AMOUNT);
        BigDecimal price = (BigDecimal) args.get(TransportArgs.PRICE);
        BigDecimal stopPrice = (BigDecimal) args.get(TransportArgs.STOP_PRICE);
        BigDecimal currentPrice = (BigDecimal) args.get(TransportArgs.CURRENT_PRICE);

        ObjectNode body = objectMapper.createObjectNode();
        body.put("client_order_id", clientOrderId(args));
        body.put("product_id", parseSymbol(args.get(TransportArgs.SYMBOL)).toProductId());
        body.put("side", side.name());
        ObjectNode configuration = body.putObject("order_configuration");
        switch (type) {
            case MARKET -> {
                ObjectNode market = configuration.putObject("market_market_ioc");
                if (side == Side.BUY) {
                    if (currentPrice == null) {
                        throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                                "current price is required to size coinbase market buy orders");
                    }
                    market.put("quote_size", amount.multiply(currentPrice).stripTrailingZeros().toPlainString());
                } else {
                    market.put("base_size", amount.toPlainString());
                }
            }
            case LIMIT -> {
                ObjectNode limit = configuration.putObject("limit_limit_gtc");
                limit.put("base_size", amount.toPlainString());
                limit.put("limit_price", price.toPlainString());
                limit.put("post_only", false);
            }
            case STOP_LOSS -> {
                ObjectNode stop = configuration.putObject("stop_limit_stop_limit_gtc");
                stop.put("base_size", amount.toPlainString());
                stop.put("limit_price", (price != null ? price : stopPrice).toPlainString());
                stop.put("stop_price", stopPrice.toPlainString());
                stop.put("stop_direction", side == Side.SELL ? "STOP_DIRECTION_STOP_DOWN" : "STOP_DIRECTION_STOP_UP");
            }
        }
        return body;
    }

    private static String clientOrderId(Map<String, Object> args) {
        Object explicit = args.get(TransportArgs.CLIENT_ORDER_ID);
        if (explicit == null && args.get(TransportArgs.PARAMS) instanceof Map<?, ?> params) {
            explicit = params.get(TransportArgs.CLIENT_ORDER_ID);
        }
        return explicit == null ? UUID.randomUUID().toString() : explicit.toString();
    }

    private void syncServerTime() {
        try {
            JsonNode root = execute("GET", SERVER_TIME_PATH, null, null, false);
            long serverMillis = root.path("epochMillis").asLong(0L);
            if (serverMillis > 0) {
                serverTimeOffsetMillis = serverMillis - clock.millis();
                logger.debug("coinbase server time offset: {} ms", serverTimeOffsetMillis);
            }
        } catch (ExchangeException e) {
            logger.warn("Unable to read coinbase server time, keeping offset {} ms: {}",
                    serverTimeOffsetMillis, e.getMessage());
        }
    }

    private String productPath(Map<String, Object> args) throws ExchangeException {
        return MARKET_PRODUCTS_PATH + "/" + urlEncode(parseSymbol(args.get(TransportArgs.SYMBOL)).toProductId());
    }

    private static Symbol parseSymbol(Object symbol) throws ExchangeException {
        try {
            return Symbol.of((String) symbol);
        } catch (IllegalArgumentException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.NOT_SUPPORTED,
                    "Unsupported coinbase symbol: " + symbol, e);
        }
    }

    private JsonNode execute(String method,
                             String path,
                             Map<String, String> queryParams,
                             JsonNode body,
                             boolean signed) throws ExchangeException {
        String query = buildQueryString(queryParams);
        String requestPath = query.isEmpty() ? path : path + "?" + query;
        String bodyJson = toRequestBodyJson(body);

        Request.Builder builder = new Request.Builder()
                .url(restBaseUrl + requestPath)
                .addHeader("Content-Type", "application/json");
        if (signed) {
            signer.headers(method, host, path, bodyJson, serverTimeMillis() / 1000L).forEach(builder::addHeader);
        }
        if ("POST".equals(method)) {
            builder.post(RequestBody.create(bodyJson, JSON_MEDIA_TYPE));
        } else {
            builder.get();
        }

        try (Response response = httpClient.newCall(builder.build()).execute()) {
            String responseBody = response.body() == null ? "" : response.body().string();
            logger.debug("{} {} -> HTTP {} ({} bytes)", method, requestPath, response.code(), responseBody.length());
            if (!response.isSuccessful()) {
                throw httpError(response.code(), responseBody);
            }
            return objectMapper.readTree(responseBody.isEmpty() ? "{}" : responseBody);
        } catch (SocketTimeoutException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT,
                    "coinbase request timed out: " + method + " " + path, e);
        } catch (InterruptedIOException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new ExchangeException(ExchangeException.ErrorCode.CANCELLED,
                        "coinbase request interrupted: " + method + " " + path, e);
            }
            throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT,
                    "coinbase request timed out: " + method + " " + path, e);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.API_ERROR,
                    "Unexpected coinbase response on " + method + " " + path, e);
        } catch (IOException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR,
                    "coinbase request failed: " + method + " " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Maps a non 2xx response. The status code stays in the message.
     */
    static ExchangeException httpError(int code, String body) {
        String message = "coinbase HTTP " + code + ": " + body;
        if (code == 429) {
            return new ExchangeException(ExchangeException.ErrorCode.RATE_LIMIT, message);
        }
        if (code == 401 || code == 403) {
            return new ExchangeException(ExchangeException.ErrorCode.AUTH_FAILED, message);
        }
        if (code >= 500) {
            return new ExchangeException(ExchangeException.ErrorCode.NETWORK_ERROR, message);
        }
        return new ExchangeException(ExchangeException.ErrorCode.API_ERROR, message);
    }

    private String toRequestBodyJson(JsonNode body) throws ExchangeException {
        if (body == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ExchangeException(ExchangeException.ErrorCode.UNKNOWN, "Unable to encode coinbase request", e);
        }
    }

    private static String buildQueryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        Map<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("&");
            }
            sb.append(urlEncode(entry.getKey()))
                    .append("=")
                    .append(urlEncode(entry.getValue()));
        }
        return sb.toString();
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
