package com.trade.coinbase.exchange;

import com.trade.coinbase.core.AdapterConfig;
import com.trade.coinbase.error.ErrorClassifier;
import com.trade.coinbase.market.PaginationWindower;
import com.trade.coinbase.normalize.ResponseNormalizer;
import com.trade.coinbase.retry.RetryPolicy;

/**
 * 交易所工厂
 */
public final class ExchangeFactory {

    private ExchangeFactory() {}

    /**
     * 创建交易所实例
     * @param exchangeName 交易所名称（目前仅支持 coinbase）
     */
    public static Exchange createExchange(String exchangeName, AdapterConfig config) {
        if (CoinbaseExchange.NAME.equalsIgnoreCase(exchangeName)) {
            return createCoinbase(config);
        }
        throw new IllegalArgumentException("不支持的交易所: " + exchangeName);
    }

    /**
     * 按配置创建 Coinbase 实例
     */
    public static CoinbaseExchange createCoinbase(AdapterConfig config) {
        Transport transport = new CoinbaseRestTransport(config, credentials(config));
        return createCoinbase(config, transport);
    }

    /**
     * 使用指定传输层创建 Coinbase 实例，重试、错误分类和分页参数取自配置
     */
    public static CoinbaseExchange createCoinbase(AdapterConfig config, Transport transport) {
        RetryPolicy retryPolicy = new RetryPolicy(CoinbaseExchange.NAME,
                config.getRetryMaxAttempts(), config.getRetryInstantMarker());
        ErrorClassifier classifier = ErrorClassifier.defaults()
                .withConfiguredSignatures(config::getErrorSignatures);
        PaginationWindower windower = new PaginationWindower(config.getOhlcvMaxPageSize(), transport::serverTimeMillis);
        return new CoinbaseExchange(transport, retryPolicy, new ResponseNormalizer(), windower, classifier);
    }

    static Credentials credentials(AdapterConfig config) {
        return CredentialAdapter.adapt(new Credentials(
                config.getOptionalProperty(AdapterConfig.API_KEY),
                config.getOptionalProperty(AdapterConfig.API_SECRET),
                config.getOptionalProperty(AdapterConfig.API_PASSPHRASE),
                config.getOptionalProperty(AdapterConfig.API_UID),
                config.getOptionalProperty(AdapterConfig.API_AUTH_TOKEN)));
    }
}
