package com.trade.coinbase.core;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * 配置管理器
 * 默认值来自 classpath 下的 coinbase-adapter.properties，
 * 工作目录中同名文件存在时覆盖默认值
 */
public class AdapterConfig {

    public static final String CONFIG_FILE = "coinbase-adapter.properties";

    public static final String API_KEY = "coinbase.api.key";
    public static final String API_SECRET = "coinbase.api.secret";
    public static final String API_PASSPHRASE = "coinbase.api.passphrase";
    public static final String API_UID = "coinbase.api.uid";
    public static final String API_AUTH_TOKEN = "coinbase.api.auth-token";
    public static final String REST_BASE_URL = "coinbase.rest.base-url";
    public static final String HTTP_TIMEOUT_SECONDS = "coinbase.http.timeout-seconds";
    public static final String RETRY_MAX_ATTEMPTS = "coinbase.retry.max-attempts";
    public static final String RETRY_INSTANT_MARKER = "coinbase.retry.instant-marker";
    public static final String OHLCV_MAX_PAGE_SIZE = "coinbase.ohlcv.max-page-size";
    public static final String ERROR_SIGNATURES_PREFIX = "coinbase.errors.";

    private static AdapterConfig instance;
    private final Properties properties;

    private AdapterConfig(Properties properties) {
        this.properties = properties;
    }

    public static synchronized AdapterConfig getInstance() {
        if (instance == null) {
            instance = load(Paths.get(CONFIG_FILE));
        }
        return instance;
    }

    public static AdapterConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new AdapterConfig(copy);
    }

    /**
     * 加载配置：先读 classpath 默认值，再用 overrideFile 覆盖（文件不存在时跳过）
     */
    public static AdapterConfig load(Path overrideFile) {
        Properties properties = new Properties();
        try (InputStream in = AdapterConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (in != null) {
                try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    properties.load(reader);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load default configuration: " + CONFIG_FILE, e);
        }

        if (overrideFile != null && Files.exists(overrideFile)) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException e) {
                throw new IllegalStateException("Unable to load configuration file: " + overrideFile, e);
            }
        }
        return new AdapterConfig(properties);
    }

    /**
     * 获取配置属性，缺失时抛出异常
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("Missing configuration property: " + key);
        }
        return value.trim();
    }

    /**
     * 获取可选配置，未设置或为模板占位值时返回 null
     */
    public String getOptionalProperty(String key) {
        return hasProperty(key) ? properties.getProperty(key).trim() : null;
    }

    /**
     * 检查属性是否存在
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() && !value.trim().startsWith("YOUR_");
    }

    /**
     * 获取整数配置
     */
    public int getIntProperty(String key, int defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(getProperty(key));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * 获取布尔配置
     */
    public boolean getBooleanProperty(String key, boolean defaultValue) {
        if (!hasProperty(key)) {
            return defaultValue;
        }
        return Boolean.parseBoolean(getProperty(key));
    }

    public String getRestBaseUrl() {
        String url = getOptionalProperty(REST_BASE_URL);
        return url == null ? "https://api.coinbase.com" : url;
    }

    public int getHttpTimeoutSeconds() {
        return getIntProperty(HTTP_TIMEOUT_SECONDS, 30);
    }

    public int getRetryMaxAttempts() {
        int attempts = getIntProperty(RETRY_MAX_ATTEMPTS, 5);
        if (attempts < 1) {
            throw new IllegalStateException(RETRY_MAX_ATTEMPTS + " must be at least 1, got " + attempts);
        }
        return attempts;
    }

    public String getRetryInstantMarker() {
        String marker = getOptionalProperty(RETRY_INSTANT_MARKER);
        return marker == null ? "429" : marker;
    }

    public int getOhlcvMaxPageSize() {
        return getIntProperty(OHLCV_MAX_PAGE_SIZE, 300);
    }

    /**
     * Raw extra error signatures for one category, e.g. "not_found&amp;order|unknown order".
     */
    public String getErrorSignatures(String categoryName) {
        return getOptionalProperty(ERROR_SIGNATURES_PREFIX + categoryName);
    }
}
