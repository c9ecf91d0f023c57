package com.trade.coinbase.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdapterConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void classpathDefaultsAreLoaded() {
        AdapterConfig config = AdapterConfig.load(tempDir.resolve("absent.properties"));

        assertEquals("https://api.coinbase.com", config.getRestBaseUrl());
        assertEquals(5, config.getRetryMaxAttempts());
        assertEquals("429", config.getRetryInstantMarker());
        assertEquals(300, config.getOhlcvMaxPageSize());
        // template placeholders count as unset
        assertFalse(config.hasProperty(AdapterConfig.API_KEY));
        assertNull(config.getOptionalProperty(AdapterConfig.API_SECRET));
    }

    @Test
    void workingDirectoryFileOverridesDefaults() throws IOException {
        Path file = tempDir.resolve(AdapterConfig.CONFIG_FILE);
        Files.writeString(file, String.join("\n",
                "coinbase.retry.max-attempts=3",
                "coinbase.api.key=organizations/o/apiKeys/k",
                "coinbase.errors.ORDER_NOT_FOUND=unknown&order"), StandardCharsets.UTF_8);

        AdapterConfig config = AdapterConfig.load(file);

        assertEquals(3, config.getRetryMaxAttempts());
        assertEquals("organizations/o/apiKeys/k", config.getProperty(AdapterConfig.API_KEY));
        assertEquals("unknown&order", config.getErrorSignatures("ORDER_NOT_FOUND"));
        assertNull(config.getErrorSignatures("INSUFFICIENT_FUNDS"));
        assertEquals(30, config.getHttpTimeoutSeconds());
    }

    @Test
    void invalidValuesFallBackOrFail() {
        Properties properties = new Properties();
        properties.setProperty(AdapterConfig.OHLCV_MAX_PAGE_SIZE, "many");
        properties.setProperty(AdapterConfig.RETRY_MAX_ATTEMPTS, "0");
        properties.setProperty("flag", "true");
        AdapterConfig config = AdapterConfig.fromProperties(properties);

        assertEquals(300, config.getOhlcvMaxPageSize());
        assertThrows(IllegalStateException.class, config::getRetryMaxAttempts);
        assertThrows(IllegalStateException.class, () -> config.getProperty("missing"));
        assertTrue(config.getBooleanProperty("flag", false));
    }
}
