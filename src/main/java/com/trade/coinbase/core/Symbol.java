package com.trade.coinbase.core;

import java.util.Locale;
import java.util.Objects;

/**
 * 交易对
 * 统一格式 BASE/QUOTE（如 AAVE/USD），交易所格式 BASE-QUOTE（如 AAVE-USD）
 */
public class Symbol {
    private final String base;      // 基础货币，如 AAVE
    private final String quote;     // 报价货币，如 USD

    public Symbol(String base, String quote) {
        if (base == null || base.isBlank() || quote == null || quote.isBlank()) {
            throw new IllegalArgumentException("Invalid symbol parts: " + base + ", " + quote);
        }
        this.base = base.trim().toUpperCase(Locale.ROOT);
        this.quote = quote.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Parses "AAVE/USD", "AAVE-USD", "AAVE_USD" and settled forms such as "BTC/USD:USD".
     */
    public static Symbol of(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Invalid symbol: null");
        }
        String pair = symbol;
        int settleIndex = pair.indexOf(':');
        if (settleIndex >= 0) {
            pair = pair.substring(0, settleIndex);
        }
        String[] parts = pair.split("[/\\-_]");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid symbol: " + symbol);
        }
        return new Symbol(parts[0], parts[1]);
    }

    public static Symbol fromProductId(String productId) {
        return of(productId);
    }

    public String getBase() {
        return base;
    }

    public String getQuote() {
        return quote;
    }

    public String toPairString() {
        return base + "/" + quote;
    }

    /**
     * Coinbase product id, e.g. AAVE-USD.
     */
    public String toProductId() {
        return base + "-" + quote;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(base, symbol.base) && Objects.equals(quote, symbol.quote);
    }

    @Override
    public int hashCode() {
        return Objects.hash(base, quote);
    }

    @Override
    public String toString() {
        return toPairString();
    }
}
