package com.trade.coinbase.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SymbolTest {

    @Test
    void parsesUnifiedAndProductForms() {
        assertEquals(new Symbol("AAVE", "USD"), Symbol.of("AAVE/USD"));
        assertEquals(new Symbol("AAVE", "USD"), Symbol.of("aave-usd"));
        assertEquals(new Symbol("BTC", "USDC"), Symbol.of("BTC_USDC"));
        assertEquals(new Symbol("BTC", "USD"), Symbol.of("BTC/USD:USD"));
    }

    @Test
    void formatsBothWays() {
        Symbol symbol = Symbol.fromProductId("AAVE-USD");
        assertEquals("AAVE/USD", symbol.toPairString());
        assertEquals("AAVE-USD", symbol.toProductId());
        assertEquals("USD", symbol.getQuote());
    }

    @Test
    void rejectsMalformedSymbols() {
        assertThrows(IllegalArgumentException.class, () -> Symbol.of("AAVEUSD"));
        assertThrows(IllegalArgumentException.class, () -> Symbol.of("A/B/C"));
        assertThrows(IllegalArgumentException.class, () -> Symbol.of(null));
    }
}
