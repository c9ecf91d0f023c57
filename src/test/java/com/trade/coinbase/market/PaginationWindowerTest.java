package com.trade.coinbase.market;

import com.trade.coinbase.core.TimeFrame;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PaginationWindowerTest {

    private static final long NOW = 1_000_000L;

    private final PaginationWindower windower = new PaginationWindower(() -> NOW);

    @Test
    void defaultWindowEndsNowWithMaxPageSize() {
        PageWindow window = windower.window(TimeFrame.ONE_MINUTE, null, null);

        assertEquals(300, window.getLimit());
        assertEquals(NOW - 60_000L * 300, window.getSince());
    }

    @Test
    void requestedLimitIsCapped() {
        assertEquals(300, windower.window(TimeFrame.ONE_MINUTE, 500, null).getLimit());
        assertEquals(new PageWindow(NOW - 60_000L * 300, 300), windower.window(TimeFrame.ONE_MINUTE, 500, null));
    }

    @Test
    void smallerLimitShortensWindow() {
        PageWindow window = windower.window(TimeFrame.ONE_HOUR, 24, null);

        assertEquals(24, window.getLimit());
        assertEquals(NOW - 3_600_000L * 24, window.getSince());
    }

    @Test
    void nonPositiveLimitMeansMaxPageSize() {
        assertEquals(300, windower.resolveLimit(0));
        assertEquals(300, windower.resolveLimit(-5));
        assertEquals(1, windower.resolveLimit(1));
    }

    @Test
    void explicitSinceIsKept() {
        PageWindow window = windower.window(TimeFrame.FIVE_MINUTES, 500, 42L);

        assertEquals(42L, window.getSince());
        assertEquals(300, window.getLimit());
    }

    @Test
    void clockIsReadOnEveryCall() {
        AtomicInteger reads = new AtomicInteger();
        PaginationWindower counting = new PaginationWindower(100, () -> NOW + reads.incrementAndGet());

        counting.window(TimeFrame.ONE_MINUTE, null, null);
        PageWindow second = counting.window(TimeFrame.ONE_MINUTE, null, null);

        assertEquals(2, reads.get());
        assertEquals(NOW + 2 - 60_000L * 100, second.getSince());
        assertEquals(100, second.getLimit());
    }

    @Test
    void rejectsEmptyPageSize() {
        assertThrows(IllegalArgumentException.class, () -> new PaginationWindower(0, () -> NOW));
    }
}
