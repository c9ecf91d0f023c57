package com.trade.coinbase.market;

import com.trade.coinbase.core.TimeFrame;

import java.util.function.LongSupplier;

/**
 * Computes since / limit of candle requests.
 * Coinbase returns at most {@code maxPageSize} candles and, without a start time,
 * does not return the latest ones: the window is anchored on the exchange clock.
 */
public class PaginationWindower {

    public static final int DEFAULT_MAX_PAGE_SIZE = 300;

    private final int maxPageSize;
    private final LongSupplier serverClock;

    public PaginationWindower(LongSupplier serverClock) {
        this(DEFAULT_MAX_PAGE_SIZE, serverClock);
    }

    public PaginationWindower(int maxPageSize, LongSupplier serverClock) {
        if (maxPageSize < 1) {
            throw new IllegalArgumentException("maxPageSize must be positive, got " + maxPageSize);
        }
        this.maxPageSize = maxPageSize;
        this.serverClock = serverClock;
    }

    /**
     * @param timeFrame candle time frame
     * @param limit     requested candle count, null or non positive for the maximum page size
     * @param since     requested start time (ms), null to end the window now
     */
    public PageWindow window(TimeFrame timeFrame, Integer limit, Long since) {
        int effectiveLimit = resolveLimit(limit);
        if (since != null) {
            return new PageWindow(since, effectiveLimit);
        }
        long now = serverClock.getAsLong();
        return new PageWindow(now - timeFrame.toMillis() * effectiveLimit, effectiveLimit);
    }

    public int resolveLimit(Integer limit) {
        if (limit == null || limit <= 0) {
            return maxPageSize;
        }
        return Math.min(limit, maxPageSize);
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }
}
