package com.trade.coinbase.market;

/**
 * Request window of one historical candle page.
 */
public class PageWindow {
    private final long since;    // start time (ms)
    private final int limit;     // candle count

    public PageWindow(long since, int limit) {
        this.since = since;
        this.limit = limit;
    }

    public long getSince() { return since; }
    public int getLimit() { return limit; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PageWindow that = (PageWindow) o;
        return since == that.since && limit == that.limit;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(since) * 31 + limit;
    }

    @Override
    public String toString() {
        return "PageWindow{since=" + since + ", limit=" + limit + "}";
    }
}
