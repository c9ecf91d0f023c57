package com.trade.coinbase.core;

import java.math.BigDecimal;

/**
 * 单币种余额
 * v2 接口只返回可用余额，此时 used/total 为空
 */
public class Balance {
    private final String currency;
    private final BigDecimal free;      // 可用
    private final BigDecimal used;      // 冻结
    private final BigDecimal total;     // 总额

    public Balance(String currency, BigDecimal free, BigDecimal used, BigDecimal total) {
        this.currency = currency;
        this.free = free;
        this.used = used;
        this.total = total;
    }

    public String getCurrency() { return currency; }
    public BigDecimal getFree() { return free; }
    public BigDecimal getUsed() { return used; }
    public BigDecimal getTotal() { return total; }

    public boolean hasTotal() {
        return total != null;
    }

    @Override
    public String toString() {
        return String.format("Balance{currency=%s, free=%s, used=%s, total=%s}", currency, free, used, total);
    }
}
