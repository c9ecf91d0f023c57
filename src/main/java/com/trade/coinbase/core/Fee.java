package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * 手续费
 */
public class Fee {
    private final BigDecimal cost;
    private final String currency;

    public Fee(BigDecimal cost, String currency) {
        this.cost = cost;
        this.currency = currency;
    }

    public BigDecimal getCost() { return cost; }
    public String getCurrency() { return currency; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fee fee = (Fee) o;
        return (cost == null ? fee.cost == null : fee.cost != null && cost.compareTo(fee.cost) == 0)
                && Objects.equals(currency, fee.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cost == null ? null : cost.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return String.format("Fee{cost=%s, currency=%s}", cost, currency);
    }
}
