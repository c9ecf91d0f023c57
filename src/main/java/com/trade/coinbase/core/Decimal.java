package com.trade.coinbase.core;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * BigDecimal 工具类
 * 所有金额、价格、数量计算必须使用此类，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    /**
     * 宽松解析：空值、空串或非法格式返回 null
     */
    public static BigDecimal parseOrNull(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 按有效位数相除（DECIMAL128），小额报价换算不会被截成 0
     */
    public static BigDecimal divideExact(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, MathContext.DECIMAL128);
    }

    /**
     * 判断是否为正值
     */
    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    /**
     * 判断是否为零
     */
    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }

    /**
     * null 或 0 均视为未设置
     */
    public static boolean isUnsetOrZero(BigDecimal value) {
        return value == null || isZero(value);
    }
}
