package com.trade.scalp.core;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * BigDecimal 工具类
 * 价格、数量、指标、盈亏一律使用 BigDecimal，禁止 double
 */
public final class Decimal {

    private Decimal() {}

    /**
     * 价格与指标精度：8位小数
     */
    public static final int PRICE_SCALE = 8;

    /**
     * 数量精度：8位小数，向下取整（不能超买）
     */
    public static final int QUANTITY_SCALE = 8;

    /**
     * 百分比/强度精度：2位小数
     */
    public static final int PERCENT_SCALE = 2;

    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final MathContext SQRT_CONTEXT = MathContext.DECIMAL64;

    public static BigDecimal of(String value) {
        return new BigDecimal(value);
    }

    public static BigDecimal of(double value) {
        return BigDecimal.valueOf(value);
    }

    public static BigDecimal scalePrice(BigDecimal value) {
        return value.setScale(PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal scaleQuantity(BigDecimal value) {
        return value.setScale(QUANTITY_SCALE, RoundingMode.DOWN);
    }

    public static BigDecimal scalePercent(BigDecimal value) {
        return value.setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 安全除法，除数为0时返回0
     */
    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return dividend.divide(divisor, PRICE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 按百分比偏移价格，percent=0.7 表示 +0.7%
     */
    public static BigDecimal offsetPercent(BigDecimal price, BigDecimal percent) {
        BigDecimal factor = BigDecimal.ONE.add(percent.divide(HUNDRED, PRICE_SCALE, RoundingMode.HALF_UP));
        return scalePrice(price.multiply(factor));
    }

    /**
     * 非负数平方根
     */
    public static BigDecimal sqrt(BigDecimal value) {
        if (value.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return scalePrice(value.sqrt(SQRT_CONTEXT));
    }

    public static BigDecimal max(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) > 0;
    }

    public static boolean isNegative(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) < 0;
    }

    public static boolean isZero(BigDecimal value) {
        return value != null && value.compareTo(BigDecimal.ZERO) == 0;
    }
}
