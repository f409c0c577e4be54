package com.trade.scalp.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decimal 工具类单元测试
 */
class DecimalTest {

    @Test
    void testOf_String() {
        BigDecimal value = Decimal.of("123.45678901");
        assertEquals(0, new BigDecimal("123.45678901").compareTo(value));
    }

    @Test
    void testOf_Double() {
        BigDecimal value = Decimal.of(123.45);
        assertEquals(0, BigDecimal.valueOf(123.45).compareTo(value));
    }

    @Test
    void testScalePrice() {
        BigDecimal scaled = Decimal.scalePrice(new BigDecimal("123.456789012345"));

        // 价格保留8位小数，四舍五入
        assertEquals(8, scaled.scale());
        assertEquals(0, new BigDecimal("123.45678901").compareTo(scaled));
    }

    @Test
    void testScaleQuantity_RoundsDown() {
        BigDecimal scaled = Decimal.scaleQuantity(new BigDecimal("0.123456789"));

        // 数量保留8位小数，向下取整
        assertEquals(8, scaled.scale());
        assertEquals(0, new BigDecimal("0.12345678").compareTo(scaled));
    }

    @Test
    void testScalePercent() {
        BigDecimal scaled = Decimal.scalePercent(new BigDecimal("12.3456"));

        assertEquals(2, scaled.scale());
        assertEquals(0, new BigDecimal("12.35").compareTo(scaled));
    }

    @Test
    void testDivide_Normal() {
        BigDecimal result = Decimal.divide(new BigDecimal("100"), new BigDecimal("3"));

        // 100 / 3 ≈ 33.33333333
        assertTrue(result.compareTo(new BigDecimal("33.33")) > 0);
        assertTrue(result.compareTo(new BigDecimal("33.34")) < 0);
    }

    @Test
    void testDivide_ByZero() {
        BigDecimal result = Decimal.divide(new BigDecimal("100"), BigDecimal.ZERO);

        // 除零返回0，不抛异常
        assertEquals(0, BigDecimal.ZERO.compareTo(result));
    }

    @Test
    void testOffsetPercent() {
        BigDecimal price = new BigDecimal("100");

        assertEquals(0, new BigDecimal("100.7").compareTo(Decimal.offsetPercent(price, new BigDecimal("0.7"))));
        assertEquals(0, new BigDecimal("99.3").compareTo(Decimal.offsetPercent(price, new BigDecimal("-0.7"))));
        assertEquals(0, new BigDecimal("101.8").compareTo(Decimal.offsetPercent(price, new BigDecimal("1.8"))));
    }

    @Test
    void testSqrt() {
        assertEquals(0, new BigDecimal("4").compareTo(Decimal.sqrt(new BigDecimal("16"))));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.sqrt(BigDecimal.ZERO)));
        assertEquals(0, BigDecimal.ZERO.compareTo(Decimal.sqrt(new BigDecimal("-1"))));
    }

    @Test
    void testMaxMin() {
        BigDecimal a = new BigDecimal("1.5");
        BigDecimal b = new BigDecimal("2");
        assertSame(b, Decimal.max(a, b));
        assertSame(a, Decimal.min(a, b));
    }

    @Test
    void testIsPositive() {
        assertTrue(Decimal.isPositive(new BigDecimal("1")));
        assertTrue(Decimal.isPositive(new BigDecimal("0.0001")));
        assertFalse(Decimal.isPositive(BigDecimal.ZERO));
        assertFalse(Decimal.isPositive(new BigDecimal("-1")));
        assertFalse(Decimal.isPositive(null));
    }

    @Test
    void testIsNegative() {
        assertTrue(Decimal.isNegative(new BigDecimal("-1")));
        assertFalse(Decimal.isNegative(BigDecimal.ZERO));
        assertFalse(Decimal.isNegative(new BigDecimal("1")));
        assertFalse(Decimal.isNegative(null));
    }

    @Test
    void testIsZero() {
        assertTrue(Decimal.isZero(BigDecimal.ZERO));
        assertTrue(Decimal.isZero(new BigDecimal("0.00000000")));
        assertFalse(Decimal.isZero(new BigDecimal("1")));
        assertFalse(Decimal.isZero(null));
    }
}
