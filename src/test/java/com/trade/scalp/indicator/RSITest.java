package com.trade.scalp.indicator;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RSI 指标单元测试
 */
class RSITest {

    @Test
    void testRSI_Calculate() {
        RSI rsi = new RSI(14);

        List<BigDecimal> prices = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            prices.add(BigDecimal.valueOf(100 + (i % 3) - 1));
        }

        List<BigDecimal> result = rsi.calculate(prices);

        // 16 个价格，15 个变化，周期 14 -> 2 个结果
        assertEquals(2, result.size());
        for (BigDecimal value : result) {
            assertTrue(value.compareTo(BigDecimal.ZERO) >= 0);
            assertTrue(value.compareTo(BigDecimal.valueOf(100)) <= 0);
        }
    }

    @Test
    void testRSI_Uptrend() {
        RSI rsi = new RSI(5);
        List<BigDecimal> prices = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            prices.add(BigDecimal.valueOf(100 + i));
        }

        // 没有下跌，RSI 固定为 100
        assertEquals(0, BigDecimal.valueOf(100).compareTo(rsi.latest(prices)));
        assertTrue(rsi.isOverbought(prices, BigDecimal.valueOf(70)));
    }

    @Test
    void testRSI_Downtrend() {
        RSI rsi = new RSI(5);
        List<BigDecimal> prices = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            prices.add(BigDecimal.valueOf(100 - i));
        }

        assertEquals(0, BigDecimal.ZERO.compareTo(rsi.latest(prices)));
        assertTrue(rsi.isOversold(prices, BigDecimal.valueOf(30)));
    }

    @Test
    void testRSI_EqualGainsAndLosses() {
        RSI rsi = new RSI(2);
        List<BigDecimal> prices = List.of(new BigDecimal("10"), new BigDecimal("11"), new BigDecimal("10"));

        assertEquals(0, BigDecimal.valueOf(50).compareTo(rsi.latest(prices)));
    }

    @Test
    void testRSI_FlatSeriesIsHundred() {
        RSI rsi = new RSI(3);
        List<BigDecimal> prices = List.of(BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN, BigDecimal.TEN);

        assertEquals(0, BigDecimal.valueOf(100).compareTo(rsi.latest(prices)));
    }

    @Test
    void testRSI_InsufficientData() {
        RSI rsi = new RSI(14);
        List<BigDecimal> prices = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            prices.add(BigDecimal.valueOf(100));
        }

        assertThrows(IllegalArgumentException.class, () -> rsi.calculate(prices));
    }

    @Test
    void testRSI_Name() {
        RSI rsi = new RSI(14);
        assertEquals("RSI-14", rsi.getName());
        assertEquals(15, rsi.requiredPoints());
    }
}
