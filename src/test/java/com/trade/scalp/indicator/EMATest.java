package com.trade.scalp.indicator;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EMA 指标单元测试
 */
class EMATest {

    @Test
    void testEMA_SeededWithFirstValue() {
        EMA ema = new EMA(3);
        List<BigDecimal> values = List.of(new BigDecimal("1"), new BigDecimal("2"), new BigDecimal("3"));

        List<BigDecimal> result = ema.calculate(values);

        // alpha = 2 / (3 + 1) = 0.5
        assertEquals(3, result.size());
        assertEquals(0, new BigDecimal("1").compareTo(result.get(0)));
        assertEquals(0, new BigDecimal("1.5").compareTo(result.get(1)));
        assertEquals(0, new BigDecimal("2.25").compareTo(result.get(2)));
    }

    @Test
    void testEMA_ConstantSeries() {
        EMA ema = new EMA(5);
        List<BigDecimal> values = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            values.add(new BigDecimal("42.5"));
        }

        assertEquals(0, new BigDecimal("42.5").compareTo(ema.latest(values)));
    }

    @Test
    void testEMA_ShortReactsFasterThanLong() {
        List<BigDecimal> values = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            values.add(BigDecimal.valueOf(100 + i));
        }

        BigDecimal fast = new EMA(3).latest(values);
        BigDecimal slow = new EMA(7).latest(values);

        assertTrue(fast.compareTo(slow) > 0);
    }

    @Test
    void testEMA_InvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> new EMA(0));
        assertThrows(IllegalArgumentException.class, () -> new EMA(3).calculate(List.of()));
    }

    @Test
    void testEMA_Name() {
        assertEquals("EMA-7", new EMA(7).getName());
        assertEquals(7, new EMA(7).requiredPoints());
    }
}
