package com.trade.scalp.indicator;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MACD 指标单元测试
 */
class MACDTest {

    private static List<BigDecimal> series(int start, int step, int count) {
        List<BigDecimal> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(BigDecimal.valueOf(start + (long) step * i));
        }
        return values;
    }

    @Test
    void testMACD_OutputMatchesInputLength() {
        MACD macd = new MACD(8, 17, 7);
        assertEquals(20, macd.calculate(series(100, 1, 20)).size());
    }

    @Test
    void testMACD_ConstantSeriesIsZero() {
        MACD.MACDResult result = new MACD(8, 17, 7).latest(series(100, 0, 20));

        assertEquals(0, BigDecimal.ZERO.compareTo(result.macdLine));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.signalLine));
        assertEquals(0, BigDecimal.ZERO.compareTo(result.histogram));
    }

    @Test
    void testMACD_Trend() {
        MACD macd = new MACD(8, 17, 7);

        assertTrue(macd.latest(series(100, 1, 30)).macdLine.signum() > 0);
        assertTrue(macd.latest(series(200, -1, 30)).macdLine.signum() < 0);
    }

    @Test
    void testMACD_InvalidPeriods() {
        assertThrows(IllegalArgumentException.class, () -> new MACD(17, 8, 7));
        assertThrows(IllegalArgumentException.class, () -> new MACD(8, 8, 7));
        assertThrows(IllegalArgumentException.class, () -> new MACD(8, 17, 7).calculate(series(100, 1, 16)));
    }
}
