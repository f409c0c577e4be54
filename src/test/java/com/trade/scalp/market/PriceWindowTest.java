package com.trade.scalp.market;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Symbol;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 价格窗口单元测试
 */
class PriceWindowTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");
    private static final Instant T0 = Instant.parse("2024-03-04T10:00:00Z");

    private static Candle candle(Symbol symbol, int minute, String close) {
        BigDecimal price = new BigDecimal(close);
        return new Candle(symbol, T0.plusSeconds(60L * minute), price, price, price, price, BigDecimal.ONE);
    }

    @Test
    void append_shouldKeepChronologicalOrder() {
        PriceWindow window = new PriceWindow(BTC, 10);

        assertEquals(AppendResult.APPENDED, window.append(candle(BTC, 0, "100")));
        assertEquals(AppendResult.APPENDED, window.append(candle(BTC, 1, "101")));
        assertEquals(AppendResult.APPENDED, window.append(candle(BTC, 2, "102")));

        List<BigDecimal> closes = window.closes();
        assertEquals(3, closes.size());
        assertEquals(0, new BigDecimal("100").compareTo(closes.get(0)));
        assertEquals(0, new BigDecimal("102").compareTo(closes.get(2)));
        assertEquals(T0.plusSeconds(120), window.latest().orElseThrow().getCloseTime());
    }

    @Test
    void append_shouldRejectDuplicateAndOlderCandles() {
        PriceWindow window = new PriceWindow(BTC, 10);
        window.append(candle(BTC, 5, "100"));

        assertEquals(AppendResult.STALE, window.append(candle(BTC, 5, "999")));
        assertEquals(AppendResult.STALE, window.append(candle(BTC, 3, "999")));

        assertEquals(1, window.size());
        assertEquals(0, new BigDecimal("100").compareTo(window.latest().orElseThrow().getClose()));
    }

    @Test
    void append_shouldEvictOldestBeyondCapacity() {
        PriceWindow window = new PriceWindow(BTC, 3);
        for (int i = 0; i < 5; i++) {
            window.append(candle(BTC, i, String.valueOf(100 + i)));
        }

        assertEquals(3, window.size());
        List<BigDecimal> closes = window.closes();
        assertEquals(0, new BigDecimal("102").compareTo(closes.get(0)));
        assertEquals(0, new BigDecimal("104").compareTo(closes.get(2)));
    }

    @Test
    void append_shouldRejectOtherSymbol() {
        PriceWindow window = new PriceWindow(BTC, 3);
        assertThrows(IllegalArgumentException.class,
                () -> window.append(candle(Symbol.of("ETHUSDT"), 0, "100")));
    }

    @Test
    void snapshot_shouldBeDetachedAndReadOnly() {
        PriceWindow window = new PriceWindow(BTC, 3);
        window.append(candle(BTC, 0, "100"));

        List<Candle> snapshot = window.snapshot();
        window.append(candle(BTC, 1, "101"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(candle(BTC, 2, "102")));
    }

    @Test
    void emptyWindow() {
        PriceWindow window = new PriceWindow(BTC);

        assertTrue(window.isEmpty());
        assertTrue(window.latest().isEmpty());
        assertEquals(PriceWindow.DEFAULT_CAPACITY, window.capacity());
        assertThrows(IllegalArgumentException.class, () -> new PriceWindow(BTC, 0));
    }
}
