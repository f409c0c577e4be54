package com.trade.scalp.core;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 已收盘K线
 * 追加到价格窗口后不可变
 */
public final class Candle {
    private final Symbol symbol;
    private final Instant closeTime;         // 收盘时间，同一交易对内单调递增
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final BigDecimal volume;

    public Candle(Symbol symbol, Instant closeTime,
                  BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                  BigDecimal volume) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.closeTime = Objects.requireNonNull(closeTime, "closeTime");
        this.open = Objects.requireNonNull(open, "open");
        this.high = Objects.requireNonNull(high, "high");
        this.low = Objects.requireNonNull(low, "low");
        this.close = Objects.requireNonNull(close, "close");
        this.volume = volume == null ? BigDecimal.ZERO : volume;
    }

    public Symbol getSymbol() { return symbol; }
    public Instant getCloseTime() { return closeTime; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }

    /**
     * 是否为阳线
     */
    public boolean isBullish() {
        return close.compareTo(open) > 0;
    }

    /**
     * 是否晚于另一根K线
     */
    public boolean isAfter(Candle other) {
        return closeTime.isAfter(other.closeTime);
    }

    @Override
    public String toString() {
        return String.format("Candle{symbol=%s, time=%s, OHLC=[%s,%s,%s,%s], vol=%s}",
                symbol, closeTime, open, high, low, close, volume);
    }
}
