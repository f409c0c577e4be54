package com.trade.scalp.market;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 单个交易对的滚动K线窗口
 *
 * 不变式：
 * 1. 收盘时间严格递增
 * 2. 最多保存 capacity 根，超出时淘汰最旧的一根
 *
 * 非线程安全，由持有者在交易对锁内访问
 */
public class PriceWindow {

    public static final int DEFAULT_CAPACITY = 100;

    private final Symbol symbol;
    private final int capacity;
    private final Deque<Candle> candles;

    public PriceWindow(Symbol symbol) {
        this(symbol, DEFAULT_CAPACITY);
    }

    public PriceWindow(Symbol symbol, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("窗口容量必须大于0");
        }
        this.symbol = symbol;
        this.capacity = capacity;
        this.candles = new ArrayDeque<>(capacity + 1);
    }

    /**
     * 追加收盘K线
     * 时间戳不晚于最后一根时拒绝，窗口保持不变
     */
    public AppendResult append(Candle candle) {
        if (!symbol.equals(candle.getSymbol())) {
            throw new IllegalArgumentException("K线交易对 " + candle.getSymbol() + " 不属于窗口 " + symbol);
        }
        Candle last = candles.peekLast();
        if (last != null && !candle.isAfter(last)) {
            return AppendResult.STALE;
        }
        candles.addLast(candle);
        while (candles.size() > capacity) {
            candles.removeFirst();
        }
        return AppendResult.APPENDED;
    }

    /**
     * 按时间顺序返回窗口的不可变副本
     */
    public List<Candle> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(candles));
    }

    /**
     * 收盘价序列
     */
    public List<BigDecimal> closes() {
        List<BigDecimal> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(candle.getClose());
        }
        return closes;
    }

    public Optional<Candle> latest() {
        return Optional.ofNullable(candles.peekLast());
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public int size() {
        return candles.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return candles.isEmpty();
    }
}
