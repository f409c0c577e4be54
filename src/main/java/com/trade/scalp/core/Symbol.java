package com.trade.scalp.core;

import java.util.Objects;

/**
 * 交易对
 * 支持 BTCUSDT / BTC-USDT / BTC_USDT / BTC/USDT 写法，统一归一化为大写无分隔形式
 */
public final class Symbol {

    private final String pair;

    private Symbol(String pair) {
        this.pair = pair;
    }

    public static Symbol of(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("交易对不能为空");
        }
        String normalized = symbol.trim().replaceAll("[-_/]", "").toUpperCase();
        if (!normalized.matches("[A-Z0-9]+")) {
            throw new IllegalArgumentException("无效的交易对格式: " + symbol);
        }
        return new Symbol(normalized);
    }

    public String toPairString() {
        return pair;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Symbol symbol = (Symbol) o;
        return Objects.equals(pair, symbol.pair);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pair);
    }

    @Override
    public String toString() {
        return pair;
    }
}
