package com.trade.scalp.strategy;

import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * 交易信号
 * 信号生成器的输出，由风控立即消费或丢弃
 */
public final class Signal {

    private final Symbol symbol;
    private final Side side;
    private final BigDecimal price;       // 建议入场价
    private final BigDecimal strength;    // 信号强度 [0,100]
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final Instant generatedAt;

    public Signal(Symbol symbol, Side side, BigDecimal price, BigDecimal strength,
                  BigDecimal stopLoss, BigDecimal takeProfit, Instant generatedAt) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        this.price = Objects.requireNonNull(price, "price");
        this.strength = Objects.requireNonNull(strength, "strength");
        this.stopLoss = Objects.requireNonNull(stopLoss, "stopLoss");
        this.takeProfit = Objects.requireNonNull(takeProfit, "takeProfit");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getStrength() { return strength; }
    public BigDecimal getStopLoss() { return stopLoss; }
    public BigDecimal getTakeProfit() { return takeProfit; }
    public Instant getGeneratedAt() { return generatedAt; }

    /**
     * 入场价到止损价的距离
     */
    public BigDecimal stopDistance() {
        return price.subtract(stopLoss).abs();
    }

    @Override
    public String toString() {
        return String.format("Signal{symbol=%s, side=%s, price=%s, strength=%s, SL=%s, TP=%s, time=%s}",
                symbol, side, price, strength, stopLoss, takeProfit, generatedAt);
    }
}
