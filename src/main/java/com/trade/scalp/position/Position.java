package com.trade.scalp.position;

import com.trade.scalp.core.Decimal;
import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 持仓
 * 由 {@link PositionLifecycle} 创建，止损价只能由生命周期的追踪止损修改
 */
public class Position {
    private final Symbol symbol;
    private final Side side;
    private final BigDecimal entryPrice;      // 开仓价
    private final BigDecimal quantity;        // 持仓数量
    private volatile BigDecimal stopLoss;     // 止损价格（追踪止损会上移/下移）
    private final BigDecimal takeProfit;      // 止盈价格
    private final Instant openedAt;           // 开仓时间
    private final BigDecimal signalStrength;  // 开仓信号强度
    private final String orderId;             // 开仓订单ID

    public Position(Symbol symbol, Side side, BigDecimal entryPrice, BigDecimal quantity,
                    BigDecimal stopLoss, BigDecimal takeProfit, Instant openedAt,
                    BigDecimal signalStrength, String orderId) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.side = Objects.requireNonNull(side, "side");
        if (!Decimal.isPositive(entryPrice) || !Decimal.isPositive(quantity)) {
            throw new IllegalArgumentException("开仓价和数量必须大于0");
        }
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.stopLoss = Objects.requireNonNull(stopLoss, "stopLoss");
        this.takeProfit = Objects.requireNonNull(takeProfit, "takeProfit");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt");
        this.signalStrength = signalStrength == null ? BigDecimal.ZERO : signalStrength;
        this.orderId = orderId;
    }

    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getStopLoss() { return stopLoss; }
    public BigDecimal getTakeProfit() { return takeProfit; }
    public Instant getOpenedAt() { return openedAt; }
    public BigDecimal getSignalStrength() { return signalStrength; }
    public String getOrderId() { return orderId; }

    /**
     * 按给定价格计算盈亏（多头 (价-开仓价)*数量，空头相反）
     */
    public BigDecimal pnlAt(BigDecimal price) {
        BigDecimal diff = side.isLong() ? price.subtract(entryPrice) : entryPrice.subtract(price);
        return Decimal.scalePrice(diff.multiply(quantity));
    }

    /**
     * 检查是否触发止损
     */
    public boolean isStopLossTriggered(BigDecimal price) {
        return side.isLong()
                ? price.compareTo(stopLoss) <= 0
                : price.compareTo(stopLoss) >= 0;
    }

    /**
     * 检查是否达到止盈
     */
    public boolean isTakeProfitReached(BigDecimal price) {
        return side.isLong()
                ? price.compareTo(takeProfit) >= 0
                : price.compareTo(takeProfit) <= 0;
    }

    public Duration holdingDuration(Instant now) {
        return Duration.between(openedAt, now);
    }

    /**
     * 追踪止损：只允许向有利方向移动
     * @return 是否发生了移动
     */
    boolean trailStopLoss(BigDecimal candidate) {
        boolean improves = side.isLong()
                ? candidate.compareTo(stopLoss) > 0
                : candidate.compareTo(stopLoss) < 0;
        if (improves) {
            stopLoss = candidate;
        }
        return improves;
    }

    @Override
    public String toString() {
        return String.format("Position{symbol=%s, side=%s, entry=%s, qty=%s, stopLoss=%s, takeProfit=%s, openedAt=%s}",
                symbol, side, entryPrice, quantity, stopLoss, takeProfit, openedAt);
    }
}
