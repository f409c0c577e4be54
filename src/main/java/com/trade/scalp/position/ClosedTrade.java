package com.trade.scalp.position;

import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * 已平仓交易记录
 * 包含完整的入场和出场信息，由 {@link PositionLifecycle#completeClose} 产生
 */
public class ClosedTrade {
    private final String tradeId;
    private final Symbol symbol;
    private final Side side;
    private final BigDecimal entryPrice;
    private final BigDecimal exitPrice;
    private final BigDecimal quantity;
    private final BigDecimal pnl;
    private final Instant openedAt;
    private final Instant closedAt;
    private final ExitReason reason;
    private final BigDecimal signalStrength;

    public ClosedTrade(String tradeId, Symbol symbol, Side side,
                       BigDecimal entryPrice, BigDecimal exitPrice, BigDecimal quantity,
                       BigDecimal pnl, Instant openedAt, Instant closedAt,
                       ExitReason reason, BigDecimal signalStrength) {
        this.tradeId = tradeId;
        this.symbol = symbol;
        this.side = side;
        this.entryPrice = entryPrice;
        this.exitPrice = exitPrice;
        this.quantity = quantity;
        this.pnl = pnl;
        this.openedAt = openedAt;
        this.closedAt = closedAt;
        this.reason = reason;
        this.signalStrength = signalStrength;
    }

    public String getTradeId() { return tradeId; }
    public Symbol getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getExitPrice() { return exitPrice; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPnl() { return pnl; }
    public Instant getOpenedAt() { return openedAt; }
    public Instant getClosedAt() { return closedAt; }
    public ExitReason getReason() { return reason; }
    public BigDecimal getSignalStrength() { return signalStrength; }

    public boolean isWin() {
        return pnl.compareTo(BigDecimal.ZERO) > 0;
    }

    public Duration getHoldingDuration() {
        return Duration.between(openedAt, closedAt);
    }

    /**
     * 收益率（百分比）
     */
    public BigDecimal getReturnPercent() {
        BigDecimal entryValue = entryPrice.multiply(quantity);
        if (entryValue.compareTo(BigDecimal.ZERO) == 0) {
            return BigDecimal.ZERO;
        }
        return pnl.divide(entryValue, 4, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(100));
    }

    @Override
    public String toString() {
        return String.format("ClosedTrade{id=%s, %s %s, entry=%s, exit=%s, qty=%s, pnl=%s, reason=%s, %s -> %s}",
                tradeId, symbol, side, entryPrice, exitPrice, quantity, pnl, reason, openedAt, closedAt);
    }
}
