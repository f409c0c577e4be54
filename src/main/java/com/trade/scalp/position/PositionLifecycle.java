package com.trade.scalp.position;

import com.trade.scalp.core.Decimal;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.indicator.IndicatorConfig;
import com.trade.scalp.indicator.IndicatorSnapshot;
import com.trade.scalp.strategy.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * 单个交易对的持仓状态机
 *
 * NONE -> OPENING -> OPEN -> CLOSING -> NONE
 *
 * 外部下单期间停留在 OPENING / CLOSING，交易对锁不跨越下单调用。
 * 状态转换都在交易对锁内调用；state 可无锁读取，仅用于统计持仓数。
 */
public class PositionLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(PositionLifecycle.class);

    private final Symbol symbol;
    private final TradingConfig tradingConfig;
    private final BigDecimal rsiOverbought;
    private final BigDecimal rsiOversold;

    private volatile PositionState state = PositionState.NONE;  // 允许无锁读取计数
    private Position position;
    private ExitDecision pendingExit;

    public PositionLifecycle(Symbol symbol, TradingConfig tradingConfig, IndicatorConfig indicatorConfig) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
        this.tradingConfig = Objects.requireNonNull(tradingConfig, "tradingConfig");
        this.rsiOverbought = indicatorConfig.getRsiOverbought();
        this.rsiOversold = indicatorConfig.getRsiOversold();
    }

    /**
     * NONE -> OPENING
     * @return false 表示已有持仓或正在开/平仓，拒绝第二个持仓
     */
    public boolean beginOpen() {
        if (state != PositionState.NONE) {
            logger.warn("[并发异常] {} 当前状态 {}，拒绝再次开仓", symbol, state);
            return false;
        }
        state = PositionState.OPENING;
        return true;
    }

    /**
     * OPENING -> OPEN，开仓订单成功
     */
    public void completeOpen(Position opened) {
        requireState(PositionState.OPENING, "completeOpen");
        if (!symbol.equals(opened.getSymbol())) {
            throw new IllegalArgumentException("持仓交易对 " + opened.getSymbol() + " 不属于 " + symbol);
        }
        this.position = opened;
        this.state = PositionState.OPEN;
        logger.info("开仓完成: {}", opened);
    }

    /**
     * OPENING -> NONE，开仓订单失败
     */
    public void abortOpen() {
        requireState(PositionState.OPENING, "abortOpen");
        state = PositionState.NONE;
        logger.warn("{} 开仓失败，回到空仓", symbol);
    }

    /**
     * 每个周期检查离场条件，按优先级：止损 > 止盈 > 超时 > 技术离场，第一个满足的生效。
     * 无离场时按配置移动追踪止损。
     * @param snapshot 最新指标，可为空（跳过技术离场）
     */
    public Optional<ExitDecision> manage(BigDecimal price, IndicatorSnapshot snapshot, Instant now) {
        if (state != PositionState.OPEN) {
            return Optional.empty();
        }

        ExitReason reason = null;
        if (position.isStopLossTriggered(price)) {
            reason = ExitReason.STOP_LOSS;
        } else if (position.isTakeProfitReached(price)) {
            reason = ExitReason.TAKE_PROFIT;
        } else if (position.holdingDuration(now).compareTo(tradingConfig.getMaxPositionTime()) > 0) {
            reason = ExitReason.MAX_TIME;
        } else if (snapshot != null && technicalExit(snapshot)) {
            reason = ExitReason.TECHNICAL_EXIT;
        }

        if (reason != null) {
            logger.info("{} 触发离场: {} 价格={} 持仓={}", symbol, reason.getDescription(), price, position);
            return Optional.of(new ExitDecision(reason, price, now));
        }

        if (tradingConfig.isTrailingStopEnabled()) {
            trail(price);
        }
        return Optional.empty();
    }

    /**
     * 技术反转：多头 RSI 超买 / 跌破短EMA / MACD 下穿；空头镜像
     */
    private boolean technicalExit(IndicatorSnapshot s) {
        if (position.getSide().isLong()) {
            return s.getRsi().compareTo(rsiOverbought) > 0
                    || s.getClose().compareTo(s.getEmaShort()) < 0
                    || s.getMacd().compareTo(s.getMacdSignal()) < 0;
        }
        return s.getRsi().compareTo(rsiOversold) < 0
                || s.getClose().compareTo(s.getEmaShort()) > 0
                || s.getMacd().compareTo(s.getMacdSignal()) > 0;
    }

    private void trail(BigDecimal price) {
        BigDecimal percent = tradingConfig.getTrailingStopPercent();
        BigDecimal candidate = position.getSide().isLong()
                ? Decimal.offsetPercent(price, percent.negate())
                : Decimal.offsetPercent(price, percent);
        BigDecimal previous = position.getStopLoss();
        if (position.trailStopLoss(candidate)) {
            logger.info("更新追踪止损: {} {} -> {}", symbol, previous, candidate);
        }
    }

    /**
     * OPEN -> CLOSING
     */
    public void beginClose(ExitDecision decision) {
        requireState(PositionState.OPEN, "beginClose");
        this.pendingExit = Objects.requireNonNull(decision, "decision");
        this.state = PositionState.CLOSING;
    }

    /**
     * CLOSING -> NONE，平仓订单成功，计算已实现盈亏
     */
    public ClosedTrade completeClose(BigDecimal exitPrice, Instant closedAt) {
        requireState(PositionState.CLOSING, "completeClose");
        Position closed = position;
        BigDecimal pnl = closed.pnlAt(exitPrice);
        String tradeId = closed.getOrderId() != null ? closed.getOrderId() : UUID.randomUUID().toString();

        ClosedTrade trade = new ClosedTrade(tradeId, symbol, closed.getSide(),
                closed.getEntryPrice(), Decimal.scalePrice(exitPrice), closed.getQuantity(), pnl,
                closed.getOpenedAt(), closedAt, pendingExit.getReason(), closed.getSignalStrength());

        position = null;
        pendingExit = null;
        state = PositionState.NONE;
        logger.info("平仓完成: {}", trade);
        return trade;
    }

    /**
     * CLOSING -> OPEN，平仓订单失败，保留持仓等待下个周期
     */
    public void abortClose() {
        requireState(PositionState.CLOSING, "abortClose");
        pendingExit = null;
        state = PositionState.OPEN;
        logger.warn("{} 平仓失败，保留持仓", symbol);
    }

    public PositionState state() {
        return state;
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    public Optional<ExitDecision> pendingExit() {
        return Optional.ofNullable(pendingExit);
    }

    public boolean isOpen() {
        return state == PositionState.OPEN;
    }

    /**
     * 是否有敞口（开仓中、持仓中、平仓中）
     */
    public boolean hasExposure() {
        return state != PositionState.NONE;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    private void requireState(PositionState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException(String.format("%s 状态为 %s，无法执行 %s（需要 %s）",
                    symbol, state, operation, expected));
        }
    }
}
