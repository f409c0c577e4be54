package com.trade.scalp.risk;

import com.trade.scalp.core.Decimal;
import com.trade.scalp.strategy.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Objects;

/**
 * 风控模块
 *
 * 职责：
 * 1. 对信号做开仓前检查（当日亏损、持仓数、开仓间隔、仓位价值、单笔风险）
 * 2. 计算仓位大小
 * 3. 维护当日统计，跨日时先清零再记录
 *
 * 风控模块有最终否决权。当日统计为全局状态，所有读写都在本对象的锁内。
 */
public class RiskManager {

    private static final Logger logger = LoggerFactory.getLogger(RiskManager.class);

    private final RiskConfig config;
    private final Clock clock;

    private volatile boolean tradingEnabled = true;
    private volatile Instant lastTradeAt;

    // 以下字段由 this 保护
    private DailyRiskStats daily;
    private final Deque<BigDecimal> tradeHistory = new ArrayDeque<>();

    public RiskManager(RiskConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.daily = DailyRiskStats.empty(today());
    }

    /**
     * 检查信号，按顺序执行各项检查，第一项失败即拒绝，不修改任何状态
     * @param accountBalance 账户余额（缓存值）
     * @param openPositionCount 当前持仓数（含开仓中）
     */
    public RiskDecision validate(Signal signal, BigDecimal accountBalance, int openPositionCount) {
        // 1. 全局开关
        if (!tradingEnabled) {
            return reject(signal, RejectReason.TRADING_DISABLED, "已紧急停止");
        }

        BigDecimal balance = accountBalance == null ? BigDecimal.ZERO : accountBalance;

        // 2. 当日亏损
        BigDecimal realized = getDailyStats().getRealizedPnl();
        BigDecimal dailyLimit = balance.multiply(config.getMaxDailyLoss());
        if (realized.signum() < 0 && realized.abs().compareTo(dailyLimit) >= 0) {
            return reject(signal, RejectReason.DAILY_LOSS_LIMIT,
                    String.format("当日已实现亏损 %s >= 上限 %s", realized.abs(), dailyLimit));
        }

        // 3. 持仓数
        if (openPositionCount >= config.getMaxOpenPositions()) {
            return reject(signal, RejectReason.MAX_OPEN_POSITIONS,
                    String.format("当前持仓 %d >= 上限 %d", openPositionCount, config.getMaxOpenPositions()));
        }

        // 4. 开仓间隔（任意交易对）
        Instant last = lastTradeAt;
        if (last != null) {
            Duration elapsed = Duration.between(last, clock.instant());
            if (elapsed.compareTo(config.getMinTimeBetweenTrades()) < 0) {
                return reject(signal, RejectReason.TRADE_INTERVAL,
                        String.format("距上次开仓 %ds < %ds", elapsed.getSeconds(),
                                config.getMinTimeBetweenTrades().getSeconds()));
            }
        }

        BigDecimal quantity = size(signal.getPrice(), signal.getStopLoss(), balance);

        // 5. 仓位价值
        BigDecimal notional = quantity.multiply(signal.getPrice());
        BigDecimal notionalLimit = balance.multiply(config.getMaxPositionSize());
        if (notional.compareTo(notionalLimit) > 0) {
            return reject(signal, RejectReason.POSITION_SIZE_LIMIT,
                    String.format("仓位价值 %s > 上限 %s", Decimal.scalePrice(notional), notionalLimit));
        }

        // 6. 单笔风险：止损距离 × 数量
        BigDecimal risk = signal.stopDistance().multiply(quantity);
        BigDecimal riskLimit = balance.multiply(config.getMaxPositionLoss());
        if (risk.compareTo(riskLimit) > 0) {
            return reject(signal, RejectReason.POSITION_LOSS_LIMIT,
                    String.format("单笔风险 %s > 上限 %s", Decimal.scalePrice(risk), riskLimit));
        }

        // 7. 仓位有效性
        if (!Decimal.isPositive(quantity)) {
            return reject(signal, RejectReason.INVALID_SIZE,
                    String.format("余额=%s 价格=%s 计算数量为0", balance, signal.getPrice()));
        }

        logger.info("风控通过: {} {} 数量={}", signal.getSymbol(), signal.getSide(), quantity);
        return RiskDecision.accepted(quantity);
    }

    /**
     * 计算仓位数量
     * 固定名义金额：fixedLot / 价格；否则 余额 × 默认比例，限制在 [最小, 最大] 比例内，再除以价格
     * @return 数量，输入非正时返回0
     */
    public BigDecimal size(BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal balance) {
        if (!Decimal.isPositive(entryPrice) || !Decimal.isPositive(stopLoss) || !Decimal.isPositive(balance)) {
            return BigDecimal.ZERO;
        }
        if (config.isUseFixedLot()) {
            return config.getFixedLotSize().divide(entryPrice, Decimal.QUANTITY_SCALE, RoundingMode.DOWN);
        }

        BigDecimal value = balance.multiply(config.getDefaultPositionSize());
        BigDecimal maxValue = balance.multiply(config.getMaxPositionSize());
        BigDecimal minValue = balance.multiply(config.getMinPositionSize());
        value = Decimal.min(Decimal.max(value, minValue), maxValue);

        return value.divide(entryPrice, Decimal.QUANTITY_SCALE, RoundingMode.DOWN);
    }

    /**
     * 记录开仓时间，用于开仓间隔检查
     * 开仓单发出前调用即可占住间隔，下单失败时用返回值调用 {@link #releaseEntry}
     * @return 之前的开仓时间，从未开仓时为 null
     */
    public synchronized Instant recordEntry(Instant openedAt) {
        Instant previous = lastTradeAt;
        this.lastTradeAt = openedAt;
        return previous;
    }

    /**
     * 撤销 recordEntry，期间若已有更新的开仓记录则保持不变
     */
    public synchronized void releaseEntry(Instant recorded, Instant previous) {
        if (recorded.equals(lastTradeAt)) {
            lastTradeAt = previous;
        }
    }

    /**
     * 记录平仓结果，跨日时先清零当日统计
     */
    public synchronized void recordResult(BigDecimal pnl, TradeOutcome outcome) {
        rolloverIfNeeded();
        daily = daily.record(pnl, outcome);

        tradeHistory.addLast(pnl);
        while (tradeHistory.size() > config.getMaxTradeHistory()) {
            tradeHistory.removeFirst();
        }
        logger.info("记录交易结果: pnl={} {}, 当日 {}", pnl, outcome, daily);
    }

    /**
     * 当日统计快照
     */
    public synchronized DailyRiskStats getDailyStats() {
        rolloverIfNeeded();
        return daily;
    }

    /**
     * 保留的交易记录统计
     */
    public synchronized TradeStatistics getStatistics() {
        return TradeStatistics.fromPnls(new ArrayList<>(tradeHistory));
    }

    /**
     * 紧急停止交易
     */
    public void emergencyStop() {
        tradingEnabled = false;
        logger.warn("风控紧急停止，拒绝所有新开仓");
    }

    /**
     * 恢复交易
     */
    public void resumeTrading() {
        tradingEnabled = true;
        logger.info("风控恢复交易");
    }

    public boolean isTradingEnabled() {
        return tradingEnabled;
    }

    public RiskConfig getConfig() {
        return config;
    }

    private void rolloverIfNeeded() {
        LocalDate today = today();
        if (!today.equals(daily.getDate())) {
            logger.info("新交易日 {}，清零当日统计（前一日 {}）", today, daily);
            daily = DailyRiskStats.empty(today);
        }
    }

    private LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    private RiskDecision reject(Signal signal, RejectReason reason, String detail) {
        logger.warn("[风控拒绝] {} {} - 原因: {}, {}", signal.getSymbol(), signal.getSide(),
                reason.getDescription(), detail);
        return RiskDecision.rejected(reason, detail);
    }
}
