package com.trade.scalp.risk;

import com.trade.scalp.core.ConfigManager;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 风控配置
 * 比例类参数均为账户余额的比例（0.05 = 5%）
 */
public class RiskConfig {

    private BigDecimal maxPositionSize = new BigDecimal("0.1");        // 最大仓位比例
    private BigDecimal minPositionSize = new BigDecimal("0.01");       // 最小仓位比例
    private BigDecimal defaultPositionSize = new BigDecimal("0.05");   // 默认仓位比例
    private BigDecimal fixedLotSize = BigDecimal.valueOf(100);         // 固定名义金额
    private boolean useFixedLot = false;                               // 使用固定名义金额
    private BigDecimal maxDailyLoss = new BigDecimal("0.05");          // 当日最大亏损比例
    private BigDecimal maxPositionLoss = new BigDecimal("0.02");       // 单笔最大风险比例
    private int maxOpenPositions = 3;                                  // 最大同时持仓数
    private Duration minTimeBetweenTrades = Duration.ofSeconds(300);   // 两次开仓最小间隔
    private int maxTradeHistory = 1000;                                // 保留的交易记录数

    public BigDecimal getMaxPositionSize() { return maxPositionSize; }
    public BigDecimal getMinPositionSize() { return minPositionSize; }
    public BigDecimal getDefaultPositionSize() { return defaultPositionSize; }
    public BigDecimal getFixedLotSize() { return fixedLotSize; }
    public boolean isUseFixedLot() { return useFixedLot; }
    public BigDecimal getMaxDailyLoss() { return maxDailyLoss; }
    public BigDecimal getMaxPositionLoss() { return maxPositionLoss; }
    public int getMaxOpenPositions() { return maxOpenPositions; }
    public Duration getMinTimeBetweenTrades() { return minTimeBetweenTrades; }
    public int getMaxTradeHistory() { return maxTradeHistory; }

    public void validate() {
        if (minPositionSize.signum() <= 0 || maxPositionSize.compareTo(minPositionSize) < 0) {
            throw new IllegalArgumentException("仓位比例区间无效: [" + minPositionSize + ", " + maxPositionSize + "]");
        }
        if (maxPositionSize.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("最大仓位比例不能超过1");
        }
        if (defaultPositionSize.signum() <= 0) {
            throw new IllegalArgumentException("默认仓位比例必须大于0");
        }
        if (useFixedLot && fixedLotSize.signum() <= 0) {
            throw new IllegalArgumentException("固定名义金额必须大于0");
        }
        if (maxDailyLoss.signum() <= 0 || maxPositionLoss.signum() <= 0) {
            throw new IllegalArgumentException("亏损上限比例必须大于0");
        }
        if (maxOpenPositions <= 0) {
            throw new IllegalArgumentException("最大持仓数必须大于0");
        }
        if (minTimeBetweenTrades.isNegative()) {
            throw new IllegalArgumentException("开仓间隔不能为负");
        }
        if (maxTradeHistory <= 0) {
            throw new IllegalArgumentException("交易记录数必须大于0");
        }
    }

    public static RiskConfig fromConfig(ConfigManager cfg) {
        RiskConfig defaults = new RiskConfig();
        return builder()
                .positionSize(cfg.getDecimalProperty("risk.min.position.size", defaults.minPositionSize),
                        cfg.getDecimalProperty("risk.default.position.size", defaults.defaultPositionSize),
                        cfg.getDecimalProperty("risk.max.position.size", defaults.maxPositionSize))
                .fixedLot(cfg.getBooleanProperty("risk.use.fixed.lot", defaults.useFixedLot),
                        cfg.getDecimalProperty("risk.fixed.lot.size", defaults.fixedLotSize))
                .maxDailyLoss(cfg.getDecimalProperty("risk.max.daily.loss", defaults.maxDailyLoss))
                .maxPositionLoss(cfg.getDecimalProperty("risk.max.position.loss", defaults.maxPositionLoss))
                .maxOpenPositions(cfg.getIntProperty("risk.max.open.positions", defaults.maxOpenPositions))
                .minTimeBetweenTrades(Duration.ofSeconds(cfg.getLongProperty("risk.min.time.between.trades.seconds",
                        defaults.minTimeBetweenTrades.getSeconds())))
                .maxTradeHistory(cfg.getIntProperty("risk.max.trade.history", defaults.maxTradeHistory))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final RiskConfig config = new RiskConfig();

        public Builder positionSize(BigDecimal min, BigDecimal defaultSize, BigDecimal max) {
            config.minPositionSize = min;
            config.defaultPositionSize = defaultSize;
            config.maxPositionSize = max;
            return this;
        }

        public Builder fixedLot(boolean enabled, BigDecimal lotSize) {
            config.useFixedLot = enabled;
            config.fixedLotSize = lotSize;
            return this;
        }

        public Builder maxDailyLoss(BigDecimal value) {
            config.maxDailyLoss = value;
            return this;
        }

        public Builder maxPositionLoss(BigDecimal value) {
            config.maxPositionLoss = value;
            return this;
        }

        public Builder maxOpenPositions(int value) {
            config.maxOpenPositions = value;
            return this;
        }

        public Builder minTimeBetweenTrades(Duration value) {
            config.minTimeBetweenTrades = value;
            return this;
        }

        public Builder maxTradeHistory(int value) {
            config.maxTradeHistory = value;
            return this;
        }

        public RiskConfig build() {
            config.validate();
            return config;
        }
    }
}
