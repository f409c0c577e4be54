package com.trade.scalp.strategy;

import com.trade.scalp.core.ConfigManager;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * 交易配置：信号阈值、止盈止损、持仓时长、追踪止损
 */
public class TradingConfig {

    private Duration maxPositionTime = Duration.ofMinutes(10);           // 最长持仓时间
    private BigDecimal maxRiskPercent = BigDecimal.valueOf(5);           // 止损距离上限（%）
    private BigDecimal minSignalStrength = BigDecimal.valueOf(50);       // 最小信号强度
    private BigDecimal stopLossPercent = new BigDecimal("0.7");          // 止损百分比
    private BigDecimal takeProfitPercent = new BigDecimal("1.8");        // 止盈百分比
    private boolean trailingStopEnabled = true;                          // 启用追踪止损
    private BigDecimal trailingStopPercent = new BigDecimal("0.5");      // 追踪止损距离（%）
    private boolean requireVolumeConfirmation = false;                   // 需要成交量确认
    private BigDecimal minVolumeRatio = new BigDecimal("1.2");           // 最小成交量倍数

    public Duration getMaxPositionTime() { return maxPositionTime; }
    public BigDecimal getMaxRiskPercent() { return maxRiskPercent; }
    public BigDecimal getMinSignalStrength() { return minSignalStrength; }
    public BigDecimal getStopLossPercent() { return stopLossPercent; }
    public BigDecimal getTakeProfitPercent() { return takeProfitPercent; }
    public boolean isTrailingStopEnabled() { return trailingStopEnabled; }
    public BigDecimal getTrailingStopPercent() { return trailingStopPercent; }
    public boolean isRequireVolumeConfirmation() { return requireVolumeConfirmation; }
    public BigDecimal getMinVolumeRatio() { return minVolumeRatio; }

    public void validate() {
        if (maxPositionTime == null || maxPositionTime.isNegative() || maxPositionTime.isZero()) {
            throw new IllegalArgumentException("最长持仓时间必须大于0");
        }
        if (minSignalStrength.signum() < 0 || minSignalStrength.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("最小信号强度必须在0-100之间");
        }
        if (stopLossPercent.signum() <= 0 || takeProfitPercent.signum() <= 0) {
            throw new IllegalArgumentException("止损/止盈百分比必须大于0");
        }
        if (stopLossPercent.compareTo(BigDecimal.valueOf(100)) >= 0) {
            throw new IllegalArgumentException("止损百分比必须小于100");
        }
        if (stopLossPercent.compareTo(maxRiskPercent) > 0) {
            throw new IllegalArgumentException("止损百分比 " + stopLossPercent + "% 超过风险上限 " + maxRiskPercent + "%");
        }
        if (trailingStopEnabled && trailingStopPercent.signum() <= 0) {
            throw new IllegalArgumentException("追踪止损百分比必须大于0");
        }
        if (minVolumeRatio.signum() <= 0) {
            throw new IllegalArgumentException("成交量倍数必须大于0");
        }
    }

    public static TradingConfig fromConfig(ConfigManager cfg) {
        TradingConfig defaults = new TradingConfig();
        return builder()
                .maxPositionTime(Duration.ofSeconds(cfg.getLongProperty("trading.max.position.time.seconds",
                        defaults.maxPositionTime.getSeconds())))
                .maxRiskPercent(cfg.getDecimalProperty("trading.max.risk.percent", defaults.maxRiskPercent))
                .minSignalStrength(cfg.getDecimalProperty("trading.min.signal.strength", defaults.minSignalStrength))
                .stopLossPercent(cfg.getDecimalProperty("trading.stop.loss.percent", defaults.stopLossPercent))
                .takeProfitPercent(cfg.getDecimalProperty("trading.take.profit.percent", defaults.takeProfitPercent))
                .trailingStop(cfg.getBooleanProperty("trading.trailing.stop.enabled", defaults.trailingStopEnabled),
                        cfg.getDecimalProperty("trading.trailing.stop.percent", defaults.trailingStopPercent))
                .volumeConfirmation(cfg.getBooleanProperty("trading.volume.confirmation", defaults.requireVolumeConfirmation),
                        cfg.getDecimalProperty("trading.volume.min.ratio", defaults.minVolumeRatio))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final TradingConfig config = new TradingConfig();

        public Builder maxPositionTime(Duration value) {
            config.maxPositionTime = value;
            return this;
        }

        public Builder maxRiskPercent(BigDecimal value) {
            config.maxRiskPercent = value;
            return this;
        }

        public Builder minSignalStrength(BigDecimal value) {
            config.minSignalStrength = value;
            return this;
        }

        public Builder stopLossPercent(BigDecimal value) {
            config.stopLossPercent = value;
            return this;
        }

        public Builder takeProfitPercent(BigDecimal value) {
            config.takeProfitPercent = value;
            return this;
        }

        public Builder trailingStop(boolean enabled, BigDecimal percent) {
            config.trailingStopEnabled = enabled;
            config.trailingStopPercent = percent;
            return this;
        }

        public Builder volumeConfirmation(boolean required, BigDecimal minRatio) {
            config.requireVolumeConfirmation = required;
            config.minVolumeRatio = minRatio;
            return this;
        }

        public TradingConfig build() {
            config.validate();
            return config;
        }
    }
}
