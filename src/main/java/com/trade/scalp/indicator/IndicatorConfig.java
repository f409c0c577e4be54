package com.trade.scalp.indicator;

import com.trade.scalp.core.ConfigManager;

import java.math.BigDecimal;

/**
 * 指标参数配置
 * 默认值为 1 分钟剥头皮参数
 */
public class IndicatorConfig {

    private int emaShort = 3;                                   // 短期EMA周期
    private int emaLong = 7;                                    // 长期EMA周期
    private int rsiPeriod = 5;                                  // RSI周期
    private BigDecimal rsiOverbought = BigDecimal.valueOf(70);  // RSI超买阈值
    private BigDecimal rsiOversold = BigDecimal.valueOf(30);    // RSI超卖阈值
    private int macdFast = 8;
    private int macdSlow = 17;
    private int macdSignal = 7;
    private int bbPeriod = 10;                                  // 布林带周期
    private BigDecimal bbStdDev = BigDecimal.valueOf(2);        // 布林带标准差倍数
    private int momentumPeriod = 3;
    private int volumeMaPeriod = 20;                            // 成交量均线周期

    public int getEmaShort() { return emaShort; }
    public int getEmaLong() { return emaLong; }
    public int getRsiPeriod() { return rsiPeriod; }
    public BigDecimal getRsiOverbought() { return rsiOverbought; }
    public BigDecimal getRsiOversold() { return rsiOversold; }
    public int getMacdFast() { return macdFast; }
    public int getMacdSlow() { return macdSlow; }
    public int getMacdSignal() { return macdSignal; }
    public int getBbPeriod() { return bbPeriod; }
    public BigDecimal getBbStdDev() { return bbStdDev; }
    public int getMomentumPeriod() { return momentumPeriod; }
    public int getVolumeMaPeriod() { return volumeMaPeriod; }

    /**
     * 产生完整快照所需的最少K线数量
     */
    public int requiredLookback() {
        int required = emaLong;
        required = Math.max(required, rsiPeriod + 1);
        required = Math.max(required, macdSlow);
        required = Math.max(required, bbPeriod);
        required = Math.max(required, momentumPeriod + 1);
        return required;
    }

    /**
     * 校验参数组合
     * @throws IllegalArgumentException 参数非法
     */
    public void validate() {
        if (emaShort <= 0 || emaLong <= 0 || rsiPeriod <= 0 || macdFast <= 0 || macdSlow <= 0
                || macdSignal <= 0 || bbPeriod <= 1 || momentumPeriod <= 0 || volumeMaPeriod <= 0) {
            throw new IllegalArgumentException("指标周期必须大于0（布林带周期必须大于1）");
        }
        if (emaShort >= emaLong) {
            throw new IllegalArgumentException("短期EMA周期必须小于长期EMA周期: " + emaShort + " >= " + emaLong);
        }
        if (macdFast >= macdSlow) {
            throw new IllegalArgumentException("MACD快线周期必须小于慢线周期: " + macdFast + " >= " + macdSlow);
        }
        if (bbStdDev == null || bbStdDev.signum() <= 0) {
            throw new IllegalArgumentException("布林带标准差倍数必须大于0");
        }
        if (rsiOversold == null || rsiOverbought == null || rsiOversold.compareTo(rsiOverbought) >= 0) {
            throw new IllegalArgumentException("RSI超卖阈值必须小于超买阈值");
        }
    }

    /**
     * 从配置文件读取，缺失项使用默认值
     */
    public static IndicatorConfig fromConfig(ConfigManager cfg) {
        IndicatorConfig defaults = new IndicatorConfig();
        return builder()
                .ema(cfg.getIntProperty("indicator.ema.short", defaults.emaShort),
                        cfg.getIntProperty("indicator.ema.long", defaults.emaLong))
                .rsiPeriod(cfg.getIntProperty("indicator.rsi.period", defaults.rsiPeriod))
                .rsiThresholds(cfg.getDecimalProperty("indicator.rsi.oversold", defaults.rsiOversold),
                        cfg.getDecimalProperty("indicator.rsi.overbought", defaults.rsiOverbought))
                .macd(cfg.getIntProperty("indicator.macd.fast", defaults.macdFast),
                        cfg.getIntProperty("indicator.macd.slow", defaults.macdSlow),
                        cfg.getIntProperty("indicator.macd.signal", defaults.macdSignal))
                .bollinger(cfg.getIntProperty("indicator.bb.period", defaults.bbPeriod),
                        cfg.getDecimalProperty("indicator.bb.stddev", defaults.bbStdDev))
                .momentumPeriod(cfg.getIntProperty("indicator.momentum.period", defaults.momentumPeriod))
                .volumeMaPeriod(cfg.getIntProperty("indicator.volume.ma.period", defaults.volumeMaPeriod))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final IndicatorConfig config = new IndicatorConfig();

        public Builder ema(int shortPeriod, int longPeriod) {
            config.emaShort = shortPeriod;
            config.emaLong = longPeriod;
            return this;
        }

        public Builder rsiPeriod(int value) {
            config.rsiPeriod = value;
            return this;
        }

        public Builder rsiThresholds(BigDecimal oversold, BigDecimal overbought) {
            config.rsiOversold = oversold;
            config.rsiOverbought = overbought;
            return this;
        }

        public Builder macd(int fast, int slow, int signal) {
            config.macdFast = fast;
            config.macdSlow = slow;
            config.macdSignal = signal;
            return this;
        }

        public Builder bollinger(int period, BigDecimal stdDev) {
            config.bbPeriod = period;
            config.bbStdDev = stdDev;
            return this;
        }

        public Builder momentumPeriod(int value) {
            config.momentumPeriod = value;
            return this;
        }

        public Builder volumeMaPeriod(int value) {
            config.volumeMaPeriod = value;
            return this;
        }

        public IndicatorConfig build() {
            config.validate();
            return config;
        }
    }

    @Override
    public String toString() {
        return String.format("IndicatorConfig{ema=%d/%d, rsi=%d(%s/%s), macd=%d/%d/%d, bb=%dx%s, momentum=%d, volumeMa=%d}",
                emaShort, emaLong, rsiPeriod, rsiOversold, rsiOverbought, macdFast, macdSlow, macdSignal,
                bbPeriod, bbStdDev, momentumPeriod, volumeMaPeriod);
    }
}
