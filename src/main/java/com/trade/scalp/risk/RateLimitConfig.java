package com.trade.scalp.risk;

import com.trade.scalp.core.ConfigManager;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 频率限制配置：信号检查间隔、下单冷却、每日下单上限、交易时段
 */
public class RateLimitConfig {

    private Duration signalCheckInterval = Duration.ofSeconds(300);
    private Duration orderCooldown = Duration.ofSeconds(1800);
    private int maxDailyOrders = 10;
    private int tradingHoursStart = 9;     // 含
    private int tradingHoursEnd = 21;      // 不含
    private Set<DayOfWeek> tradingDays = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);

    public Duration getSignalCheckInterval() { return signalCheckInterval; }
    public Duration getOrderCooldown() { return orderCooldown; }
    public int getMaxDailyOrders() { return maxDailyOrders; }
    public int getTradingHoursStart() { return tradingHoursStart; }
    public int getTradingHoursEnd() { return tradingHoursEnd; }
    public Set<DayOfWeek> getTradingDays() { return Collections.unmodifiableSet(tradingDays); }

    public void validate() {
        if (signalCheckInterval.isNegative() || orderCooldown.isNegative()) {
            throw new IllegalArgumentException("间隔不能为负");
        }
        if (maxDailyOrders <= 0) {
            throw new IllegalArgumentException("每日下单上限必须大于0");
        }
        if (tradingHoursStart < 0 || tradingHoursEnd > 24 || tradingHoursStart >= tradingHoursEnd) {
            throw new IllegalArgumentException("交易时段无效: " + tradingHoursStart + "-" + tradingHoursEnd);
        }
        if (tradingDays.isEmpty()) {
            throw new IllegalArgumentException("交易日不能为空");
        }
    }

    public static RateLimitConfig fromConfig(ConfigManager cfg) {
        RateLimitConfig defaults = new RateLimitConfig();
        return builder()
                .signalCheckInterval(Duration.ofSeconds(cfg.getLongProperty("ratelimit.signal.check.interval.seconds",
                        defaults.signalCheckInterval.getSeconds())))
                .orderCooldown(Duration.ofSeconds(cfg.getLongProperty("ratelimit.order.cooldown.seconds",
                        defaults.orderCooldown.getSeconds())))
                .maxDailyOrders(cfg.getIntProperty("ratelimit.max.daily.orders", defaults.maxDailyOrders))
                .tradingHours(cfg.getIntProperty("ratelimit.trading.hours.start", defaults.tradingHoursStart),
                        cfg.getIntProperty("ratelimit.trading.hours.end", defaults.tradingHoursEnd))
                .tradingDays(cfg.getIntListProperty("ratelimit.trading.days", List.of(1, 2, 3, 4, 5)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final RateLimitConfig config = new RateLimitConfig();

        public Builder signalCheckInterval(Duration value) {
            config.signalCheckInterval = value;
            return this;
        }

        public Builder orderCooldown(Duration value) {
            config.orderCooldown = value;
            return this;
        }

        public Builder maxDailyOrders(int value) {
            config.maxDailyOrders = value;
            return this;
        }

        public Builder tradingHours(int startInclusive, int endExclusive) {
            config.tradingHoursStart = startInclusive;
            config.tradingHoursEnd = endExclusive;
            return this;
        }

        /**
         * ISO 星期：1 = 周一 ... 7 = 周日
         */
        public Builder tradingDays(List<Integer> isoDays) {
            Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            for (Integer day : isoDays) {
                if (day == null || day < 1 || day > 7) {
                    throw new IllegalArgumentException("交易日必须在1-7之间: " + day);
                }
                days.add(DayOfWeek.of(day));
            }
            config.tradingDays = days;
            return this;
        }

        /**
         * 全天候交易
         */
        public Builder allDay() {
            config.tradingHoursStart = 0;
            config.tradingHoursEnd = 24;
            config.tradingDays = EnumSet.allOf(DayOfWeek.class);
            return this;
        }

        public RateLimitConfig build() {
            config.validate();
            return config;
        }
    }
}
