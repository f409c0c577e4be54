package com.trade.scalp.risk;

import com.trade.scalp.core.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 频率限制器
 *
 * canCheckSignal / canPlaceOrder 为两个独立的闸门，只检查不登记；
 * 调用方在动作成功后自行调用 registerSignal / registerOrder。
 * 下单结果未知时可用 reserveOrder 先占用当日名额，下单失败后 releaseOrder 归还。
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final RateLimitConfig config;
    private final Clock clock;

    private final Map<Symbol, Instant> lastSignalChecks = new ConcurrentHashMap<>();
    private final Map<Symbol, Instant> lastOrders = new ConcurrentHashMap<>();

    // 由 this 保护
    private int dailyOrders;
    private LocalDate counterDate;

    public RateLimiter(RateLimitConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.counterDate = LocalDate.ofInstant(clock.instant(), clock.getZone());
    }

    /**
     * 是否允许检查信号：距上次检查已满间隔，且处于交易时段
     */
    public boolean canCheckSignal(Symbol symbol) {
        Instant now = clock.instant();
        Instant last = lastSignalChecks.get(symbol);
        if (last != null && Duration.between(last, now).compareTo(config.getSignalCheckInterval()) < 0) {
            logger.debug("{} 跳过信号检查: 间隔未到", symbol);
            return false;
        }
        if (!isTradingTime(now)) {
            logger.debug("{} 跳过信号检查: 非交易时段", symbol);
            return false;
        }
        return true;
    }

    /**
     * 是否允许下单：当日下单数未满、冷却已过、处于交易时段
     */
    public boolean canPlaceOrder(Symbol symbol) {
        Instant now = clock.instant();
        if (dailyOrderCount() >= config.getMaxDailyOrders()) {
            logger.info("{} 跳过下单: 当日下单数已达上限 {}", symbol, config.getMaxDailyOrders());
            return false;
        }
        Instant last = lastOrders.get(symbol);
        if (last != null && Duration.between(last, now).compareTo(config.getOrderCooldown()) < 0) {
            logger.debug("{} 跳过下单: 冷却中", symbol);
            return false;
        }
        if (!isTradingTime(now)) {
            logger.debug("{} 跳过下单: 非交易时段", symbol);
            return false;
        }
        return true;
    }

    public void registerSignal(Symbol symbol) {
        lastSignalChecks.put(symbol, clock.instant());
    }

    public void registerOrder(Symbol symbol) {
        register(symbol, clock.instant());
    }

    /**
     * 检查当日上限并登记下单，两步在同一把锁内完成
     * @return 当日下单数已满时为 empty
     */
    public synchronized Optional<OrderSlot> reserveOrder(Symbol symbol) {
        resetCounterIfNeeded();
        if (dailyOrders >= config.getMaxDailyOrders()) {
            logger.info("{} 无法占用下单名额: 当日已达上限 {}", symbol, config.getMaxDailyOrders());
            return Optional.empty();
        }
        Instant now = clock.instant();
        Instant previous = lastOrders.get(symbol);
        register(symbol, now);
        return Optional.of(new OrderSlot(symbol, now, previous, counterDate));
    }

    /**
     * 归还 reserveOrder 占用的名额，恢复该交易对之前的下单时间
     */
    public synchronized void releaseOrder(OrderSlot slot) {
        if (slot.date.equals(counterDate) && dailyOrders > 0) {
            dailyOrders--;
        }
        Symbol symbol = slot.symbol;
        if (slot.reservedAt.equals(lastOrders.get(symbol))) {
            if (slot.previous == null) {
                lastOrders.remove(symbol);
            } else {
                lastOrders.put(symbol, slot.previous);
            }
        }
        logger.info("归还下单名额: {}，当日 {} 单", symbol, dailyOrders);
    }

    private void register(Symbol symbol, Instant now) {
        lastOrders.put(symbol, now);
        int count;
        synchronized (this) {
            resetCounterIfNeeded();
            count = ++dailyOrders;
        }
        logger.info("登记下单: {}，当日第 {} 单", symbol, count);
    }

    /**
     * 下一次允许检查信号的时间，从未检查过时为当前时间
     */
    public Instant nextSignalTime(Symbol symbol) {
        Instant last = lastSignalChecks.get(symbol);
        return last == null ? clock.instant() : last.plus(config.getSignalCheckInterval());
    }

    /**
     * 下一次冷却结束的时间，从未下单时为当前时间
     */
    public Instant nextOrderTime(Symbol symbol) {
        Instant last = lastOrders.get(symbol);
        return last == null ? clock.instant() : last.plus(config.getOrderCooldown());
    }

    public synchronized int dailyOrderCount() {
        resetCounterIfNeeded();
        return dailyOrders;
    }

    public boolean isTradingTime() {
        return isTradingTime(clock.instant());
    }

    private boolean isTradingTime(Instant now) {
        ZonedDateTime local = now.atZone(clock.getZone());
        if (!config.getTradingDays().contains(local.getDayOfWeek())) {
            return false;
        }
        int hour = local.getHour();
        return hour >= config.getTradingHoursStart() && hour < config.getTradingHoursEnd();
    }

    private void resetCounterIfNeeded() {
        LocalDate today = LocalDate.ofInstant(clock.instant(), clock.getZone());
        if (!today.equals(counterDate)) {
            logger.info("新交易日 {}，重置下单计数（前一日 {} 单）", today, dailyOrders);
            dailyOrders = 0;
            counterDate = today;
        }
    }

    /**
     * 已占用的下单名额
     */
    public static final class OrderSlot {
        private final Symbol symbol;
        private final Instant reservedAt;
        private final Instant previous;
        private final LocalDate date;

        private OrderSlot(Symbol symbol, Instant reservedAt, Instant previous, LocalDate date) {
            this.symbol = symbol;
            this.reservedAt = reservedAt;
            this.previous = previous;
            this.date = date;
        }
    }
}
