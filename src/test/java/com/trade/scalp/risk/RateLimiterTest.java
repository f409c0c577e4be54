package com.trade.scalp.risk;

import com.trade.scalp.core.Symbol;
import com.trade.scalp.market.ReplayClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 频率限制器单元测试
 */
class RateLimiterTest {

    private static final Symbol BTC = Symbol.of("BTCUSDT");
    private static final Symbol ETH = Symbol.of("ETHUSDT");
    private static final Instant MONDAY_10AM = Instant.parse("2024-03-04T10:00:00Z");

    private ReplayClock clock;

    @BeforeEach
    void setUp() {
        clock = new ReplayClock(MONDAY_10AM, ZoneOffset.UTC);
    }

    @Test
    void signalCheck_respectsInterval() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(), clock);

        assertTrue(limiter.canCheckSignal(BTC));
        limiter.registerSignal(BTC);
        assertFalse(limiter.canCheckSignal(BTC));
        assertTrue(limiter.canCheckSignal(ETH));
        assertEquals(MONDAY_10AM.plusSeconds(300), limiter.nextSignalTime(BTC));

        clock.advance(Duration.ofSeconds(300));
        assertTrue(limiter.canCheckSignal(BTC));
    }

    @Test
    void canCheckDoesNotRegister() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(), clock);

        assertTrue(limiter.canCheckSignal(BTC));
        assertTrue(limiter.canCheckSignal(BTC));
        assertTrue(limiter.canPlaceOrder(BTC));
        assertEquals(0, limiter.dailyOrderCount());
    }

    @Test
    void order_cooldownPerSymbol() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(), clock);
        limiter.registerOrder(BTC);

        clock.advance(Duration.ofSeconds(1000));
        assertFalse(limiter.canPlaceOrder(BTC));
        assertTrue(limiter.canPlaceOrder(ETH));

        clock.advance(Duration.ofSeconds(801));
        assertTrue(limiter.canPlaceOrder(BTC));
        assertEquals(MONDAY_10AM.plusSeconds(1800), limiter.nextOrderTime(BTC));
    }

    @Test
    void order_dailyCapResetsNextDay() {
        RateLimitConfig config = RateLimitConfig.builder().maxDailyOrders(2).build();
        RateLimiter limiter = new RateLimiter(config, clock);
        limiter.registerOrder(BTC);
        limiter.registerOrder(ETH);

        assertEquals(2, limiter.dailyOrderCount());
        assertFalse(limiter.canPlaceOrder(Symbol.of("SOLUSDT")));

        clock.advance(Duration.ofDays(1));
        assertEquals(0, limiter.dailyOrderCount());
        assertTrue(limiter.canPlaceOrder(Symbol.of("SOLUSDT")));
    }

    @Test
    void reserveOrder_holdsDailySlotUntilReleased() {
        RateLimitConfig config = RateLimitConfig.builder().maxDailyOrders(1).build();
        RateLimiter limiter = new RateLimiter(config, clock);

        Optional<RateLimiter.OrderSlot> slot = limiter.reserveOrder(BTC);
        assertTrue(slot.isPresent());
        assertEquals(1, limiter.dailyOrderCount());
        assertFalse(limiter.canPlaceOrder(ETH));
        assertTrue(limiter.reserveOrder(ETH).isEmpty());

        limiter.releaseOrder(slot.get());
        assertEquals(0, limiter.dailyOrderCount());
        assertTrue(limiter.canPlaceOrder(BTC));
        assertEquals(MONDAY_10AM, limiter.nextOrderTime(BTC));
    }

    @Test
    void releaseOrder_restoresPreviousOrderTime() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(), clock);
        limiter.registerOrder(BTC);

        clock.advance(Duration.ofSeconds(1800));
        RateLimiter.OrderSlot slot = limiter.reserveOrder(BTC).orElseThrow();
        assertEquals(MONDAY_10AM.plusSeconds(3600), limiter.nextOrderTime(BTC));

        limiter.releaseOrder(slot);
        assertEquals(1, limiter.dailyOrderCount());
        assertEquals(MONDAY_10AM.plusSeconds(1800), limiter.nextOrderTime(BTC));
        assertTrue(limiter.canPlaceOrder(BTC));
    }

    @Test
    void tradingHoursAndDays() {
        RateLimiter limiter = new RateLimiter(new RateLimitConfig(), clock);
        assertTrue(limiter.isTradingTime());

        // 21 点为结束（不含）
        clock.setInstant(Instant.parse("2024-03-04T21:00:00Z"));
        assertFalse(limiter.isTradingTime());
        assertFalse(limiter.canCheckSignal(BTC));
        assertFalse(limiter.canPlaceOrder(BTC));

        // 周六
        clock.setInstant(Instant.parse("2024-03-09T10:00:00Z"));
        assertFalse(limiter.isTradingTime());
    }

    @Test
    void allDayConfigTradesAnyTime() {
        RateLimiter limiter = new RateLimiter(RateLimitConfig.builder().allDay().build(), clock);

        clock.setInstant(Instant.parse("2024-03-09T23:30:00Z"));
        assertTrue(limiter.isTradingTime());
        assertTrue(limiter.canCheckSignal(BTC));
    }

    @Test
    void tradingDaysUseIsoNumbers() {
        RateLimitConfig config = RateLimitConfig.builder().tradingDays(List.of(6, 7)).build();
        RateLimiter limiter = new RateLimiter(config, clock);

        assertFalse(limiter.isTradingTime());
        clock.setInstant(Instant.parse("2024-03-10T10:00:00Z"));
        assertTrue(limiter.isTradingTime());

        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder().tradingDays(List.of(8)));
        assertThrows(IllegalArgumentException.class, () -> RateLimitConfig.builder().tradingHours(21, 9).build());
    }
}
