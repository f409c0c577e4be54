package com.trade.scalp.execution;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.exchange.ExchangeException;
import com.trade.scalp.exchange.OrderExecutor;
import com.trade.scalp.exchange.PaperExchange;
import com.trade.scalp.indicator.IndicatorConfig;
import com.trade.scalp.market.ReplayClock;
import com.trade.scalp.position.ExitReason;
import com.trade.scalp.position.Position;
import com.trade.scalp.position.PositionState;
import com.trade.scalp.risk.RateLimitConfig;
import com.trade.scalp.risk.RateLimiter;
import com.trade.scalp.risk.RejectReason;
import com.trade.scalp.risk.RiskConfig;
import com.trade.scalp.risk.RiskManager;
import com.trade.scalp.strategy.TradingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.trade.scalp.execution.TradingEngineTest.BTC;
import static com.trade.scalp.execution.TradingEngineTest.ETH;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 多线程下的交易引擎测试
 * BTC 的开仓单在交易所挂起期间，ETH 的K线与 tick 在各自线程上继续执行
 */
class TradingEngineConcurrencyTest {

    private static final long TIMEOUT_SECONDS = 5;

    private ReplayClock clock;
    private PaperExchange exchange;
    private GatedOrderExecutor orders;
    private TradingEngineTest.RecordingPersistence persistence;
    private TradingEngineTest.RecordingNotifier notifier;
    private RateLimiter rateLimiter;
    private TradingEngine engine;
    private TradingScheduler scheduler;

    @BeforeEach
    void setUp() {
        List<Candle> candles = TradingEngineTest.candles(BTC);
        clock = new ReplayClock(candles.get(candles.size() - 1).getCloseTime(), ZoneOffset.UTC);
        exchange = new PaperExchange(new BigDecimal("1000"));
        orders = new GatedOrderExecutor(exchange, BTC);
        persistence = new TradingEngineTest.RecordingPersistence();
        notifier = new TradingEngineTest.RecordingNotifier();
    }

    @AfterEach
    void tearDown() {
        orders.release.countDown();
        if (scheduler != null && scheduler.isRunning()) {
            scheduler.shutdown();
        }
    }

    private void startEngine(RiskConfig riskConfig, RateLimitConfig rateLimitConfig) {
        rateLimiter = new RateLimiter(rateLimitConfig, clock);
        engine = TradingEngine.builder()
                .indicatorConfig(new IndicatorConfig())
                .tradingConfig(new TradingConfig())
                .riskManager(new RiskManager(riskConfig, clock))
                .rateLimiter(rateLimiter)
                .orderExecutor(orders)
                .accountProvider(exchange)
                .priceFeed(exchange)
                .persistence(persistence)
                .notifier(notifier)
                .clock(clock)
                .build();
        orders.engine = engine;
        scheduler = new TradingScheduler(engine, Duration.ofHours(1), Duration.ofSeconds(TIMEOUT_SECONDS));
        scheduler.start();
    }

    /**
     * 两个交易对各喂入前 19 根K线（不产生信号）
     */
    private void warmUp() throws Exception {
        List<Future<?>> futures = new ArrayList<>();
        List<Candle> btc = TradingEngineTest.candles(BTC);
        List<Candle> eth = TradingEngineTest.candles(ETH);
        for (int i = 0; i < btc.size() - 1; i++) {
            futures.add(submit(btc.get(i)));
            futures.add(submit(eth.get(i)));
        }
        for (Future<?> future : futures) {
            future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        }
        assertTrue(persistence.signals.isEmpty());
    }

    private Future<?> submit(Candle candle) {
        exchange.onCandle(candle);
        return scheduler.submitCandle(candle);
    }

    private static Candle lastCandle(Symbol symbol) {
        List<Candle> candles = TradingEngineTest.candles(symbol);
        return candles.get(candles.size() - 1);
    }

    /**
     * BTC 的开仓单发出并挂起，返回其任务句柄
     */
    private Future<?> openBtcAndHoldOrder() throws Exception {
        Future<?> btcEntry = submit(lastCandle(BTC));
        assertTrue(orders.entered.await(TIMEOUT_SECONDS, TimeUnit.SECONDS), "BTC 开仓单未发出");
        // 下单期间交易对锁已释放，其他线程可以读取状态
        PositionState state = assertTimeoutPreemptively(Duration.ofSeconds(TIMEOUT_SECONDS),
                () -> stateOf(BTC));
        assertEquals(PositionState.OPENING, state);
        return btcEntry;
    }

    private PositionState stateOf(Symbol symbol) {
        SymbolContext ctx = engine.getContext(symbol).orElseThrow();
        ctx.lock();
        try {
            return ctx.lifecycle().state();
        } finally {
            ctx.unlock();
        }
    }

    @Test
    void entryIntervalHoldsWhileOtherSymbolOrderIsInFlight() throws Exception {
        startEngine(new RiskConfig(), TradingEngineTest.noThrottle());
        warmUp();

        Future<?> btcEntry = openBtcAndHoldOrder();
        submit(lastCandle(ETH)).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        orders.release.countDown();
        btcEntry.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        List<Position> positions = engine.getOpenPositions();
        assertEquals(1, positions.size());
        assertEquals(BTC, positions.get(0).getSymbol());
        assertEquals(List.of(RejectReason.TRADE_INTERVAL), notifier.rejections);
        assertEquals(List.of("BTCUSDT BUY"), orders.placed);
        assertEquals(1, rateLimiter.dailyOrderCount());
        assertEquals(PositionState.NONE, stateOf(ETH));
        orders.assertNoViolations();
    }

    @Test
    void dailyOrderCapHoldsWhileOtherSymbolOrderIsInFlight() throws Exception {
        RiskConfig riskConfig = RiskConfig.builder().minTimeBetweenTrades(Duration.ZERO).build();
        RateLimitConfig rateLimitConfig = RateLimitConfig.builder()
                .signalCheckInterval(Duration.ZERO)
                .orderCooldown(Duration.ZERO)
                .maxDailyOrders(1)
                .allDay()
                .build();
        startEngine(riskConfig, rateLimitConfig);
        warmUp();

        Future<?> btcEntry = openBtcAndHoldOrder();
        assertEquals(1, rateLimiter.dailyOrderCount());
        submit(lastCandle(ETH)).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        orders.release.countDown();
        btcEntry.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(1, engine.getOpenPositions().size());
        assertEquals(List.of("BTCUSDT BUY"), orders.placed);
        assertEquals(1, rateLimiter.dailyOrderCount());
        // 两个交易对都产生了信号，ETH 在下单闸门被拦截，未进入风控
        assertEquals(2, persistence.signals.size());
        assertTrue(notifier.rejections.isEmpty());
        orders.assertNoViolations();
    }

    @Test
    void openingPositionCountsTowardsMaxOpenPositions() throws Exception {
        RiskConfig riskConfig = RiskConfig.builder()
                .maxOpenPositions(1)
                .minTimeBetweenTrades(Duration.ZERO)
                .build();
        startEngine(riskConfig, TradingEngineTest.noThrottle());
        warmUp();

        Future<?> btcEntry = openBtcAndHoldOrder();
        submit(lastCandle(ETH)).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        orders.release.countDown();
        btcEntry.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(1, engine.getOpenPositions().size());
        assertEquals(List.of(RejectReason.MAX_OPEN_POSITIONS), notifier.rejections);
        orders.assertNoViolations();
    }

    @Test
    void failedEntryReleasesIntervalAndOrderSlot() throws Exception {
        startEngine(new RiskConfig(), TradingEngineTest.noThrottle());
        warmUp();
        orders.failGated = true;

        Future<?> btcEntry = openBtcAndHoldOrder();
        orders.release.countDown();
        btcEntry.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(PositionState.NONE, stateOf(BTC));
        assertEquals(0, rateLimiter.dailyOrderCount());

        submit(lastCandle(ETH)).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        List<Position> positions = engine.getOpenPositions();
        assertEquals(1, positions.size());
        assertEquals(ETH, positions.get(0).getSymbol());
        assertTrue(notifier.rejections.isEmpty());
        assertTrue(notifier.errors.contains("openOrder"));
        assertEquals(1, rateLimiter.dailyOrderCount());
        orders.assertNoViolations();
    }

    @Test
    void tickDuringPendingEntryDoesNotCloseOrBlock() throws Exception {
        startEngine(new RiskConfig(), TradingEngineTest.noThrottle());
        warmUp();

        Future<?> btcEntry = openBtcAndHoldOrder();
        scheduler.triggerTick().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(PositionState.OPENING, stateOf(BTC));
        assertTrue(persistence.trades.isEmpty());

        orders.release.countDown();
        btcEntry.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(PositionState.OPEN, stateOf(BTC));

        // 收盘 101 低于短期EMA，下一次 tick 技术离场
        scheduler.triggerTick().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(PositionState.NONE, stateOf(BTC));
        assertEquals(1, persistence.trades.size());
        assertEquals(ExitReason.TECHNICAL_EXIT, persistence.trades.get(0).getReason());
        assertEquals(List.of("BTCUSDT BUY", "BTCUSDT SELL"), orders.placed);
        orders.assertNoViolations();
    }

    /**
     * 指定交易对的第一笔订单在 release 之前挂起
     * 同时记录下单时是否持有交易对锁、同一交易对是否有并发订单
     */
    static class GatedOrderExecutor implements OrderExecutor {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final List<String> placed = new CopyOnWriteArrayList<>();
        final List<String> violations = new CopyOnWriteArrayList<>();
        volatile TradingEngine engine;
        volatile boolean failGated;

        private final PaperExchange delegate;
        private final Symbol gatedSymbol;
        private final AtomicBoolean gateUsed = new AtomicBoolean();
        private final Map<Symbol, AtomicInteger> inFlight = new ConcurrentHashMap<>();

        GatedOrderExecutor(PaperExchange delegate, Symbol gatedSymbol) {
            this.delegate = delegate;
            this.gatedSymbol = gatedSymbol;
        }

        @Override
        public String placeOrder(Symbol symbol, Side side, BigDecimal quantity) throws ExchangeException {
            engine.getContext(symbol).ifPresent(ctx -> {
                if (ctx.isHeldByCurrentThread()) {
                    violations.add(symbol + " 下单时持有交易对锁");
                }
            });
            AtomicInteger count = inFlight.computeIfAbsent(symbol, s -> new AtomicInteger());
            if (count.incrementAndGet() > 1) {
                violations.add(symbol + " 同时存在多笔订单");
            }
            try {
                if (symbol.equals(gatedSymbol) && gateUsed.compareAndSet(false, true)) {
                    entered.countDown();
                    awaitRelease();
                    if (failGated) {
                        throw new ExchangeException(ExchangeException.ErrorCode.ORDER_REJECTED, "rejected");
                    }
                }
                String orderId = delegate.placeOrder(symbol, side, quantity);
                placed.add(symbol.toPairString() + " " + side);
                return orderId;
            } finally {
                count.decrementAndGet();
            }
        }

        private void awaitRelease() throws ExchangeException {
            try {
                if (!release.await(TIMEOUT_SECONDS * 2, TimeUnit.SECONDS)) {
                    throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "gate not released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExchangeException(ExchangeException.ErrorCode.TIMEOUT, "interrupted", e);
            }
        }

        void assertNoViolations() {
            assertTrue(violations.isEmpty(), violations.toString());
        }
    }
}
