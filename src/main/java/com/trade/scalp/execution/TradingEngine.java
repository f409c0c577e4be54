package com.trade.scalp.execution;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.exchange.AccountProvider;
import com.trade.scalp.exchange.ExchangeException;
import com.trade.scalp.exchange.OrderExecutor;
import com.trade.scalp.exchange.PriceFeed;
import com.trade.scalp.execution.notifier.NoopTradeEventNotifier;
import com.trade.scalp.execution.notifier.TradeEventNotifier;
import com.trade.scalp.indicator.IndicatorConfig;
import com.trade.scalp.indicator.IndicatorEngine;
import com.trade.scalp.indicator.IndicatorResult;
import com.trade.scalp.indicator.IndicatorSnapshot;
import com.trade.scalp.market.AppendResult;
import com.trade.scalp.market.CandleListener;
import com.trade.scalp.market.PriceWindow;
import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.position.ExitDecision;
import com.trade.scalp.position.Position;
import com.trade.scalp.position.PositionLifecycle;
import com.trade.scalp.risk.RateLimiter;
import com.trade.scalp.risk.RiskDecision;
import com.trade.scalp.risk.RiskManager;
import com.trade.scalp.risk.TradeOutcome;
import com.trade.scalp.strategy.Signal;
import com.trade.scalp.strategy.SignalGenerator;
import com.trade.scalp.strategy.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 交易引擎
 *
 * 职责：
 * 1. 收盘K线 -> 价格窗口 -> 指标 -> 信号 -> 频率限制 -> 风控 -> 开仓
 * 2. 周期 tick：刷新余额，逐个交易对检查离场并平仓
 *
 * 交易对状态只在 {@link SymbolContext} 锁内修改，下单、持久化、通知都在锁外进行；
 * 锁内只做决定和状态转换，外部调用完成后再加锁提交结果。
 * 外部失败不会抛出本类，只记录日志并发送错误事件。
 */
public class TradingEngine implements CandleListener {

    private static final Logger logger = LoggerFactory.getLogger(TradingEngine.class);

    private final IndicatorEngine indicatorEngine;
    private final SignalGenerator signalGenerator;
    private final RiskManager riskManager;
    private final RateLimiter rateLimiter;
    private final OrderExecutor orderExecutor;
    private final AccountProvider accountProvider;
    private final PriceFeed priceFeed;
    private final Persistence persistence;
    private final TradeEventNotifier notifier;
    private final Clock clock;
    private final TradingConfig tradingConfig;
    private final IndicatorConfig indicatorConfig;
    private final int windowCapacity;

    private final Map<Symbol, SymbolContext> contexts = new ConcurrentHashMap<>();
    // 风控检查、占用下单名额、beginOpen、登记开仓时间之间不能被其他交易对插入
    private final Object entryGate = new Object();

    private volatile BigDecimal cachedBalance = BigDecimal.ZERO;
    private volatile boolean running;

    private TradingEngine(Builder builder) {
        this.indicatorConfig = Objects.requireNonNull(builder.indicatorConfig, "indicatorConfig");
        this.tradingConfig = Objects.requireNonNull(builder.tradingConfig, "tradingConfig");
        this.riskManager = Objects.requireNonNull(builder.riskManager, "riskManager");
        this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
        this.orderExecutor = Objects.requireNonNull(builder.orderExecutor, "orderExecutor");
        this.accountProvider = Objects.requireNonNull(builder.accountProvider, "accountProvider");
        this.priceFeed = Objects.requireNonNull(builder.priceFeed, "priceFeed");
        this.persistence = Objects.requireNonNull(builder.persistence, "persistence");
        this.notifier = builder.notifier == null ? NoopTradeEventNotifier.INSTANCE : builder.notifier;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.windowCapacity = builder.windowCapacity;
        this.indicatorEngine = new IndicatorEngine(indicatorConfig);
        this.signalGenerator = new SignalGenerator(tradingConfig);
        if (windowCapacity < indicatorEngine.requiredLookback()) {
            throw new IllegalArgumentException(String.format("窗口容量 %d 小于指标所需K线数 %d",
                    windowCapacity, indicatorEngine.requiredLookback()));
        }
    }

    /**
     * 启动交易引擎
     */
    public void start() {
        if (running) {
            logger.warn("交易引擎已在运行");
            return;
        }
        running = true;
        refreshBalance();
        logger.info("交易引擎已启动，余额={}，指标参数 {}", cachedBalance, indicatorConfig);
    }

    /**
     * 停止交易引擎，之后的K线和 tick 被忽略
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        logger.info("交易引擎已停止");
    }

    public boolean isRunning() {
        return running;
    }

    // ==================== 开仓路径 ====================

    @Override
    public void onCandleClosed(Candle candle) {
        if (!running) {
            logger.debug("引擎未运行，忽略K线: {}", candle);
            return;
        }
        try {
            processCandle(candle);
        } catch (RuntimeException e) {
            logger.error("处理K线失败: {} - {}", candle, e.getMessage(), e);
            notifySafely(() -> notifier.error("onCandleClosed", candle.getSymbol(), e));
        }
    }

    @Override
    public void onError(Throwable throwable) {
        logger.error("行情回调错误: {}", throwable.getMessage(), throwable);
        notifySafely(() -> notifier.error("marketData", null, throwable));
    }

    private void processCandle(Candle candle) {
        Symbol symbol = candle.getSymbol();
        SymbolContext ctx = context(symbol);

        EntryPlan plan;
        ctx.lock();
        try {
            plan = decideEntry(ctx, candle);
        } finally {
            ctx.unlock();
        }

        if (plan == null) {
            return;
        }

        // 锁外：持久化、通知
        Signal signal = plan.signal;
        persistSafely(() -> persistence.saveSignal(signal), "saveSignal", symbol);
        notifySafely(() -> notifier.signalGenerated(signal));

        if (plan.decision != null && !plan.decision.isAccepted()) {
            notifySafely(() -> notifier.riskRejected(signal, plan.decision.getReason(), plan.decision.getDetail()));
            return;
        }
        if (!plan.opening) {
            return;
        }

        executeEntry(ctx, signal, plan.decision.getQuantity(), plan.reservation);
    }

    /**
     * 锁内：追加K线、计算指标、生成信号、检查频率与风控，通过后进入 OPENING
     * 进入 OPENING 的同时占用当日下单名额并登记开仓时间，下单失败时归还
     * @return null 表示没有信号
     */
    private EntryPlan decideEntry(SymbolContext ctx, Candle candle) {
        Symbol symbol = ctx.getSymbol();
        if (ctx.window().append(candle) == AppendResult.STALE) {
            logger.warn("丢弃过期K线: {}（窗口最新 {}）", candle,
                    ctx.window().latest().map(Candle::getCloseTime).orElse(null));
            return null;
        }

        IndicatorResult result = indicatorEngine.compute(ctx.window().snapshot());
        if (!result.isSufficient()) {
            logger.debug("{} K线不足: {}/{}", symbol, result.getAvailable(), result.getRequired());
            ctx.updateSnapshot(null);
            return null;
        }
        IndicatorSnapshot snapshot = result.getSnapshot().orElseThrow();
        ctx.updateSnapshot(snapshot);

        PositionLifecycle lifecycle = ctx.lifecycle();
        if (lifecycle.hasExposure()) {
            return null;
        }
        if (!rateLimiter.canCheckSignal(symbol)) {
            return null;
        }
        rateLimiter.registerSignal(symbol);

        Optional<Signal> evaluated = signalGenerator.evaluate(symbol, snapshot, candle.getClose(),
                lifecycle.hasExposure(), clock.instant());
        if (evaluated.isEmpty()) {
            return null;
        }
        Signal signal = evaluated.get();

        if (!rateLimiter.canPlaceOrder(symbol)) {
            logger.info("{} 信号被频率限制拦截: 下次可下单时间 {}", symbol, rateLimiter.nextOrderTime(symbol));
            return new EntryPlan(signal, null, false);
        }

        synchronized (entryGate) {
            RiskDecision decision = riskManager.validate(signal, cachedBalance, openPositionCount());
            if (!decision.isAccepted()) {
                return new EntryPlan(signal, decision, false);
            }
            Optional<RateLimiter.OrderSlot> slot = rateLimiter.reserveOrder(symbol);
            if (slot.isEmpty()) {
                logger.info("{} 信号被频率限制拦截: 当日下单数已满", symbol);
                return new EntryPlan(signal, null, false);
            }
            if (!lifecycle.beginOpen()) {
                rateLimiter.releaseOrder(slot.get());
                return new EntryPlan(signal, decision, false);
            }
            Instant reservedAt = clock.instant();
            Instant previousEntry = riskManager.recordEntry(reservedAt);
            return new EntryPlan(signal, decision, true,
                    new EntryReservation(slot.get(), reservedAt, previousEntry));
        }
    }

    /**
     * 锁外下单，结果在锁内提交
     */
    private void executeEntry(SymbolContext ctx, Signal signal, BigDecimal quantity, EntryReservation reservation) {
        Symbol symbol = signal.getSymbol();
        String orderId;
        try {
            orderId = orderExecutor.placeOrder(symbol, signal.getSide(), quantity);
        } catch (ExchangeException | RuntimeException e) {
            ctx.lock();
            try {
                ctx.lifecycle().abortOpen();
            } finally {
                ctx.unlock();
            }
            synchronized (entryGate) {
                rateLimiter.releaseOrder(reservation.slot);
                riskManager.releaseEntry(reservation.reservedAt, reservation.previousEntry);
            }
            logger.error("开仓下单失败: {} {} {} - {}", symbol, signal.getSide(), quantity, e.getMessage(), e);
            notifySafely(() -> notifier.error("openOrder", symbol, e));
            return;
        }

        Instant openedAt = clock.instant();
        Position position = new Position(symbol, signal.getSide(), signal.getPrice(), quantity,
                signal.getStopLoss(), signal.getTakeProfit(), openedAt, signal.getStrength(), orderId);

        ctx.lock();
        try {
            ctx.lifecycle().completeOpen(position);
        } finally {
            ctx.unlock();
        }

        notifySafely(() -> notifier.tradeOpened(position));
    }

    // ==================== 周期管理 ====================

    /**
     * 周期任务：刷新余额，检查每个持仓的离场条件
     */
    public void tick() {
        if (!running) {
            return;
        }
        refreshBalance();
        for (SymbolContext ctx : contexts.values()) {
            try {
                manageSymbol(ctx);
            } catch (RuntimeException e) {
                logger.error("管理持仓失败: {} - {}", ctx.getSymbol(), e.getMessage(), e);
                notifySafely(() -> notifier.error("tick", ctx.getSymbol(), e));
            }
        }
    }

    private void manageSymbol(SymbolContext ctx) {
        Symbol symbol = ctx.getSymbol();
        BigDecimal fallbackPrice;
        ctx.lock();
        try {
            if (!ctx.lifecycle().isOpen()) {
                return;
            }
            fallbackPrice = ctx.window().latest().map(Candle::getClose).orElse(null);
        } finally {
            ctx.unlock();
        }

        BigDecimal price = currentPrice(symbol, fallbackPrice);
        if (price == null) {
            logger.warn("{} 无法获取价格，跳过本次管理", symbol);
            return;
        }

        Position position;
        ctx.lock();
        try {
            PositionLifecycle lifecycle = ctx.lifecycle();
            Optional<ExitDecision> decision = lifecycle.manage(price, ctx.snapshot(), clock.instant());
            if (decision.isEmpty()) {
                return;
            }
            lifecycle.beginClose(decision.get());
            position = lifecycle.position().orElseThrow();
        } finally {
            ctx.unlock();
        }

        executeExit(ctx, position, price);
    }

    private BigDecimal currentPrice(Symbol symbol, BigDecimal fallbackPrice) {
        try {
            return priceFeed.getCurrentPrice(symbol);
        } catch (ExchangeException e) {
            logger.warn("获取 {} 价格失败，使用最近收盘价 {}: {}", symbol, fallbackPrice, e.getMessage());
            return fallbackPrice;
        }
    }

    private void executeExit(SymbolContext ctx, Position position, BigDecimal price) {
        Symbol symbol = position.getSymbol();
        Side closeSide = position.getSide().opposite();
        try {
            orderExecutor.placeOrder(symbol, closeSide, position.getQuantity());
        } catch (ExchangeException | RuntimeException e) {
            ctx.lock();
            try {
                ctx.lifecycle().abortClose();
            } finally {
                ctx.unlock();
            }
            logger.error("平仓下单失败: {} {} {} - {}", symbol, closeSide, position.getQuantity(), e.getMessage(), e);
            notifySafely(() -> notifier.error("closeOrder", symbol, e));
            return;
        }

        ClosedTrade trade;
        ctx.lock();
        try {
            trade = ctx.lifecycle().completeClose(price, clock.instant());
        } finally {
            ctx.unlock();
        }

        riskManager.recordResult(trade.getPnl(), TradeOutcome.of(trade.getPnl()));
        persistSafely(() -> persistence.saveTrade(trade), "saveTrade", symbol);
        notifySafely(() -> notifier.tradeClosed(trade));
    }

    /**
     * 刷新缓存余额，失败时保留上次的值
     */
    private void refreshBalance() {
        try {
            BigDecimal balance = accountProvider.getBalance();
            if (balance != null) {
                cachedBalance = balance;
            }
        } catch (ExchangeException e) {
            logger.warn("刷新余额失败，沿用 {}: {}", cachedBalance, e.getMessage());
            notifySafely(() -> notifier.error("balance", null, e));
        }
    }

    // ==================== 查询 ====================

    /**
     * 当前持仓（逐个交易对加锁读取）
     */
    public List<Position> getOpenPositions() {
        List<Position> positions = new ArrayList<>();
        for (SymbolContext ctx : contexts.values()) {
            ctx.lock();
            try {
                ctx.lifecycle().position().ifPresent(positions::add);
            } finally {
                ctx.unlock();
            }
        }
        return positions;
    }

    public Optional<SymbolContext> getContext(Symbol symbol) {
        return Optional.ofNullable(contexts.get(symbol));
    }

    /**
     * 预先注册交易对
     */
    public SymbolContext register(Symbol symbol) {
        return context(symbol);
    }

    public BigDecimal getCachedBalance() {
        return cachedBalance;
    }

    private int openPositionCount() {
        int count = 0;
        for (SymbolContext ctx : contexts.values()) {
            if (ctx.hasExposure()) {
                count++;
            }
        }
        return count;
    }

    private SymbolContext context(Symbol symbol) {
        return contexts.computeIfAbsent(symbol, s -> new SymbolContext(s,
                new PriceWindow(s, windowCapacity),
                new PositionLifecycle(s, tradingConfig, indicatorConfig)));
    }

    private void persistSafely(Runnable action, String operation, Symbol symbol) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("持久化失败 [{}] {}: {}", operation, symbol, e.getMessage(), e);
            notifySafely(() -> notifier.error(operation, symbol, e));
        }
    }

    private void notifySafely(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn("发送通知失败: {}", e.getMessage(), e);
        }
    }

    private static final class EntryPlan {
        private final Signal signal;
        private final RiskDecision decision;
        private final boolean opening;
        private final EntryReservation reservation;

        private EntryPlan(Signal signal, RiskDecision decision, boolean opening) {
            this(signal, decision, opening, null);
        }

        private EntryPlan(Signal signal, RiskDecision decision, boolean opening, EntryReservation reservation) {
            this.signal = signal;
            this.decision = decision;
            this.opening = opening;
            this.reservation = reservation;
        }
    }

    /**
     * 开仓单发出前占用的名额与开仓时间
     */
    private static final class EntryReservation {
        private final RateLimiter.OrderSlot slot;
        private final Instant reservedAt;
        private final Instant previousEntry;

        private EntryReservation(RateLimiter.OrderSlot slot, Instant reservedAt, Instant previousEntry) {
            this.slot = slot;
            this.reservedAt = reservedAt;
            this.previousEntry = previousEntry;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IndicatorConfig indicatorConfig;
        private TradingConfig tradingConfig;
        private RiskManager riskManager;
        private RateLimiter rateLimiter;
        private OrderExecutor orderExecutor;
        private AccountProvider accountProvider;
        private PriceFeed priceFeed;
        private Persistence persistence;
        private TradeEventNotifier notifier;
        private Clock clock = Clock.systemDefaultZone();
        private int windowCapacity = PriceWindow.DEFAULT_CAPACITY;

        public Builder indicatorConfig(IndicatorConfig value) {
            this.indicatorConfig = value;
            return this;
        }

        public Builder tradingConfig(TradingConfig value) {
            this.tradingConfig = value;
            return this;
        }

        public Builder riskManager(RiskManager value) {
            this.riskManager = value;
            return this;
        }

        public Builder rateLimiter(RateLimiter value) {
            this.rateLimiter = value;
            return this;
        }

        public Builder orderExecutor(OrderExecutor value) {
            this.orderExecutor = value;
            return this;
        }

        public Builder accountProvider(AccountProvider value) {
            this.accountProvider = value;
            return this;
        }

        public Builder priceFeed(PriceFeed value) {
            this.priceFeed = value;
            return this;
        }

        public Builder persistence(Persistence value) {
            this.persistence = value;
            return this;
        }

        public Builder notifier(TradeEventNotifier value) {
            this.notifier = value;
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public Builder windowCapacity(int value) {
            this.windowCapacity = value;
            return this;
        }

        public TradingEngine build() {
            return new TradingEngine(this);
        }
    }
}
