package com.trade.scalp.execution;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.ConfigManager;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.market.CandleListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 调度器
 *
 * 1. 单线程定时执行 {@link TradingEngine#tick()}（固定间隔）
 * 2. 每个交易对一个串行执行器处理收盘K线，同一交易对的K线按到达顺序处理
 *
 * 关闭时先停止接收新任务，在宽限期内等待进行中的开/平仓完成，超时后放弃并记录。
 */
public class TradingScheduler implements CandleListener {

    private static final Logger logger = LoggerFactory.getLogger(TradingScheduler.class);

    private final TradingEngine engine;
    private final Duration tickInterval;
    private final Duration shutdownGrace;
    private final ScheduledExecutorService tickExecutor;
    private final Map<Symbol, ExecutorService> candleExecutors = new ConcurrentHashMap<>();
    private volatile boolean accepting;

    public TradingScheduler(TradingEngine engine, Duration tickInterval, Duration shutdownGrace) {
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tick 间隔必须大于0");
        }
        this.engine = engine;
        this.tickInterval = tickInterval;
        this.shutdownGrace = shutdownGrace;
        this.tickExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "trading-tick");
            t.setDaemon(true);
            return t;
        });
    }

    public static TradingScheduler fromConfig(TradingEngine engine, ConfigManager cfg) {
        return new TradingScheduler(engine,
                Duration.ofSeconds(cfg.getLongProperty("engine.tick.interval.seconds", 60)),
                Duration.ofSeconds(cfg.getLongProperty("engine.shutdown.grace.seconds", 10)));
    }

    /**
     * 启动引擎与定时 tick
     */
    public void start() {
        engine.start();
        accepting = true;
        long millis = tickInterval.toMillis();
        tickExecutor.scheduleWithFixedDelay(this::safeTick, millis, millis, TimeUnit.MILLISECONDS);
        logger.info("调度器已启动，tick 间隔 {}s", tickInterval.getSeconds());
    }

    @Override
    public void onCandleClosed(Candle candle) {
        submitCandle(candle);
    }

    @Override
    public void onError(Throwable throwable) {
        engine.onError(throwable);
    }

    /**
     * 提交收盘K线到对应交易对的执行器
     * @return 任务句柄，调度器已关闭时为 null
     */
    public Future<?> submitCandle(Candle candle) {
        if (!accepting) {
            logger.warn("调度器未运行，丢弃K线: {}", candle);
            return null;
        }
        ExecutorService executor = candleExecutors.computeIfAbsent(candle.getSymbol(), this::newCandleExecutor);
        try {
            return executor.submit(() -> engine.onCandleClosed(candle));
        } catch (RejectedExecutionException e) {
            logger.warn("调度器正在关闭，丢弃K线: {}", candle);
            return null;
        }
    }

    /**
     * 立即执行一次 tick（与定时 tick 串行）
     */
    public Future<?> triggerTick() {
        return tickExecutor.submit(this::safeTick);
    }

    /**
     * 停止接收新任务，等待进行中的任务，超时后强制停止
     */
    public void shutdown() {
        accepting = false;
        tickExecutor.shutdown();
        for (ExecutorService executor : candleExecutors.values()) {
            executor.shutdown();
        }

        long deadline = System.nanoTime() + shutdownGrace.toNanos();
        awaitOrAbandon("trading-tick", tickExecutor, deadline);
        for (Map.Entry<Symbol, ExecutorService> entry : candleExecutors.entrySet()) {
            awaitOrAbandon("candle-" + entry.getKey().toPairString(), entry.getValue(), deadline);
        }

        engine.stop();
        logger.info("调度器已停止");
    }

    public boolean isRunning() {
        return accepting;
    }

    private void awaitOrAbandon(String name, ExecutorService executor, long deadlineNanos) {
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            if (executor.awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("等待 {} 结束时被中断", name);
        }
        List<Runnable> abandoned = executor.shutdownNow();
        logger.warn("{} 超过宽限期 {}s 未结束，放弃 {} 个待执行任务", name, shutdownGrace.getSeconds(), abandoned.size());
    }

    private ExecutorService newCandleExecutor(Symbol symbol) {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "candle-" + symbol.toPairString());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 定时任务抛出异常会取消后续执行，这里兜底
     */
    private void safeTick() {
        try {
            engine.tick();
        } catch (RuntimeException e) {
            logger.error("tick 执行失败: {}", e.getMessage(), e);
        }
    }
}
