package com.trade.scalp;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.ConfigManager;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.exchange.PaperExchange;
import com.trade.scalp.execution.FilePersistence;
import com.trade.scalp.execution.TradingEngine;
import com.trade.scalp.execution.notifier.TradeEventNotifier;
import com.trade.scalp.execution.notifier.TradeEventNotifierFactory;
import com.trade.scalp.indicator.IndicatorConfig;
import com.trade.scalp.market.CsvCandleLoader;
import com.trade.scalp.market.ReplayClock;
import com.trade.scalp.risk.RateLimitConfig;
import com.trade.scalp.risk.RateLimiter;
import com.trade.scalp.risk.RiskConfig;
import com.trade.scalp.risk.RiskManager;
import com.trade.scalp.strategy.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.List;

/**
 * 剥头皮交易系统主类
 * 用 CSV 历史K线回放完整决策流程：模拟交易所成交，每根K线后执行一次 tick
 */
public class TradingSystemMain {

    private static final Logger logger = LoggerFactory.getLogger(TradingSystemMain.class);

    public static void main(String[] args) {
        System.out.println("""
            ================================================
               剥头皮交易系统 v1.0
               风控第一 · 规则确定 · 无未来数据
            ================================================
            """);

        if (args.length < 1) {
            printUsage();
            System.exit(1);
        }

        Path csv = Paths.get(args[0]);
        Symbol symbol = Symbol.of(args.length > 1 ? args[1] : "BTCUSDT");

        try {
            runReplay(ConfigManager.getInstance(), csv, symbol);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("回放失败: {}", e.getMessage(), e);
            System.err.println("回放失败: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * 运行回放
     */
    static void runReplay(ConfigManager cfg, Path csv, Symbol symbol) throws IOException {
        List<Candle> candles = CsvCandleLoader.load(csv, symbol);
        if (candles.isEmpty()) {
            System.out.println("CSV 中没有K线数据: " + csv);
            return;
        }
        logger.info("加载 {} 根K线: {} ~ {}", candles.size(),
                candles.get(0).getCloseTime(), candles.get(candles.size() - 1).getCloseTime());

        ZoneId zone = cfg.hasProperty("engine.timezone")
                ? ZoneId.of(cfg.getProperty("engine.timezone"))
                : ZoneId.systemDefault();
        ReplayClock clock = new ReplayClock(candles.get(0).getCloseTime(), zone);

        BigDecimal initialBalance = cfg.getDecimalProperty("replay.initial.balance", BigDecimal.valueOf(1000));
        PaperExchange exchange = new PaperExchange(initialBalance);
        RiskManager riskManager = new RiskManager(RiskConfig.fromConfig(cfg), clock);
        TradeEventNotifier notifier = TradeEventNotifierFactory.fromConfig(cfg, "replay");

        TradingEngine engine = TradingEngine.builder()
                .indicatorConfig(IndicatorConfig.fromConfig(cfg))
                .tradingConfig(TradingConfig.fromConfig(cfg))
                .riskManager(riskManager)
                .rateLimiter(new RateLimiter(RateLimitConfig.fromConfig(cfg), clock))
                .orderExecutor(exchange)
                .accountProvider(exchange)
                .priceFeed(exchange)
                .persistence(new FilePersistence(cfg.getProperty("persistence.dir", "data")))
                .notifier(notifier)
                .clock(clock)
                .windowCapacity(cfg.getIntProperty("window.capacity", 100))
                .build();

        try {
            engine.start();
            for (Candle candle : candles) {
                clock.setInstant(candle.getCloseTime());
                exchange.onCandle(candle);
                engine.onCandleClosed(candle);
                engine.tick();
            }
            engine.stop();
        } finally {
            notifier.close();
        }

        if (!engine.getOpenPositions().isEmpty()) {
            System.out.println("回放结束时仍有持仓: " + engine.getOpenPositions());
        }
        System.out.println(riskManager.getStatistics());
        System.out.printf("初始余额: %s USDT, 最终余额: %s USDT%n", initialBalance, exchange.getBalance());
    }

    private static void printUsage() {
        System.out.println("用法: java -jar scalp-trading-core.jar <K线CSV> [交易对]");
        System.out.println("CSV 格式: closeTime,open,high,low,close,volume（首行为表头）");
    }
}
