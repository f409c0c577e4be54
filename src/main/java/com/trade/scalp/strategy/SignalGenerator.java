package com.trade.scalp.strategy;

import com.trade.scalp.core.Decimal;
import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;
import com.trade.scalp.indicator.IndicatorSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * 多因子剥头皮信号生成器
 *
 * 做多（全部满足）：EMA短 > EMA长，30 < RSI < 65，MACD > 信号线，收盘 > 布林中轨，动量 > 0，强度达标
 * 做空（全部满足）：EMA短 < EMA长，35 < RSI < 65，MACD < 信号线，收盘 < 布林中轨，动量 < 0，强度达标
 *
 * 两组条件同时成立时做多优先。已有持仓时不产生信号。
 */
public class SignalGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SignalGenerator.class);

    private static final BigDecimal LONG_RSI_LOW = BigDecimal.valueOf(30);
    private static final BigDecimal SHORT_RSI_LOW = BigDecimal.valueOf(35);
    private static final BigDecimal RSI_HIGH = BigDecimal.valueOf(65);

    // 强度子条件权重：价格/短EMA、趋势、RSI中间带、MACD、布林中轨、动量
    private static final BigDecimal[] WEIGHTS = {
            new BigDecimal("1.2"), new BigDecimal("1.2"), new BigDecimal("1.0"),
            new BigDecimal("1.1"), new BigDecimal("1.0"), new BigDecimal("1.0")
    };
    private static final BigDecimal WEIGHT_TOTAL = new BigDecimal("6.5");

    private final TradingConfig config;

    public SignalGenerator(TradingConfig config) {
        this.config = config;
    }

    /**
     * 评估最新快照
     * @param hasOpenPosition 该交易对是否已有持仓（含开仓/平仓中）
     * @return 至多一个信号
     */
    public Optional<Signal> evaluate(Symbol symbol, IndicatorSnapshot snapshot, BigDecimal currentPrice,
                                     boolean hasOpenPosition, Instant now) {
        if (hasOpenPosition) {
            logger.debug("{} 已有持仓，跳过信号评估", symbol);
            return Optional.empty();
        }
        if (!Decimal.isPositive(currentPrice)) {
            logger.warn("{} 当前价格无效: {}", symbol, currentPrice);
            return Optional.empty();
        }

        if (config.isRequireVolumeConfirmation() && !volumeConfirmed(snapshot)) {
            logger.debug("{} 成交量未放大: {} < {} x {}", symbol,
                    snapshot.getVolume(), config.getMinVolumeRatio(), snapshot.getVolumeAverage());
            return Optional.empty();
        }

        BigDecimal longStrength = strength(snapshot, Side.BUY);
        BigDecimal shortStrength = strength(snapshot, Side.SELL);

        if (longConditions(snapshot) && longStrength.compareTo(config.getMinSignalStrength()) >= 0) {
            Signal signal = buildSignal(symbol, Side.BUY, currentPrice, longStrength, now);
            logger.info("生成做多信号: {} 强度={}%", symbol, longStrength);
            return Optional.of(signal);
        }
        if (shortConditions(snapshot) && shortStrength.compareTo(config.getMinSignalStrength()) >= 0) {
            Signal signal = buildSignal(symbol, Side.SELL, currentPrice, shortStrength, now);
            logger.info("生成做空信号: {} 强度={}%", symbol, shortStrength);
            return Optional.of(signal);
        }

        logger.debug("{} 无信号: 多头强度={} 空头强度={} {}", symbol, longStrength, shortStrength, snapshot);
        return Optional.empty();
    }

    /**
     * 方向强度：六个加权子条件按该方向求值，归一化到 [0,100]
     */
    public static BigDecimal strength(IndicatorSnapshot s, Side side) {
        boolean isLong = side.isLong();
        boolean[] conditions = {
                isLong ? gt(s.getClose(), s.getEmaShort()) : lt(s.getClose(), s.getEmaShort()),
                isLong ? gt(s.getEmaShort(), s.getEmaLong()) : lt(s.getEmaShort(), s.getEmaLong()),
                gt(s.getRsi(), SHORT_RSI_LOW) && lt(s.getRsi(), RSI_HIGH),
                isLong ? gt(s.getMacd(), s.getMacdSignal()) : lt(s.getMacd(), s.getMacdSignal()),
                isLong ? gt(s.getClose(), s.getBbMiddle()) : lt(s.getClose(), s.getBbMiddle()),
                isLong ? s.getMomentum().signum() > 0 : s.getMomentum().signum() < 0
        };

        BigDecimal weighted = BigDecimal.ZERO;
        for (int i = 0; i < conditions.length; i++) {
            if (conditions[i]) {
                weighted = weighted.add(WEIGHTS[i]);
            }
        }
        return weighted.multiply(Decimal.HUNDRED)
                .divide(WEIGHT_TOTAL, Decimal.PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    static boolean longConditions(IndicatorSnapshot s) {
        return gt(s.getEmaShort(), s.getEmaLong())
                && gt(s.getRsi(), LONG_RSI_LOW) && lt(s.getRsi(), RSI_HIGH)
                && gt(s.getMacd(), s.getMacdSignal())
                && gt(s.getClose(), s.getBbMiddle())
                && s.getMomentum().signum() > 0;
    }

    static boolean shortConditions(IndicatorSnapshot s) {
        return lt(s.getEmaShort(), s.getEmaLong())
                && gt(s.getRsi(), SHORT_RSI_LOW) && lt(s.getRsi(), RSI_HIGH)
                && lt(s.getMacd(), s.getMacdSignal())
                && lt(s.getClose(), s.getBbMiddle())
                && s.getMomentum().signum() < 0;
    }

    private boolean volumeConfirmed(IndicatorSnapshot s) {
        BigDecimal threshold = s.getVolumeAverage().multiply(config.getMinVolumeRatio());
        return s.getVolume().compareTo(threshold) >= 0;
    }

    private Signal buildSignal(Symbol symbol, Side side, BigDecimal price, BigDecimal strength, Instant now) {
        BigDecimal sl = config.getStopLossPercent();
        BigDecimal tp = config.getTakeProfitPercent();
        BigDecimal stopLoss = side.isLong()
                ? Decimal.offsetPercent(price, sl.negate())
                : Decimal.offsetPercent(price, sl);
        BigDecimal takeProfit = side.isLong()
                ? Decimal.offsetPercent(price, tp)
                : Decimal.offsetPercent(price, tp.negate());
        return new Signal(symbol, side, Decimal.scalePrice(price), strength, stopLoss, takeProfit, now);
    }

    private static boolean gt(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) > 0;
    }

    private static boolean lt(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) < 0;
    }

    public TradingConfig getConfig() {
        return config;
    }
}
