package com.trade.scalp.indicator;

import com.trade.scalp.core.Candle;
import com.trade.scalp.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 指标引擎
 *
 * 纯函数：相同的K线序列总是得到相同的快照，除配置外不持有状态。
 * K线数量少于最大回看周期时返回数据不足，不计算任何数值。
 */
public class IndicatorEngine {

    private final IndicatorConfig config;
    private final EMA emaShort;
    private final EMA emaLong;
    private final RSI rsi;
    private final MACD macd;
    private final BOLL boll;
    private final Momentum momentum;

    public IndicatorEngine(IndicatorConfig config) {
        config.validate();
        this.config = config;
        this.emaShort = new EMA(config.getEmaShort());
        this.emaLong = new EMA(config.getEmaLong());
        this.rsi = new RSI(config.getRsiPeriod());
        this.macd = new MACD(config.getMacdFast(), config.getMacdSlow(), config.getMacdSignal());
        this.boll = new BOLL(config.getBbPeriod(), config.getBbStdDev());
        this.momentum = new Momentum(config.getMomentumPeriod());
    }

    /**
     * 根据窗口内容计算指标快照
     * @param candles 按时间顺序的K线（通常为 PriceWindow.snapshot()）
     */
    public IndicatorResult compute(List<Candle> candles) {
        int required = config.requiredLookback();
        if (candles.size() < required) {
            return IndicatorResult.insufficient(candles.size(), required);
        }

        List<BigDecimal> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(candle.getClose());
        }

        MACD.MACDResult macdResult = macd.latest(closes);
        BOLL.BOLLResult bollResult = boll.latest(closes);
        Candle last = candles.get(candles.size() - 1);

        IndicatorSnapshot snapshot = IndicatorSnapshot.builder()
                .ema(emaShort.latest(closes), emaLong.latest(closes))
                .rsi(rsi.latest(closes))
                .macd(Decimal.scalePrice(macdResult.macdLine), Decimal.scalePrice(macdResult.signalLine))
                .bollinger(bollResult.upper, bollResult.middle, bollResult.lower)
                .momentum(momentum.latest(closes))
                .close(last.getClose())
                .volume(last.getVolume(), volumeAverage(candles))
                .candleTime(last.getCloseTime())
                .build();

        return IndicatorResult.sufficient(snapshot, candles.size(), required);
    }

    /**
     * 最近 volumeMaPeriod 根K线的成交量均值，窗口较短时取全部
     */
    private BigDecimal volumeAverage(List<Candle> candles) {
        int count = Math.min(config.getVolumeMaPeriod(), candles.size());
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = candles.size() - count; i < candles.size(); i++) {
            sum = sum.add(candles.get(i).getVolume());
        }
        return sum.divide(BigDecimal.valueOf(count), Decimal.PRICE_SCALE, RoundingMode.HALF_UP);
    }

    public int requiredLookback() {
        return config.requiredLookback();
    }

    public IndicatorConfig getConfig() {
        return config;
    }
}
