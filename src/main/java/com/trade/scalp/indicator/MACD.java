package com.trade.scalp.indicator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 平滑异同移动平均线（Moving Average Convergence Divergence）
 * MACD = EMA(fast) - EMA(slow)，信号线 = MACD 的 EMA(signal)
 */
public class MACD {

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MACD(int fastPeriod, int slowPeriod, int signalPeriod) {
        if (fastPeriod <= 0 || slowPeriod <= 0 || signalPeriod <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        if (fastPeriod >= slowPeriod) {
            throw new IllegalArgumentException("快速周期必须小于慢速周期");
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    /**
     * MACD结果
     */
    public static class MACDResult {
        public final BigDecimal macdLine;
        public final BigDecimal signalLine;
        public final BigDecimal histogram;

        public MACDResult(BigDecimal macdLine, BigDecimal signalLine) {
            this.macdLine = macdLine;
            this.signalLine = signalLine;
            this.histogram = macdLine.subtract(signalLine);
        }
    }

    /**
     * 计算MACD，输出与输入等长
     */
    public List<MACDResult> calculate(List<BigDecimal> prices) {
        if (prices.size() < slowPeriod) {
            throw new IllegalArgumentException("价格数量不足，需要至少 " + slowPeriod + " 个数据点");
        }

        List<BigDecimal> fast = new EMA(fastPeriod).calculate(prices);
        List<BigDecimal> slow = new EMA(slowPeriod).calculate(prices);

        List<BigDecimal> macdLine = new ArrayList<>(prices.size());
        for (int i = 0; i < prices.size(); i++) {
            macdLine.add(fast.get(i).subtract(slow.get(i)));
        }

        List<BigDecimal> signalLine = new EMA(signalPeriod).calculate(macdLine);

        List<MACDResult> results = new ArrayList<>(prices.size());
        for (int i = 0; i < macdLine.size(); i++) {
            results.add(new MACDResult(macdLine.get(i), signalLine.get(i)));
        }
        return results;
    }

    /**
     * 获取最新MACD值
     */
    public MACDResult latest(List<BigDecimal> prices) {
        List<MACDResult> results = calculate(prices);
        return results.get(results.size() - 1);
    }

    public int requiredPoints() {
        return slowPeriod;
    }

    @Override
    public String toString() {
        return String.format("MACD(%d,%d,%d)", fastPeriod, slowPeriod, signalPeriod);
    }
}
