package com.trade.scalp.indicator;

import com.trade.scalp.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 布林带（Bollinger Bands）
 * 中轨为 SMA(period)，上下轨为中轨 ± 倍数 × 样本标准差（分母 n-1）
 */
public class BOLL {

    private final int period;
    private final BigDecimal stdDevMultiplier;

    public BOLL(int period, BigDecimal stdDevMultiplier) {
        if (period <= 1) {
            throw new IllegalArgumentException("周期必须大于1");
        }
        if (stdDevMultiplier.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("标准差倍数必须大于0");
        }
        this.period = period;
        this.stdDevMultiplier = stdDevMultiplier;
    }

    /**
     * 布林带结果
     */
    public static class BOLLResult {
        public final BigDecimal upper;  // 上轨
        public final BigDecimal middle; // 中轨
        public final BigDecimal lower;  // 下轨

        public BOLLResult(BigDecimal upper, BigDecimal middle, BigDecimal lower) {
            this.upper = upper;
            this.middle = middle;
            this.lower = lower;
        }

        public BigDecimal width() {
            return upper.subtract(lower);
        }
    }

    /**
     * 计算布林带，第 i 个结果对应输入 [i, i+period)
     */
    public List<BOLLResult> calculate(List<BigDecimal> prices) {
        if (prices.size() < period) {
            throw new IllegalArgumentException("价格数量不足，需要至少 " + period + " 个数据点");
        }

        List<BigDecimal> middleBand = new SMA(period).calculate(prices);
        BigDecimal denominator = BigDecimal.valueOf(period - 1L);

        List<BOLLResult> results = new ArrayList<>(middleBand.size());
        for (int i = period - 1; i < prices.size(); i++) {
            BigDecimal middle = middleBand.get(i - period + 1);

            BigDecimal sumSq = BigDecimal.ZERO;
            for (int j = 0; j < period; j++) {
                BigDecimal diff = prices.get(i - j).subtract(middle);
                sumSq = sumSq.add(diff.multiply(diff));
            }
            BigDecimal variance = sumSq.divide(denominator, 16, RoundingMode.HALF_UP);
            BigDecimal band = Decimal.sqrt(variance).multiply(stdDevMultiplier);

            results.add(new BOLLResult(
                    Decimal.scalePrice(middle.add(band)),
                    Decimal.scalePrice(middle),
                    Decimal.scalePrice(middle.subtract(band))));
        }

        return results;
    }

    /**
     * 获取最新布林带值
     */
    public BOLLResult latest(List<BigDecimal> prices) {
        if (prices.size() > period) {
            // 只需最后 period 个价格
            prices = prices.subList(prices.size() - period, prices.size());
        }
        List<BOLLResult> results = calculate(prices);
        return results.get(results.size() - 1);
    }

    public int requiredPoints() {
        return period;
    }

    @Override
    public String toString() {
        return String.format("BOLL(%d,%s)", period, stdDevMultiplier.toPlainString());
    }
}
