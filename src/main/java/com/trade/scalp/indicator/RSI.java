package com.trade.scalp.indicator;

import com.trade.scalp.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 相对强弱指标（Relative Strength Index）
 *
 * 涨幅均值 / 跌幅均值取最近 period 个价格变化的简单平均（非 Wilder 平滑），
 * 跌幅均值为0时 RSI 固定为 100
 */
public class RSI implements Indicator {

    private final int period;

    public RSI(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> prices) {
        if (prices.size() < period + 1) {
            throw new IllegalArgumentException("价格数量不足，需要至少 " + (period + 1) + " 个数据点");
        }

        // 价格变化拆分为涨幅与跌幅（跌幅取绝对值）
        int n = prices.size() - 1;
        BigDecimal[] gains = new BigDecimal[n];
        BigDecimal[] losses = new BigDecimal[n];
        for (int i = 1; i < prices.size(); i++) {
            BigDecimal change = prices.get(i).subtract(prices.get(i - 1));
            if (change.signum() > 0) {
                gains[i - 1] = change;
                losses[i - 1] = BigDecimal.ZERO;
            } else {
                gains[i - 1] = BigDecimal.ZERO;
                losses[i - 1] = change.negate();
            }
        }

        List<BigDecimal> rsiValues = new ArrayList<>(n - period + 1);
        BigDecimal gainSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        for (int i = 0; i < period; i++) {
            gainSum = gainSum.add(gains[i]);
            lossSum = lossSum.add(losses[i]);
        }
        rsiValues.add(toRsi(gainSum, lossSum));

        for (int i = period; i < n; i++) {
            gainSum = gainSum.add(gains[i]).subtract(gains[i - period]);
            lossSum = lossSum.add(losses[i]).subtract(losses[i - period]);
            rsiValues.add(toRsi(gainSum, lossSum));
        }

        return rsiValues;
    }

    /**
     * 均值的比值与和的比值相同，直接用窗口内的和计算
     */
    private BigDecimal toRsi(BigDecimal gainSum, BigDecimal lossSum) {
        if (lossSum.signum() == 0) {
            return Decimal.HUNDRED;
        }
        BigDecimal rs = gainSum.divide(lossSum, 16, RoundingMode.HALF_UP);
        BigDecimal rsi = Decimal.HUNDRED.subtract(
                Decimal.HUNDRED.divide(BigDecimal.ONE.add(rs), 16, RoundingMode.HALF_UP));
        return Decimal.scalePrice(rsi.max(BigDecimal.ZERO).min(Decimal.HUNDRED));
    }

    /**
     * 判断是否超买
     */
    public boolean isOverbought(List<BigDecimal> prices, BigDecimal threshold) {
        return latest(prices).compareTo(threshold) > 0;
    }

    /**
     * 判断是否超卖
     */
    public boolean isOversold(List<BigDecimal> prices, BigDecimal threshold) {
        return latest(prices).compareTo(threshold) < 0;
    }

    @Override
    public int requiredPoints() {
        return period + 1;
    }

    @Override
    public String getName() {
        return "RSI-" + period;
    }
}
