package com.trade.scalp.indicator;

import com.trade.scalp.core.Decimal;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 指数移动平均线（Exponential Moving Average）
 * 以第一个值为种子递推，输出与输入等长
 */
public class EMA implements Indicator {

    private final int period;
    private final BigDecimal alpha;

    public EMA(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
        // 平滑系数 = 2 / (period + 1)
        this.alpha = BigDecimal.valueOf(2).divide(BigDecimal.valueOf(period + 1L), 16, RoundingMode.HALF_UP);
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("序列为空，无法计算 " + getName());
        }

        List<BigDecimal> result = new ArrayList<>(values.size());
        BigDecimal ema = values.get(0);
        result.add(Decimal.scalePrice(ema));

        for (int i = 1; i < values.size(); i++) {
            // EMA = (x - EMA_prev) * alpha + EMA_prev
            ema = values.get(i).subtract(ema).multiply(alpha).add(ema)
                    .setScale(16, RoundingMode.HALF_UP);
            result.add(Decimal.scalePrice(ema));
        }

        return result;
    }

    @Override
    public int requiredPoints() {
        return period;
    }

    @Override
    public String getName() {
        return "EMA-" + period;
    }
}
