package com.trade.scalp.indicator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * 简单移动平均线（Simple Moving Average）
 * 输出第 i 个值对应输入 [i, i+period) 的均值
 */
public class SMA implements Indicator {

    private final int period;

    public SMA(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> values) {
        if (values.size() < period) {
            throw new IllegalArgumentException("数据不足，" + getName() + " 需要至少 " + period + " 个数据点");
        }

        List<BigDecimal> result = new ArrayList<>(values.size() - period + 1);
        BigDecimal divisor = BigDecimal.valueOf(period);

        // 滑动求和
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < period; i++) {
            sum = sum.add(values.get(i));
        }
        result.add(sum.divide(divisor, 8, RoundingMode.HALF_UP));

        for (int i = period; i < values.size(); i++) {
            sum = sum.add(values.get(i)).subtract(values.get(i - period));
            result.add(sum.divide(divisor, 8, RoundingMode.HALF_UP));
        }

        return result;
    }

    @Override
    public int requiredPoints() {
        return period;
    }

    @Override
    public String getName() {
        return "SMA-" + period;
    }
}
