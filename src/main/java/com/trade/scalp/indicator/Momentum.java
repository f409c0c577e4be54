package com.trade.scalp.indicator;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 动量：close[t] - close[t - period]
 */
public class Momentum implements Indicator {

    private final int period;

    public Momentum(int period) {
        if (period <= 0) {
            throw new IllegalArgumentException("周期必须大于0");
        }
        this.period = period;
    }

    @Override
    public List<BigDecimal> calculate(List<BigDecimal> values) {
        if (values.size() < period + 1) {
            throw new IllegalArgumentException("数据不足，" + getName() + " 需要至少 " + (period + 1) + " 个数据点");
        }

        List<BigDecimal> result = new ArrayList<>(values.size() - period);
        for (int i = period; i < values.size(); i++) {
            result.add(values.get(i).subtract(values.get(i - period)));
        }
        return result;
    }

    @Override
    public int requiredPoints() {
        return period + 1;
    }

    @Override
    public String getName() {
        return "MOM-" + period;
    }
}
