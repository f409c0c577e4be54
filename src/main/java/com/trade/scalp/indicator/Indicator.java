package com.trade.scalp.indicator;

import java.math.BigDecimal;
import java.util.List;

/**
 * 单序列技术指标
 */
public interface Indicator {

    /**
     * 计算指标序列
     * @param values 按时间顺序的输入序列
     * @return 指标序列，最后一个元素对应最新输入
     */
    List<BigDecimal> calculate(List<BigDecimal> values);

    /**
     * 至少需要的输入数量
     */
    int requiredPoints();

    /**
     * 获取指标名称
     */
    String getName();

    /**
     * 最新指标值
     */
    default BigDecimal latest(List<BigDecimal> values) {
        List<BigDecimal> result = calculate(values);
        return result.get(result.size() - 1);
    }
}
