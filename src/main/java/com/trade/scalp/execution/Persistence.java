package com.trade.scalp.execution;

import com.trade.scalp.position.ClosedTrade;
import com.trade.scalp.strategy.Signal;

/**
 * 信号与成交记录持久化接口
 * 实现失败时抛出运行时异常，由交易引擎记录日志
 */
public interface Persistence {

    /**
     * 保存生成的信号
     */
    void saveSignal(Signal signal);

    /**
     * 保存已平仓交易
     */
    void saveTrade(ClosedTrade trade);
}
