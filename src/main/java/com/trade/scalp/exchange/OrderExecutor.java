package com.trade.scalp.exchange;

import com.trade.scalp.core.Side;
import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;

/**
 * 下单接口
 * 决策核心只通过此接口下市价单，不直接调用交易所SDK
 */
public interface OrderExecutor {

    /**
     * 下市价单
     * @return 交易所订单ID
     * @throws ExchangeException 下单失败
     */
    String placeOrder(Symbol symbol, Side side, BigDecimal quantity) throws ExchangeException;
}
