package com.trade.scalp.exchange;

import com.trade.scalp.core.Symbol;

import java.math.BigDecimal;

/**
 * 最新成交价查询
 */
public interface PriceFeed {

    BigDecimal getCurrentPrice(Symbol symbol) throws ExchangeException;
}
