package com.trade.scalp.exchange;

import java.math.BigDecimal;

/**
 * 账户余额查询
 */
public interface AccountProvider {

    /**
     * 可用余额（计价货币）
     */
    BigDecimal getBalance() throws ExchangeException;
}
