package com.trade.scalp.risk;

import java.math.BigDecimal;

/**
 * 单笔交易结果，盈亏为0记为亏损
 */
public enum TradeOutcome {
    WIN,
    LOSS;

    public static TradeOutcome of(BigDecimal pnl) {
        return pnl.compareTo(BigDecimal.ZERO) > 0 ? WIN : LOSS;
    }
}
