package com.trade.scalp.market;

import com.trade.scalp.core.Candle;

/**
 * 收盘K线监听器
 * 行情方在每个交易对的K线收盘时异步回调
 */
public interface CandleListener {

    /**
     * 收盘K线回调
     */
    void onCandleClosed(Candle candle);

    /**
     * 错误回调
     */
    default void onError(Throwable throwable) {
    }
}
