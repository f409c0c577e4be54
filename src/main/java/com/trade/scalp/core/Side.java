package com.trade.scalp.core;

/**
 * 交易方向
 * BUY 开多 / 平空，SELL 开空 / 平多
 */
public enum Side {
    BUY("做多"),
    SELL("做空");

    private final String chineseName;

    Side(String chineseName) {
        this.chineseName = chineseName;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public boolean isLong() {
        return this == BUY;
    }

    public String getChineseName() {
        return chineseName;
    }
}
