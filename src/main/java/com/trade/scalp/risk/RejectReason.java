package com.trade.scalp.risk;

/**
 * 风控拒绝原因
 */
public enum RejectReason {
    TRADING_DISABLED("交易已暂停"),
    DAILY_LOSS_LIMIT("当日亏损达到上限"),
    MAX_OPEN_POSITIONS("持仓数量达到上限"),
    TRADE_INTERVAL("距上次开仓时间过短"),
    POSITION_SIZE_LIMIT("仓位价值超过上限"),
    POSITION_LOSS_LIMIT("单笔风险超过上限"),
    INVALID_SIZE("仓位计算无效");

    private final String description;

    RejectReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
