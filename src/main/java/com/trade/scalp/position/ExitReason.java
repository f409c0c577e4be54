package com.trade.scalp.position;

/**
 * 平仓原因，按优先级排列
 */
public enum ExitReason {
    STOP_LOSS("止损"),
    TAKE_PROFIT("止盈"),
    MAX_TIME("持仓超时"),
    TECHNICAL_EXIT("技术指标离场");

    private final String description;

    ExitReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
