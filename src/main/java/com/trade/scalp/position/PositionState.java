package com.trade.scalp.position;

/**
 * 单个交易对的持仓状态
 * OPENING / CLOSING 表示已决定、等待外部订单结果
 */
public enum PositionState {
    NONE,
    OPENING,
    OPEN,
    CLOSING
}
