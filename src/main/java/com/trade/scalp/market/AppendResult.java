package com.trade.scalp.market;

/**
 * K线追加结果
 */
public enum AppendResult {
    APPENDED,   // 已追加
    STALE       // 时间戳不晚于窗口最后一根（重复或乱序），未做任何修改
}
