package com.trade.scalp.exchange;

/**
 * 外部交易服务异常（下单、余额、行情）
 * 调用方捕获后记录日志，对应的状态转换不提交
 */
public class ExchangeException extends Exception {

    private final ErrorCode errorCode;

    public ExchangeException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ExchangeException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * 网络、限频、超时类错误可以在下个周期重试
     */
    public boolean isRetryable() {
        return errorCode == ErrorCode.NETWORK_ERROR
                || errorCode == ErrorCode.RATE_LIMIT
                || errorCode == ErrorCode.TIMEOUT;
    }

    public enum ErrorCode {
        NETWORK_ERROR,          // 网络错误
        API_ERROR,              // API错误
        NO_PRICE,               // 无行情
        INSUFFICIENT_BALANCE,   // 余额不足
        ORDER_REJECTED,         // 订单被拒绝
        RATE_LIMIT,             // 频率限制
        TIMEOUT,                // 超时
        UNKNOWN                 // 未知错误
    }
}
