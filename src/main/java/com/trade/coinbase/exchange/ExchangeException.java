package com.trade.coinbase.exchange;

/**
 * 交易所异常
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

    public boolean isRemote() {
        return errorCode.isRemote();
    }

    public enum ErrorCode {
        NETWORK_ERROR(true),     // 请求失败（网络、5xx）
        TIMEOUT(true),           // 超时
        RATE_LIMIT(true),        // 频率限制
        API_ERROR(true),         // 交易所返回的业务错误
        AUTH_FAILED(true),       // 认证失败
        NOT_SUPPORTED(false),    // 前置条件不满足
        CANCELLED(false),        // 调用线程被中断
        UNKNOWN(false);          // 未知错误

        private final boolean remote;

        ErrorCode(boolean remote) {
            this.remote = remote;
        }

        /**
         * True for failures reported by or on the way to the exchange.
         */
        public boolean isRemote() {
            return remote;
        }
    }
}
