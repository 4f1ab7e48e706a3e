package com.trade.agent.exchange;

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

    public enum ErrorCode {
        CONNECTION,             // 网络错误或超时
        AUTHENTICATION,         // 认证失败
        INSUFFICIENT_FUNDS,     // 保证金不足
        SYMBOL_NOT_FOUND,       // 无效交易对
        POSITION_NOT_FOUND,     // 没有可平的持仓
        ORDER_NOT_FOUND,        // 订单不存在
        INVALID_QUANTITY,       // 数量非法（如平仓数量大于持仓）
        TRADING_ERROR,          // 交易所拒单或其他业务错误
        RATE_LIMIT              // 频率限制
    }
}
