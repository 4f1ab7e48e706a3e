package com.trade.agent.history;

/**
 * 历史数据存储读写失败
 */
public class HistoryStoreException extends RuntimeException {

    public HistoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
