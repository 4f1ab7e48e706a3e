package com.trade.agent.core;

/**
 * 订单方向
 */
public enum Side {
    BUY,
    SELL;

    /**
     * 解析交易所返回的方向（大小写不敏感），无法识别时抛出 IllegalArgumentException
     */
    public static Side parse(String raw) {
        String value = raw == null ? "" : raw.trim();
        if ("buy".equalsIgnoreCase(value)) {
            return BUY;
        }
        if ("sell".equalsIgnoreCase(value)) {
            return SELL;
        }
        throw new IllegalArgumentException("Unknown order side: '" + raw + "'");
    }
}
