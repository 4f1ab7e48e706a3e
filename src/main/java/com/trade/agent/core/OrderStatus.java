package com.trade.agent.core;

/**
 * 订单状态
 */
public enum OrderStatus {
    PENDING,            // 已提交未成交
    PARTIALLY_FILLED,   // 部分成交
    FILLED,             // 完全成交
    CANCELLED,          // 已取消/过期
    FAILED              // 被拒绝或下单失败
}
