package com.trade.agent.core;

/**
 * 持仓方向
 */
public enum PositionSide {
    LONG,   // 多头持仓
    SHORT;  // 空头持仓

    /**
     * 开仓方向对应的下单方向
     */
    public Side openSide() {
        return this == LONG ? Side.BUY : Side.SELL;
    }

    /**
     * 平仓方向对应的下单方向
     */
    public Side closeSide() {
        return this == LONG ? Side.SELL : Side.BUY;
    }

    public String lowerName() {
        return this == LONG ? "long" : "short";
    }
}
