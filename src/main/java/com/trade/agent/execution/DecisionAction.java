package com.trade.agent.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.trade.agent.core.PositionSide;

import java.util.Locale;

/**
 * 交易决策动作
 */
public enum DecisionAction {
    OPEN_LONG,
    OPEN_SHORT,
    CLOSE_LONG,
    CLOSE_SHORT,
    HOLD;

    @JsonCreator
    public static DecisionAction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("决策动作为空");
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isOpen() {
        return this == OPEN_LONG || this == OPEN_SHORT;
    }

    public boolean isClose() {
        return this == CLOSE_LONG || this == CLOSE_SHORT;
    }

    /**
     * 开平仓对应的持仓方向，HOLD 返回 null
     */
    public PositionSide positionSide() {
        switch (this) {
            case OPEN_LONG:
            case CLOSE_LONG:
                return PositionSide.LONG;
            case OPEN_SHORT:
            case CLOSE_SHORT:
                return PositionSide.SHORT;
            default:
                return null;
        }
    }
}
