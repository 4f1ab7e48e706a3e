package com.trade.agent.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 决策执行状态，序列化为小写（pending / completed / failed）
 */
public enum ExecutionStatus {
    PENDING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus parse(String raw) {
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
