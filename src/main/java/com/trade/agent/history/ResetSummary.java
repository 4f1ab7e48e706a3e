package com.trade.agent.history;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 系统重置结果
 */
public final class ResetSummary {

    private final boolean success;
    private final String message;
    private final Instant initTime;
    private final int syncedOrders;
    private final int syncedTrades;

    public ResetSummary(boolean success, String message, Instant initTime, int syncedOrders, int syncedTrades) {
        this.success = success;
        this.message = message;
        this.initTime = initTime;
        this.syncedOrders = syncedOrders;
        this.syncedTrades = syncedTrades;
    }

    @JsonProperty("success") public boolean isSuccess() { return success; }
    @JsonProperty("message") public String getMessage() { return message; }
    @JsonProperty("init_time") public Instant getInitTime() { return initTime; }
    @JsonProperty("synced_orders") public int getSyncedOrders() { return syncedOrders; }
    @JsonProperty("synced_trades") public int getSyncedTrades() { return syncedTrades; }

    @Override
    public String toString() {
        return String.format("ResetSummary{success=%s, initTime=%s, orders=%d, trades=%d}",
                success, initTime, syncedOrders, syncedTrades);
    }
}
