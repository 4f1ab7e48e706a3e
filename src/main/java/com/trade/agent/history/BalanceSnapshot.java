package com.trade.agent.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.trade.agent.core.Balance;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 账户余额快照（只追加）
 */
public final class BalanceSnapshot {

    private final Instant timestamp;
    private final BigDecimal totalBalance;
    private final BigDecimal availableBalance;
    private final BigDecimal marginBalance;
    private final BigDecimal unrealizedPnl;
    private final String currency;
    private final Instant createdAt;

    @JsonCreator
    public BalanceSnapshot(@JsonProperty("timestamp") Instant timestamp,
                           @JsonProperty("total_balance") BigDecimal totalBalance,
                           @JsonProperty("available_balance") BigDecimal availableBalance,
                           @JsonProperty("margin_balance") BigDecimal marginBalance,
                           @JsonProperty("unrealized_pnl") BigDecimal unrealizedPnl,
                           @JsonProperty("currency") String currency,
                           @JsonProperty("created_at") Instant createdAt) {
        this.timestamp = timestamp;
        this.totalBalance = totalBalance;
        this.availableBalance = availableBalance;
        this.marginBalance = marginBalance;
        this.unrealizedPnl = unrealizedPnl == null ? BigDecimal.ZERO : unrealizedPnl;
        this.currency = currency == null ? "USDT" : currency;
        this.createdAt = createdAt;
    }

    public static BalanceSnapshot of(Balance balance, Instant createdAt) {
        return new BalanceSnapshot(balance.getTimestamp(), balance.getTotalBalance(), balance.getAvailableBalance(),
                balance.getMarginBalance(), balance.getUnrealizedPnl(), balance.getCurrency(), createdAt);
    }

    @JsonProperty("timestamp") public Instant getTimestamp() { return timestamp; }
    @JsonProperty("total_balance") public BigDecimal getTotalBalance() { return totalBalance; }
    @JsonProperty("available_balance") public BigDecimal getAvailableBalance() { return availableBalance; }
    @JsonProperty("margin_balance") public BigDecimal getMarginBalance() { return marginBalance; }
    @JsonProperty("unrealized_pnl") public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    @JsonProperty("currency") public String getCurrency() { return currency; }
    @JsonProperty("created_at") public Instant getCreatedAt() { return createdAt; }

    @Override
    public String toString() {
        return String.format("BalanceSnapshot{%s total=%s upnl=%s}", timestamp, totalBalance, unrealizedPnl);
    }
}
