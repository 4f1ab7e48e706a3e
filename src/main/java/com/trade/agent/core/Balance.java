package com.trade.agent.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 账户余额快照，构建后不可变
 */
public class Balance {
    private final BigDecimal totalBalance;       // 钱包总额
    private final BigDecimal availableBalance;   // 可用余额
    private final BigDecimal marginBalance;      // 保证金余额（含未实现盈亏）
    private final BigDecimal unrealizedPnl;      // 未实现盈亏
    private final String currency;
    private final Instant timestamp;

    public Balance(BigDecimal totalBalance, BigDecimal availableBalance, BigDecimal marginBalance,
                   BigDecimal unrealizedPnl, String currency, Instant timestamp) {
        this.totalBalance = totalBalance;
        this.availableBalance = availableBalance;
        this.marginBalance = marginBalance;
        this.unrealizedPnl = unrealizedPnl;
        this.currency = currency;
        this.timestamp = timestamp;
    }

    public BigDecimal getTotalBalance() { return totalBalance; }
    public BigDecimal getAvailableBalance() { return availableBalance; }
    public BigDecimal getMarginBalance() { return marginBalance; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public String getCurrency() { return currency; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("Balance{total=%s, available=%s, margin=%s, upnl=%s %s}",
                totalBalance, availableBalance, marginBalance, unrealizedPnl, currency);
    }
}
