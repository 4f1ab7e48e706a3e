package com.trade.agent.history;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 交易统计（每次查询重新计算）
 */
public class HistoryStatistics {

    private final int periodDays;
    private final Instant since;
    private final int totalTrades;
    private final BigDecimal totalVolume;
    private final BigDecimal totalPnl;
    private final BigDecimal pnlPercentage;
    private final BigDecimal avgTradeSize;
    private final BigDecimal maxDrawdownPercentage;
    private final int activePositions;

    public HistoryStatistics(int periodDays, Instant since, int totalTrades, BigDecimal totalVolume,
                             BigDecimal totalPnl, BigDecimal pnlPercentage, BigDecimal avgTradeSize,
                             BigDecimal maxDrawdownPercentage, int activePositions) {
        this.periodDays = periodDays;
        this.since = since;
        this.totalTrades = totalTrades;
        this.totalVolume = totalVolume;
        this.totalPnl = totalPnl;
        this.pnlPercentage = pnlPercentage;
        this.avgTradeSize = avgTradeSize;
        this.maxDrawdownPercentage = maxDrawdownPercentage;
        this.activePositions = activePositions;
    }

    public int getPeriodDays() { return periodDays; }
    public Instant getSince() { return since; }
    public int getTotalTrades() { return totalTrades; }
    public BigDecimal getTotalVolume() { return totalVolume; }
    public BigDecimal getTotalPnl() { return totalPnl; }
    public BigDecimal getPnlPercentage() { return pnlPercentage; }
    public BigDecimal getAvgTradeSize() { return avgTradeSize; }

    /**
     * 快照权益的最大回撤，负值百分比（无回撤为 0）
     */
    public BigDecimal getMaxDrawdownPercentage() { return maxDrawdownPercentage; }
    public int getActivePositions() { return activePositions; }

    @Override
    public String toString() {
        return String.format(
                """
                ==================== 交易统计 ====================
                统计周期:          %d 天（自 %s）
                成交次数:          %d
                成交额:            %.2f USDT
                总盈亏:            %.2f USDT
                收益率:            %.2f%%
                平均成交额:        %.2f USDT
                最大回撤:          %.2f%%
                当前持仓数:        %d
                ================================================
                """,
                periodDays, since, totalTrades, totalVolume, totalPnl, pnlPercentage,
                avgTradeSize, maxDrawdownPercentage, activePositions
        );
    }
}
