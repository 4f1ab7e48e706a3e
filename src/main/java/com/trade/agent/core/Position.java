package com.trade.agent.core;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 持仓
 * 每次查询交易所时重新构建，不做本地缓存
 */
public class Position {
    private final String symbol;            // 交易所原始符号
    private final PositionSide side;
    private final BigDecimal size;          // 持仓数量（基础币）
    private final BigDecimal entryPrice;    // 开仓均价
    private final BigDecimal markPrice;     // 标记价格
    private final BigDecimal unrealizedPnl; // 未实现盈亏
    private final BigDecimal leverage;      // 杠杆倍数
    private final BigDecimal margin;        // 占用保证金
    private final Instant timestamp;
    private final String exchange;

    public Position(String symbol, PositionSide side, BigDecimal size, BigDecimal entryPrice,
                    BigDecimal markPrice, BigDecimal unrealizedPnl, BigDecimal leverage,
                    BigDecimal margin, Instant timestamp, String exchange) {
        if (size == null || size.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Position size must be positive: " + size);
        }
        if (leverage == null || leverage.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Leverage must be positive: " + leverage);
        }
        this.symbol = symbol;
        this.side = side;
        this.size = size;
        this.entryPrice = entryPrice;
        this.markPrice = markPrice;
        this.unrealizedPnl = unrealizedPnl;
        this.leverage = leverage;
        this.margin = margin;
        this.timestamp = timestamp;
        this.exchange = exchange;
    }

    public String getSymbol() { return symbol; }
    public PositionSide getSide() { return side; }
    public BigDecimal getSize() { return size; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getMarkPrice() { return markPrice; }
    public BigDecimal getUnrealizedPnl() { return unrealizedPnl; }
    public BigDecimal getLeverage() { return leverage; }
    public BigDecimal getMargin() { return margin; }
    public Instant getTimestamp() { return timestamp; }
    public String getExchange() { return exchange; }

    @Override
    public String toString() {
        return String.format("Position{symbol=%s, side=%s, size=%s, entry=%s, mark=%s, upnl=%s, lev=%s}",
                symbol, side, size, entryPrice, markPrice, unrealizedPnl, leverage);
    }
}
