package com.trade.agent.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 交易所成交记录（一次成交一旦产生即不再变化）
 */
public class ExchangeTrade {
    private final String tradeId;
    private final String orderId;
    private final String symbol;
    private final Side side;
    private final BigDecimal amount;
    private final BigDecimal price;
    private final BigDecimal cost;
    private final BigDecimal feeCost;
    private final String feeCurrency;
    private final Instant tradeTime;
    private final JsonNode rawData;

    public ExchangeTrade(String tradeId, String orderId, String symbol, Side side,
                         BigDecimal amount, BigDecimal price, BigDecimal cost,
                         BigDecimal feeCost, String feeCurrency, Instant tradeTime, JsonNode rawData) {
        if (tradeId == null || tradeId.isBlank()) {
            throw new IllegalArgumentException("tradeId 必须设置");
        }
        this.tradeId = tradeId;
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.amount = amount;
        this.price = price;
        this.cost = cost != null ? cost : amount.multiply(price);
        this.feeCost = feeCost != null ? feeCost : BigDecimal.ZERO;
        this.feeCurrency = feeCurrency;
        this.tradeTime = tradeTime;
        this.rawData = rawData;
    }

    public String getTradeId() { return tradeId; }
    public String getOrderId() { return orderId; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getCost() { return cost; }
    public BigDecimal getFeeCost() { return feeCost; }
    public String getFeeCurrency() { return feeCurrency; }
    public Instant getTradeTime() { return tradeTime; }
    public JsonNode getRawData() { return rawData; }
}
