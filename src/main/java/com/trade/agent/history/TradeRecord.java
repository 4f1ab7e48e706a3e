package com.trade.agent.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.trade.agent.core.ExchangeTrade;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 成交记录，以交易所 tradeId 为键，写入后不再变化
 */
public final class TradeRecord {

    private final String tradeId;
    private final String orderId;
    private final String symbol;
    private final String side;          // BUY / SELL
    private final BigDecimal amount;
    private final BigDecimal price;
    private final BigDecimal cost;      // amount * price
    private final BigDecimal feeCost;
    private final String feeCurrency;
    private final Instant tradeTime;
    private final Instant createdAt;
    private final JsonNode rawData;

    @JsonCreator
    public TradeRecord(@JsonProperty("trade_id") String tradeId,
                       @JsonProperty("order_id") String orderId,
                       @JsonProperty("symbol") String symbol,
                       @JsonProperty("side") String side,
                       @JsonProperty("amount") BigDecimal amount,
                       @JsonProperty("price") BigDecimal price,
                       @JsonProperty("cost") BigDecimal cost,
                       @JsonProperty("fee_cost") BigDecimal feeCost,
                       @JsonProperty("fee_currency") String feeCurrency,
                       @JsonProperty("trade_time") Instant tradeTime,
                       @JsonProperty("created_at") Instant createdAt,
                       @JsonProperty("raw_data") JsonNode rawData) {
        this.tradeId = tradeId;
        this.orderId = orderId;
        this.symbol = symbol;
        this.side = side;
        this.amount = amount;
        this.price = price;
        this.cost = cost;
        this.feeCost = feeCost == null ? BigDecimal.ZERO : feeCost;
        this.feeCurrency = feeCurrency;
        this.tradeTime = tradeTime;
        this.createdAt = createdAt;
        this.rawData = rawData;
    }

    public static TradeRecord from(ExchangeTrade trade, Instant now) {
        return new TradeRecord(trade.getTradeId(), trade.getOrderId(), trade.getSymbol(),
                trade.getSide().name(), trade.getAmount(), trade.getPrice(),
                trade.getCost(), trade.getFeeCost(), trade.getFeeCurrency(), trade.getTradeTime(), now,
                trade.getRawData());
    }

    @JsonProperty("trade_id") public String getTradeId() { return tradeId; }
    @JsonProperty("order_id") public String getOrderId() { return orderId; }
    @JsonProperty("symbol") public String getSymbol() { return symbol; }
    @JsonProperty("side") public String getSide() { return side; }
    @JsonProperty("amount") public BigDecimal getAmount() { return amount; }
    @JsonProperty("price") public BigDecimal getPrice() { return price; }
    @JsonProperty("cost") public BigDecimal getCost() { return cost; }
    @JsonProperty("fee_cost") public BigDecimal getFeeCost() { return feeCost; }
    @JsonProperty("fee_currency") public String getFeeCurrency() { return feeCurrency; }
    @JsonProperty("trade_time") public Instant getTradeTime() { return tradeTime; }
    @JsonProperty("created_at") public Instant getCreatedAt() { return createdAt; }
    @JsonProperty("raw_data") public JsonNode getRawData() { return rawData; }

    @Override
    public String toString() {
        return String.format("TradeRecord{%s order=%s %s %s %s@%s}", tradeId, orderId, symbol, side, amount, price);
    }
}
