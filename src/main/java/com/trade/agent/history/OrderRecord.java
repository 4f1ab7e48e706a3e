package com.trade.agent.history;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.trade.agent.core.ExchangeOrder;
import com.trade.agent.core.OrderStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

/**
 * 订单记录，以交易所 orderId 为键
 * 同步时对已存在的记录原地更新成交相关字段
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OrderRecord {

    // 订单基本信息
    private String orderId;
    private String symbol;
    private String side;            // BUY / SELL
    private String type;            // MARKET / LIMIT / STOP_MARKET ...
    private BigDecimal amount;
    private BigDecimal price;

    // 执行信息
    private BigDecimal filled;
    private BigDecimal remaining;
    private BigDecimal averagePrice;
    private BigDecimal cost;
    private BigDecimal fee;
    private String feeCurrency;
    private OrderStatus status;

    private Instant createdTime;
    private Instant updatedTime;
    private Instant filledTime;
    private JsonNode rawData;
    private Instant createdAt;

    public OrderRecord() {
    }

    public static OrderRecord from(ExchangeOrder order, Instant now) {
        OrderRecord record = new OrderRecord();
        record.orderId = order.getOrderId();
        record.symbol = order.getSymbol();
        record.side = order.getSide().name();
        record.type = order.getType() == null ? "MARKET" : order.getType().toUpperCase(Locale.ROOT);
        record.amount = order.getAmount();
        record.price = order.getPrice();
        record.createdTime = order.getCreatedTime();
        record.createdAt = now;
        record.applyUpdate(order);
        return record;
    }

    /**
     * 独立副本，存储层只对外交出副本
     */
    public OrderRecord copy() {
        OrderRecord copy = new OrderRecord();
        copy.orderId = orderId;
        copy.symbol = symbol;
        copy.side = side;
        copy.type = type;
        copy.amount = amount;
        copy.price = price;
        copy.createdTime = createdTime;
        copy.createdAt = createdAt;
        copy.mergeFrom(this);
        copy.rawData = rawData == null ? null : rawData.deepCopy();
        return copy;
    }

    /**
     * 用最新的交易所数据覆盖可变字段
     */
    public void applyUpdate(ExchangeOrder order) {
        this.filled = order.getFilled();
        this.remaining = order.getRemaining();
        this.averagePrice = order.getAveragePrice();
        this.cost = order.getCost();
        this.fee = order.getFee();
        this.feeCurrency = order.getFeeCurrency();
        this.status = order.getStatus();
        this.updatedTime = order.getUpdatedTime();
        this.filledTime = order.getStatus() == OrderStatus.FILLED ? order.getUpdatedTime() : null;
        this.rawData = order.getRawData();
    }

    /**
     * 将同一订单的较新记录合并进来（键字段与创建信息保持不变）
     */
    public void mergeFrom(OrderRecord newer) {
        this.filled = newer.filled;
        this.remaining = newer.remaining;
        this.averagePrice = newer.averagePrice;
        this.cost = newer.cost;
        this.fee = newer.fee;
        this.feeCurrency = newer.feeCurrency;
        this.status = newer.status;
        this.updatedTime = newer.updatedTime;
        this.filledTime = newer.filledTime;
        this.rawData = newer.rawData;
    }

    public String getOrderId() { return orderId; }
    public void setOrderId(String orderId) { this.orderId = orderId; }
    public String getSymbol() { return symbol; }
    public void setSymbol(String symbol) { this.symbol = symbol; }
    public String getSide() { return side; }
    public void setSide(String side) { this.side = side; }
    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }
    public BigDecimal getPrice() { return price; }
    public void setPrice(BigDecimal price) { this.price = price; }
    public BigDecimal getFilled() { return filled; }
    public void setFilled(BigDecimal filled) { this.filled = filled; }
    public BigDecimal getRemaining() { return remaining; }
    public void setRemaining(BigDecimal remaining) { this.remaining = remaining; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public void setAveragePrice(BigDecimal averagePrice) { this.averagePrice = averagePrice; }
    public BigDecimal getCost() { return cost; }
    public void setCost(BigDecimal cost) { this.cost = cost; }
    public BigDecimal getFee() { return fee; }
    public void setFee(BigDecimal fee) { this.fee = fee; }
    public String getFeeCurrency() { return feeCurrency; }
    public void setFeeCurrency(String feeCurrency) { this.feeCurrency = feeCurrency; }
    public OrderStatus getStatus() { return status; }
    public void setStatus(OrderStatus status) { this.status = status; }
    public Instant getCreatedTime() { return createdTime; }
    public void setCreatedTime(Instant createdTime) { this.createdTime = createdTime; }
    public Instant getUpdatedTime() { return updatedTime; }
    public void setUpdatedTime(Instant updatedTime) { this.updatedTime = updatedTime; }
    public Instant getFilledTime() { return filledTime; }
    public void setFilledTime(Instant filledTime) { this.filledTime = filledTime; }
    public JsonNode getRawData() { return rawData; }
    public void setRawData(JsonNode rawData) { this.rawData = rawData; }
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return String.format("OrderRecord{%s %s %s %s filled=%s/%s status=%s}",
                orderId, symbol, side, type, filled, amount, status);
    }
}
