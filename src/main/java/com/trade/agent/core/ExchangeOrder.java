package com.trade.agent.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 交易所订单历史的一行（适配器已标准化）
 */
public class ExchangeOrder {
    private final String orderId;
    private final String symbol;
    private final Side side;
    private final String type;
    private final BigDecimal amount;
    private final BigDecimal price;
    private final BigDecimal filled;
    private final BigDecimal remaining;
    private final BigDecimal averagePrice;
    private final BigDecimal cost;
    private final BigDecimal fee;
    private final String feeCurrency;
    private final OrderStatus status;
    private final Instant createdTime;
    private final Instant updatedTime;
    private final JsonNode rawData;

    private ExchangeOrder(Builder builder) {
        this.orderId = builder.orderId;
        this.symbol = builder.symbol;
        this.side = builder.side;
        this.type = builder.type;
        this.amount = builder.amount;
        this.price = builder.price;
        this.filled = builder.filled;
        this.remaining = builder.remaining != null ? builder.remaining : builder.amount.subtract(builder.filled).max(BigDecimal.ZERO);
        this.averagePrice = builder.averagePrice;
        this.cost = builder.cost;
        this.fee = builder.fee;
        this.feeCurrency = builder.feeCurrency;
        this.status = builder.status;
        this.createdTime = builder.createdTime;
        this.updatedTime = builder.updatedTime;
        this.rawData = builder.rawData;
    }

    public String getOrderId() { return orderId; }
    public String getSymbol() { return symbol; }
    public Side getSide() { return side; }
    public String getType() { return type; }
    public BigDecimal getAmount() { return amount; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getFilled() { return filled; }
    public BigDecimal getRemaining() { return remaining; }
    public BigDecimal getAveragePrice() { return averagePrice; }
    public BigDecimal getCost() { return cost; }
    public BigDecimal getFee() { return fee; }
    public String getFeeCurrency() { return feeCurrency; }
    public OrderStatus getStatus() { return status; }
    public Instant getCreatedTime() { return createdTime; }
    public Instant getUpdatedTime() { return updatedTime; }
    public JsonNode getRawData() { return rawData; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String orderId;
        private String symbol;
        private Side side;
        private String type = "MARKET";
        private BigDecimal amount = BigDecimal.ZERO;
        private BigDecimal price;
        private BigDecimal filled = BigDecimal.ZERO;
        private BigDecimal remaining;
        private BigDecimal averagePrice;
        private BigDecimal cost = BigDecimal.ZERO;
        private BigDecimal fee = BigDecimal.ZERO;
        private String feeCurrency;
        private OrderStatus status = OrderStatus.PENDING;
        private Instant createdTime;
        private Instant updatedTime;
        private JsonNode rawData;

        public Builder orderId(String orderId) { this.orderId = orderId; return this; }
        public Builder symbol(String symbol) { this.symbol = symbol; return this; }
        public Builder side(Side side) { this.side = side; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder amount(BigDecimal amount) { this.amount = amount; return this; }
        public Builder price(BigDecimal price) { this.price = price; return this; }
        public Builder filled(BigDecimal filled) { this.filled = filled; return this; }
        public Builder remaining(BigDecimal remaining) { this.remaining = remaining; return this; }
        public Builder averagePrice(BigDecimal averagePrice) { this.averagePrice = averagePrice; return this; }
        public Builder cost(BigDecimal cost) { this.cost = cost; return this; }
        public Builder fee(BigDecimal fee) { this.fee = fee; return this; }
        public Builder feeCurrency(String feeCurrency) { this.feeCurrency = feeCurrency; return this; }
        public Builder status(OrderStatus status) { this.status = status; return this; }
        public Builder createdTime(Instant createdTime) { this.createdTime = createdTime; return this; }
        public Builder updatedTime(Instant updatedTime) { this.updatedTime = updatedTime; return this; }
        public Builder rawData(JsonNode rawData) { this.rawData = rawData; return this; }

        public ExchangeOrder build() {
            if (orderId == null || orderId.isBlank() || symbol == null || side == null || createdTime == null) {
                throw new IllegalStateException("orderId, symbol, side, createdTime 必须设置");
            }
            return new ExchangeOrder(this);
        }
    }
}
