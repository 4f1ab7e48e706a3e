package com.trade.agent.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 单次下单调用的执行结果
 */
public class OrderResult {
    private final String symbol;
    private final String orderId;             // 交易所订单ID
    private final String clientOrderId;
    private final Side side;
    private final String type;                // MARKET / STOP_MARKET ...
    private final BigDecimal quantity;
    private final BigDecimal price;           // 市价单可能为 null
    private final BigDecimal executedQuantity;
    private final BigDecimal executedPrice;   // 可能为 null
    private final OrderStatus status;
    private final BigDecimal fees;
    private final Instant timestamp;
    private final String exchange;
    private final JsonNode rawData;

    private OrderResult(Builder builder) {
        this.symbol = builder.symbol;
        this.orderId = builder.orderId;
        this.clientOrderId = builder.clientOrderId;
        this.side = builder.side;
        this.type = builder.type;
        this.quantity = builder.quantity;
        this.price = builder.price;
        this.executedQuantity = builder.executedQuantity;
        this.executedPrice = builder.executedPrice;
        this.status = builder.status;
        this.fees = builder.fees;
        this.timestamp = builder.timestamp;
        this.exchange = builder.exchange;
        this.rawData = builder.rawData;
    }

    public String getSymbol() { return symbol; }
    public String getOrderId() { return orderId; }
    public String getClientOrderId() { return clientOrderId; }
    public Side getSide() { return side; }
    public String getType() { return type; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getExecutedQuantity() { return executedQuantity; }
    public BigDecimal getExecutedPrice() { return executedPrice; }
    public OrderStatus getStatus() { return status; }
    public BigDecimal getFees() { return fees; }
    public Instant getTimestamp() { return timestamp; }
    public String getExchange() { return exchange; }
    public JsonNode getRawData() { return rawData; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String symbol;
        private String orderId;
        private String clientOrderId;
        private Side side;
        private String type = "MARKET";
        private BigDecimal quantity = BigDecimal.ZERO;
        private BigDecimal price;
        private BigDecimal executedQuantity = BigDecimal.ZERO;
        private BigDecimal executedPrice;
        private OrderStatus status = OrderStatus.PENDING;
        private BigDecimal fees = BigDecimal.ZERO;
        private Instant timestamp = Instant.now();
        private String exchange;
        private JsonNode rawData;

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder orderId(String orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder clientOrderId(String clientOrderId) {
            this.clientOrderId = clientOrderId;
            return this;
        }

        public Builder side(Side side) {
            this.side = side;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder price(BigDecimal price) {
            this.price = price;
            return this;
        }

        public Builder executedQuantity(BigDecimal executedQuantity) {
            this.executedQuantity = executedQuantity;
            return this;
        }

        public Builder executedPrice(BigDecimal executedPrice) {
            this.executedPrice = executedPrice;
            return this;
        }

        public Builder status(OrderStatus status) {
            this.status = status;
            return this;
        }

        public Builder fees(BigDecimal fees) {
            this.fees = fees;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder rawData(JsonNode rawData) {
            this.rawData = rawData;
            return this;
        }

        public OrderResult build() {
            if (symbol == null || side == null || orderId == null) {
                throw new IllegalStateException("symbol, side, orderId 必须设置");
            }
            if (quantity == null || quantity.compareTo(BigDecimal.ZERO) < 0) {
                throw new IllegalStateException("quantity 不能为负数");
            }
            if (executedQuantity == null || executedQuantity.compareTo(BigDecimal.ZERO) < 0) {
                throw new IllegalStateException("executedQuantity 不能为负数");
            }
            if (quantity.signum() > 0 && executedQuantity.compareTo(quantity) > 0) {
                throw new IllegalStateException("executedQuantity 不能超过 quantity");
            }
            return new OrderResult(this);
        }
    }

    @Override
    public String toString() {
        return String.format("OrderResult{id=%s, symbol=%s, side=%s, type=%s, qty=%s, executed=%s, status=%s}",
                orderId, symbol, side, type, quantity, executedQuantity, status);
    }
}
