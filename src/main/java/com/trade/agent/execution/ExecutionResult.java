package com.trade.agent.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * 单个决策的执行结果
 * status 为 success 时携带 message，为 failed 时携带 error
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionResult {

    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    private final String status;
    private final DecisionAction action;
    private final String symbol;
    private final BigDecimal quantity;
    private final Integer leverage;
    private final BigDecimal price;
    private final String message;
    private final String error;
    private final Instant timestamp;

    @JsonCreator
    private ExecutionResult(@JsonProperty("status") String status,
                            @JsonProperty("action") DecisionAction action,
                            @JsonProperty("symbol") String symbol,
                            @JsonProperty("quantity") BigDecimal quantity,
                            @JsonProperty("leverage") Integer leverage,
                            @JsonProperty("price") BigDecimal price,
                            @JsonProperty("message") String message,
                            @JsonProperty("error") String error,
                            @JsonProperty("timestamp") Instant timestamp) {
        this.status = status;
        this.action = action;
        this.symbol = symbol;
        this.quantity = quantity;
        this.leverage = leverage;
        this.price = price;
        this.message = message;
        this.error = error;
        this.timestamp = timestamp;
    }

    public static ExecutionResult success(DecisionAction action, String symbol, BigDecimal quantity,
                                          Integer leverage, BigDecimal price, String message, Instant timestamp) {
        return new ExecutionResult(SUCCESS, action, symbol, quantity, leverage, price, message, null, timestamp);
    }

    public static ExecutionResult noop(DecisionAction action, String symbol, String message, Instant timestamp) {
        return new ExecutionResult(SUCCESS, action, symbol, null, null, null, message, null, timestamp);
    }

    public static ExecutionResult failure(DecisionAction action, String symbol, String error, Instant timestamp) {
        return new ExecutionResult(FAILED, action, symbol, null, null, null, null, error, timestamp);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }

    public String getStatus() { return status; }
    public DecisionAction getAction() { return action; }
    public String getSymbol() { return symbol; }
    public BigDecimal getQuantity() { return quantity; }
    public Integer getLeverage() { return leverage; }
    public BigDecimal getPrice() { return price; }
    public String getMessage() { return message; }
    public String getError() { return error; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("ExecutionResult{%s %s success: %s}", action, symbol, message)
                : String.format("ExecutionResult{%s %s failed: %s}", action, symbol, error);
    }
}
