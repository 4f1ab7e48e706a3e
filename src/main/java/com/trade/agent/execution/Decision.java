package com.trade.agent.execution;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;

/**
 * 单个标的的交易决策
 * 输入字段由决策方提供；executionStatus / executionResult 由执行器写入一次
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Decision {

    private String symbol;
    private DecisionAction action;
    private String reasoning;
    private BigDecimal positionSizeUsd;     // 仅开仓使用
    private BigDecimal stopLossPrice;
    private BigDecimal takeProfitPrice;
    private ExecutionStatus executionStatus = ExecutionStatus.PENDING;
    private ExecutionResult executionResult;

    public Decision() {
    }

    public Decision(String symbol, DecisionAction action, String reasoning, BigDecimal positionSizeUsd,
                    BigDecimal stopLossPrice, BigDecimal takeProfitPrice) {
        this.symbol = symbol;
        this.action = action;
        this.reasoning = reasoning;
        this.positionSizeUsd = positionSizeUsd;
        this.stopLossPrice = stopLossPrice;
        this.takeProfitPrice = takeProfitPrice;
    }

    public static Decision hold(String symbol, String reasoning) {
        return new Decision(symbol, DecisionAction.HOLD, reasoning, null, null, null);
    }

    /**
     * 写入执行结果，状态由结果决定
     */
    void complete(ExecutionResult result) {
        if (executionStatus != ExecutionStatus.PENDING) {
            throw new IllegalStateException("决策已执行: " + symbol + " " + executionStatus);
        }
        this.executionResult = result;
        this.executionStatus = result.isSuccess() ? ExecutionStatus.COMPLETED : ExecutionStatus.FAILED;
    }

    public String getSymbol() { return symbol; }
    public void setSymbol(String symbol) { this.symbol = symbol; }
    public DecisionAction getAction() { return action; }
    public void setAction(DecisionAction action) { this.action = action; }
    public String getReasoning() { return reasoning; }
    public void setReasoning(String reasoning) { this.reasoning = reasoning; }
    public BigDecimal getPositionSizeUsd() { return positionSizeUsd; }
    public void setPositionSizeUsd(BigDecimal positionSizeUsd) { this.positionSizeUsd = positionSizeUsd; }
    public BigDecimal getStopLossPrice() { return stopLossPrice; }
    public void setStopLossPrice(BigDecimal stopLossPrice) { this.stopLossPrice = stopLossPrice; }
    public BigDecimal getTakeProfitPrice() { return takeProfitPrice; }
    public void setTakeProfitPrice(BigDecimal takeProfitPrice) { this.takeProfitPrice = takeProfitPrice; }
    public ExecutionStatus getExecutionStatus() { return executionStatus; }
    public ExecutionResult getExecutionResult() { return executionResult; }

    // 仅供决策记录回读时反序列化
    void setExecutionStatus(ExecutionStatus executionStatus) { this.executionStatus = executionStatus; }
    void setExecutionResult(ExecutionResult executionResult) { this.executionResult = executionResult; }

    /**
     * 丢弃外部带入的执行状态，回到待执行
     */
    void resetExecution() {
        this.executionStatus = ExecutionStatus.PENDING;
        this.executionResult = null;
    }

    @Override
    public String toString() {
        return String.format("Decision{%s %s, size=$%s, sl=%s, tp=%s, status=%s}",
                symbol, action, positionSizeUsd, stopLossPrice, takeProfitPrice, executionStatus);
    }
}
