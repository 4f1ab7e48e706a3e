package com.trade.agent.execution;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 一个周期的决策集合：symbol -> Decision，保持插入顺序
 */
public class DecisionBatch {

    private final String batchId;
    private final Instant createdAt;
    private final Map<String, Decision> decisions;

    public DecisionBatch(Map<String, Decision> decisions) {
        this(UUID.randomUUID().toString(), Instant.now(), decisions);
    }

    @JsonCreator
    public DecisionBatch(@JsonProperty("batch_id") String batchId,
                         @JsonProperty("created_at") Instant createdAt,
                         @JsonProperty("decisions") Map<String, Decision> decisions) {
        this.batchId = batchId;
        this.createdAt = createdAt;
        this.decisions = new LinkedHashMap<>();
        if (decisions != null) {
            decisions.forEach((symbol, decision) -> {
                if (decision.getSymbol() == null) {
                    decision.setSymbol(symbol);
                }
                this.decisions.put(symbol, decision);
            });
        }
    }

    @JsonProperty("batch_id")
    public String getBatchId() {
        return batchId;
    }

    @JsonProperty("created_at")
    public Instant getCreatedAt() {
        return createdAt;
    }

    @JsonProperty("decisions")
    public Map<String, Decision> getDecisions() {
        return Collections.unmodifiableMap(decisions);
    }

    public boolean isEmpty() {
        return decisions.isEmpty();
    }

    public int size() {
        return decisions.size();
    }
}
