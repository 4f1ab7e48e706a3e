package com.trade.agent.history;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 系统配置项（键唯一）
 */
public final class SystemConfigEntry {

    private final String key;
    private final String value;
    private final String description;
    private final Instant createdAt;
    private final Instant updatedAt;

    @JsonCreator
    public SystemConfigEntry(@JsonProperty("key") String key,
                             @JsonProperty("value") String value,
                             @JsonProperty("description") String description,
                             @JsonProperty("created_at") Instant createdAt,
                             @JsonProperty("updated_at") Instant updatedAt) {
        this.key = key;
        this.value = value;
        this.description = description;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    SystemConfigEntry withValue(String newValue, Instant now) {
        return new SystemConfigEntry(key, newValue, description, createdAt, now);
    }

    @JsonProperty("key") public String getKey() { return key; }
    @JsonProperty("value") public String getValue() { return value; }
    @JsonProperty("description") public String getDescription() { return description; }
    @JsonProperty("created_at") public Instant getCreatedAt() { return createdAt; }
    @JsonProperty("updated_at") public Instant getUpdatedAt() { return updatedAt; }
}
