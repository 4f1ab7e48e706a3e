package com.trade.agent.core;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * 交易代理配置
 * 从 config.properties 读取，启动时构建一次并显式传递给各组件
 */
public class TradingConfig {

    public static final String DEFAULT_CONFIG_FILE = "config.properties";
    public static final String CONFIG_TEMPLATE_FILE = "config.template.properties";

    private final Properties properties;

    private TradingConfig(Properties properties) {
        this.properties = properties;
    }

    /**
     * 加载配置文件
     */
    public static TradingConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigurationException("配置文件不存在: " + configPath
                    + "，请参照 " + CONFIG_TEMPLATE_FILE + " 创建");
        }
        Properties properties = new Properties();
        try (Reader reader = new InputStreamReader(Files.newInputStream(configPath), StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new ConfigurationException("无法加载配置文件: " + configPath, e);
        }
        TradingConfig config = new TradingConfig(properties);
        config.validate();
        return config;
    }

    public static TradingConfig fromProperties(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        TradingConfig config = new TradingConfig(copy);
        config.validate();
        return config;
    }

    /**
     * 验证配置完整性
     */
    private void validate() {
        List<String> errors = new ArrayList<>();
        if (getSymbols().isEmpty()) {
            errors.add("agent.symbols 必须是非空列表");
        }
        if (getLongProperty("agent.decision.interval.seconds", 300) <= 0) {
            errors.add("agent.decision.interval.seconds 必须为正数");
        }
        String exchangeName = getProperty("exchange.name", "");
        if (exchangeName.isEmpty()) {
            errors.add("缺少必需配置: exchange.name");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException("配置验证失败: " + String.join("; ", errors));
        }
    }

    // ==================== 业务配置 ====================

    public List<String> getSymbols() {
        String raw = getProperty("agent.symbols", "");
        if (raw.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> symbols = new ArrayList<>();
        for (String part : raw.split(",")) {
            String symbol = part.trim().toUpperCase(Locale.ROOT);
            if (!symbol.isEmpty()) {
                symbols.add(symbol);
            }
        }
        return Collections.unmodifiableList(symbols);
    }

    public Duration getDecisionInterval() {
        return Duration.ofSeconds(getLongProperty("agent.decision.interval.seconds", 300));
    }

    public Duration getErrorBackoff() {
        return Duration.ofSeconds(getLongProperty("agent.error.backoff.seconds", 30));
    }

    public String getDefaultExchange() {
        return getProperty("exchange.name", "binance_futures");
    }

    /**
     * 交易所配置；未启用时返回 empty
     */
    public Optional<ExchangeEntry> getExchangeEntry(String exchangeId) {
        String prefix = "exchange." + exchangeId + ".";
        if (!getBooleanProperty(prefix + "enabled", false)) {
            return Optional.empty();
        }
        return Optional.of(new ExchangeEntry(
                exchangeId,
                credential(prefix + "api.key"),
                credential(prefix + "api.secret"),
                credential(prefix + "passphrase"),
                getBooleanProperty(prefix + "testnet", true),
                getProperty(prefix + "rest.url", ""),
                getIntProperty(prefix + "default.leverage", getIntProperty("exchange.default.leverage", 1)),
                getProperty(prefix + "margin.mode", "cross"),
                getBooleanProperty(prefix + "hedge.mode", true)
        ));
    }

    private String credential(String key) {
        return hasProperty(key) ? getProperty(key) : "";
    }

    /**
     * 交易所默认杠杆，未配置时为 1
     */
    public int getDefaultLeverage(String exchangeId) {
        int leverage = getExchangeEntry(exchangeId)
                .map(ExchangeEntry::getDefaultLeverage)
                .orElseGet(() -> getIntProperty("exchange.default.leverage", 1));
        return Math.max(1, leverage);
    }

    public Path getHistoryDataDir() {
        return Paths.get(getProperty("history.data.dir", "data/history"));
    }

    public int getRecentSyncHours() {
        return getIntProperty("history.sync.recent.hours", 24);
    }

    public Duration getFullSyncDelay() {
        return Duration.ofMillis(getLongProperty("history.sync.full.delay.ms", 200));
    }

    public Duration getRecentSyncDelay() {
        return Duration.ofMillis(getLongProperty("history.sync.recent.delay.ms", 100));
    }

    public Path getDecisionInboxFile() {
        return Paths.get(getProperty("decision.inbox.file", "data/decisions/inbox.json"));
    }

    public Path getDecisionJournalFile() {
        return Paths.get(getProperty("decision.journal.file", "data/decisions/journal.jsonl"));
    }

    // ==================== 通用读取 ====================

    /**
     * 获取配置属性，缺失时抛出 ConfigurationException
     */
    public String getProperty(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new ConfigurationException("配置项缺失: " + key);
        }
        return value.trim();
    }

    public String getProperty(String key, String defaultValue) {
        String value = properties.getProperty(key);
        return value == null ? defaultValue : value.trim();
    }

    /**
     * 检查属性是否存在（模板占位值 YOUR_xxx 视为未配置）
     */
    public boolean hasProperty(String key) {
        String value = properties.getProperty(key);
        return value != null && !value.trim().isEmpty() && !value.trim().startsWith("YOUR_");
    }

    public int getIntProperty(String key, int defaultValue) {
        String value = getProperty(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("配置项不是整数: " + key + "=" + value, e);
        }
    }

    public long getLongProperty(String key, long defaultValue) {
        String value = getProperty(key, "");
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("配置项不是整数: " + key + "=" + value, e);
        }
    }

    public boolean getBooleanProperty(String key, boolean defaultValue) {
        String value = getProperty(key, "");
        return value.isEmpty() ? defaultValue : Boolean.parseBoolean(value);
    }
}
