package com.trade.agent.core;

/**
 * 单个交易所的配置项（exchange.&lt;id&gt;.*）
 */
public class ExchangeEntry {

    private final String id;
    private final String apiKey;
    private final String apiSecret;
    private final String passphrase;
    private final boolean testnet;
    private final String restUrl;
    private final int defaultLeverage;
    private final String marginMode;
    private final boolean hedgeMode;

    public ExchangeEntry(String id, String apiKey, String apiSecret, String passphrase,
                         boolean testnet, String restUrl, int defaultLeverage,
                         String marginMode, boolean hedgeMode) {
        this.id = id;
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.passphrase = passphrase;
        this.testnet = testnet;
        this.restUrl = restUrl;
        this.defaultLeverage = defaultLeverage;
        this.marginMode = marginMode;
        this.hedgeMode = hedgeMode;
    }

    public String getId() { return id; }
    public String getApiKey() { return apiKey; }
    public String getApiSecret() { return apiSecret; }
    public String getPassphrase() { return passphrase; }
    public boolean isTestnet() { return testnet; }
    /** 为空表示使用适配器内置地址 */
    public String getRestUrl() { return restUrl; }
    public int getDefaultLeverage() { return defaultLeverage; }
    /** cross / isolated */
    public String getMarginMode() { return marginMode; }
    public boolean isHedgeMode() { return hedgeMode; }

    public boolean isCrossMargin() {
        return !"isolated".equalsIgnoreCase(marginMode);
    }

    @Override
    public String toString() {
        return "ExchangeEntry{id=" + id + ", testnet=" + testnet + ", leverage=" + defaultLeverage
                + ", marginMode=" + marginMode + ", hedgeMode=" + hedgeMode + "}";
    }
}
