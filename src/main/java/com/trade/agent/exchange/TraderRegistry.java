package com.trade.agent.exchange;

import com.trade.agent.core.ConfigurationException;
import com.trade.agent.core.ExchangeEntry;
import com.trade.agent.core.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 交易所注册表
 * 按名称（含别名）创建并缓存交易所适配器，启动时创建一次，随后按引用传递
 */
public class TraderRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TraderRegistry.class);

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();

    static {
        ALIASES.put("binance", BinanceFuturesTrader.EXCHANGE_NAME);
        ALIASES.put("binance_futures", BinanceFuturesTrader.EXCHANGE_NAME);
        ALIASES.put("binancefutures", BinanceFuturesTrader.EXCHANGE_NAME);
        ALIASES.put("okx", OkxSwapTrader.EXCHANGE_NAME);
        ALIASES.put("okex", OkxSwapTrader.EXCHANGE_NAME);
        ALIASES.put("okx_swap", OkxSwapTrader.EXCHANGE_NAME);
    }

    private final TradingConfig config;
    private final Map<String, Function<ExchangeEntry, ExchangeTrader>> factories;
    private final Map<String, ExchangeTrader> traders = new LinkedHashMap<>();

    public TraderRegistry(TradingConfig config) {
        this(config, defaultFactories());
    }

    /**
     * @param factories 规范名称 -> 适配器构造函数（测试可注入假实现）
     */
    public TraderRegistry(TradingConfig config, Map<String, Function<ExchangeEntry, ExchangeTrader>> factories) {
        this.config = config;
        this.factories = new LinkedHashMap<>(factories);
    }

    private static Map<String, Function<ExchangeEntry, ExchangeTrader>> defaultFactories() {
        Map<String, Function<ExchangeEntry, ExchangeTrader>> factories = new LinkedHashMap<>();
        factories.put(BinanceFuturesTrader.EXCHANGE_NAME, BinanceFuturesTrader::new);
        factories.put(OkxSwapTrader.EXCHANGE_NAME, OkxSwapTrader::new);
        return factories;
    }

    /**
     * 将别名规范化：binance -> binance_futures, okex -> okx
     */
    public static String canonicalName(String exchangeName) {
        if (exchangeName == null || exchangeName.isBlank()) {
            throw new ConfigurationException("交易所名称为空");
        }
        String canonical = ALIASES.get(exchangeName.trim().toLowerCase(Locale.ROOT));
        if (canonical == null) {
            throw new ConfigurationException("不支持的交易所: " + exchangeName);
        }
        return canonical;
    }

    /**
     * 默认交易所（exchange.name）
     */
    public ExchangeTrader getTrader() {
        return getTrader(config.getDefaultExchange());
    }

    public synchronized ExchangeTrader getTrader(String exchangeName) {
        String canonical = canonicalName(exchangeName);
        ExchangeTrader cached = traders.get(canonical);
        if (cached != null) {
            return cached;
        }
        ExchangeEntry entry = config.getExchangeEntry(canonical)
                .orElseThrow(() -> new ConfigurationException(
                        "交易所未配置或未启用: " + canonical + "（需要 exchange." + canonical + ".enabled=true）"));
        Function<ExchangeEntry, ExchangeTrader> factory = factories.get(canonical);
        if (factory == null) {
            throw new ConfigurationException("没有可用的交易所实现: " + canonical);
        }
        ExchangeTrader trader = factory.apply(entry);
        traders.put(canonical, trader);
        logger.info("交易所适配器已创建: {} ({})", canonical, entry);
        return trader;
    }

    @Override
    public synchronized void close() {
        for (Map.Entry<String, ExchangeTrader> entry : traders.entrySet()) {
            try {
                entry.getValue().close();
            } catch (Exception e) {
                logger.warn("关闭交易所适配器失败: {}", entry.getKey(), e);
            }
        }
        traders.clear();
    }
}
