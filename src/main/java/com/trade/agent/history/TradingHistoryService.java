package com.trade.agent.history;

import com.trade.agent.core.Balance;
import com.trade.agent.core.Decimal;
import com.trade.agent.core.ExchangeOrder;
import com.trade.agent.core.ExchangeTrade;
import com.trade.agent.core.TradingConfig;
import com.trade.agent.exchange.ExchangeException;
import com.trade.agent.exchange.ExchangeTrader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 交易历史数据管理服务
 *
 * 以 system_init_time 为数据起点，把交易所的订单、成交同步到本地存储，
 * 记录余额快照并提供统计查询。同一笔订单/成交重复同步不会产生重复记录。
 */
public class TradingHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(TradingHistoryService.class);

    public static final String INIT_TIME_KEY = "system_init_time";
    static final String INIT_TIME_DESCRIPTION = "系统初始化时间，只记录此时间后的数据";

    private final HistoryStore store;
    private final ExchangeTrader trader;
    private final List<String> symbols;
    private final int recentSyncHours;
    private final Duration fullSyncDelay;
    private final Duration recentSyncDelay;
    private final Clock clock;

    public TradingHistoryService(HistoryStore store, ExchangeTrader trader, TradingConfig config) {
        this(store, trader, config, Clock.systemUTC());
    }

    public TradingHistoryService(HistoryStore store, ExchangeTrader trader, TradingConfig config, Clock clock) {
        this.store = store;
        this.trader = trader;
        this.symbols = List.copyOf(config.getSymbols());
        this.recentSyncHours = config.getRecentSyncHours();
        this.fullSyncDelay = config.getFullSyncDelay();
        this.recentSyncDelay = config.getRecentSyncDelay();
        this.clock = clock;
    }

    // ==================== 初始化 ====================

    /**
     * 检查并初始化系统（服务启动时调用）
     * @return 本次是否执行了初始化
     */
    public boolean initializeIfNeeded() throws ExchangeException {
        Optional<Instant> initTime = getInitTimestamp();
        if (initTime.isPresent()) {
            logger.info("系统已初始化，初始化时间: {}", initTime.get());
            return false;
        }
        logger.info("系统首次启动，开始自动初始化历史数据系统...");
        autoInitialize();
        return true;
    }

    /**
     * 首次启动：以当前时间为起点，全量同步并记录初始余额
     */
    public void autoInitialize() throws ExchangeException {
        setInitTimestamp(null);

        logger.info("开始全量同步历史数据...");
        int orderCount = syncHistoricalOrders(true);
        int tradeCount = syncHistoricalTrades(true);

        recordBalanceSnapshot();
        logger.info("系统自动初始化完成: 同步{}个订单, {}个交易", orderCount, tradeCount);
    }

    /**
     * 清空全部历史数据并以新的起点重新初始化
     * @param newInitTime 为 null 时使用当前时间
     */
    public ResetSummary resetSystem(Instant newInitTime) throws ExchangeException {
        logger.info("开始重置系统...");
        store.clearHistory();
        logger.info("历史数据清空完成");

        Instant initTime = setInitTimestamp(newInitTime);
        int orderCount = syncHistoricalOrders(true);
        int tradeCount = syncHistoricalTrades(true);
        recordBalanceSnapshot();

        logger.info("系统重置完成: 初始化时间={}, 同步{}个订单, {}个交易", initTime, orderCount, tradeCount);
        return new ResetSummary(true, "系统重置完成", initTime, orderCount, tradeCount);
    }

    public Optional<Instant> getInitTimestamp() {
        Optional<SystemConfigEntry> entry = store.getConfig(INIT_TIME_KEY);
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(entry.get().getValue()));
        } catch (DateTimeParseException e) {
            logger.error("初始化时间格式错误: {}", entry.get().getValue(), e);
            return Optional.empty();
        }
    }

    /**
     * 设置系统初始化时间
     * @param initTime 为 null 时使用当前时间
     */
    public Instant setInitTimestamp(Instant initTime) {
        Instant value = initTime != null ? initTime : clock.instant();
        store.putConfig(INIT_TIME_KEY, value.toString(), INIT_TIME_DESCRIPTION);
        logger.info("设置系统初始化时间: {}", value);
        return value;
    }

    // ==================== 余额快照 ====================

    public BalanceSnapshot recordBalanceSnapshot() throws ExchangeException {
        Balance balance = trader.getBalance();
        BalanceSnapshot snapshot = BalanceSnapshot.of(balance, clock.instant());
        store.appendSnapshot(snapshot);
        logger.info("记录余额快照: 总计={}, 未实现盈亏={}",
                balance.getTotalBalance(), balance.getUnrealizedPnl());
        return snapshot;
    }

    // ==================== 同步 ====================

    /**
     * 同步订单
     * @param fullSync true 从初始化时间开始全量同步；false 只同步最近的数据
     */
    public int syncHistoricalOrders(boolean fullSync) {
        Optional<Instant> initTime = getInitTimestamp();
        if (initTime.isEmpty()) {
            logger.warn("系统未设置初始化时间，无法同步历史订单");
            return 0;
        }
        if (!fullSync) {
            return syncRecentOrders(recentSyncHours);
        }
        int total = syncOrders(initTime.get(), initTime.get(), fullSyncDelay, true);
        logger.info("总共同步订单: {} 条", total);
        return total;
    }

    public int syncHistoricalTrades(boolean fullSync) {
        Optional<Instant> initTime = getInitTimestamp();
        if (initTime.isEmpty()) {
            logger.warn("系统未设置初始化时间，无法同步历史交易");
            return 0;
        }
        if (!fullSync) {
            return syncRecentTrades(recentSyncHours);
        }
        int total = syncTrades(initTime.get(), initTime.get(), fullSyncDelay, true);
        logger.info("总共同步交易: {} 条", total);
        return total;
    }

    public int syncRecentOrders(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        Instant horizon = getInitTimestamp().orElse(since);
        int total = syncOrders(since, horizon, recentSyncDelay, false);
        if (total > 0) {
            logger.info("同步最近 {}h 订单: {} 条", hours, total);
        }
        return total;
    }

    public int syncRecentTrades(int hours) {
        Instant since = clock.instant().minus(Duration.ofHours(hours));
        Instant horizon = getInitTimestamp().orElse(since);
        int total = syncTrades(since, horizon, recentSyncDelay, false);
        if (total > 0) {
            logger.info("同步最近 {}h 交易: {} 条", hours, total);
        }
        return total;
    }

    private int syncOrders(Instant since, Instant horizon, Duration pause, boolean verbose) {
        Instant fetchFrom = since.isAfter(horizon) ? since : horizon;
        int total = 0;
        for (String symbol : symbols) {
            try {
                List<ExchangeOrder> orders = trader.fetchOrders(symbol, fetchFrom);
                Instant now = clock.instant();
                List<OrderRecord> records = new ArrayList<>();
                for (ExchangeOrder order : orders) {
                    if (order.getCreatedTime().isBefore(horizon)) {
                        continue;
                    }
                    records.add(OrderRecord.from(order, now));
                }
                store.upsertOrders(records);
                total += records.size();
                if (verbose) {
                    logger.info("同步 {} 订单: {} 条", symbol, records.size());
                } else {
                    logger.debug("同步 {} 订单: {} 条", symbol, records.size());
                }
            } catch (ExchangeException e) {
                logger.error("同步 {} 订单失败: [{}] {}", symbol, e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("同步 {} 订单失败", symbol, e);
            }
            if (!pause(pause)) {
                logger.warn("订单同步被中断，已同步 {} 条", total);
                break;
            }
        }
        return total;
    }

    private int syncTrades(Instant since, Instant horizon, Duration pause, boolean verbose) {
        Instant fetchFrom = since.isAfter(horizon) ? since : horizon;
        int total = 0;
        for (String symbol : symbols) {
            try {
                List<ExchangeTrade> trades = trader.fetchTrades(symbol, fetchFrom);
                Instant now = clock.instant();
                List<TradeRecord> records = new ArrayList<>();
                for (ExchangeTrade trade : trades) {
                    if (trade.getTradeTime().isBefore(horizon)) {
                        continue;
                    }
                    records.add(TradeRecord.from(trade, now));
                }
                int inserted = store.insertTradesIfAbsent(records);
                total += records.size();
                if (verbose) {
                    logger.info("同步 {} 交易: {} 条（新增 {}）", symbol, records.size(), inserted);
                } else {
                    logger.debug("同步 {} 交易: {} 条（新增 {}）", symbol, records.size(), inserted);
                }
            } catch (ExchangeException e) {
                logger.error("同步 {} 交易失败: [{}] {}", symbol, e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                logger.error("同步 {} 交易失败", symbol, e);
            }
            if (!pause(pause)) {
                logger.warn("交易同步被中断，已同步 {} 条", total);
                break;
            }
        }
        return total;
    }

    /**
     * 避免API限制
     * @return false 表示线程被中断
     */
    private boolean pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== 查询 ====================

    /**
     * 最近 N 天的余额快照，按时间升序
     */
    public List<BalanceSnapshot> getBalanceHistory(int days) {
        return store.findSnapshotsSince(clock.instant().minus(Duration.ofDays(days)));
    }

    /**
     * 订单历史，按创建时间倒序
     * @param symbol 为 null 时返回全部标的
     */
    public List<OrderRecord> getOrderHistory(String symbol, int limit) {
        return store.findOrders(symbol, limit);
    }

    public HistoryStatistics getTradeStatistics(int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));

        List<TradeRecord> trades = store.findTradesSince(cutoff);
        int totalTrades = trades.size();
        BigDecimal totalVolume = BigDecimal.ZERO;
        for (TradeRecord trade : trades) {
            if (trade.getCost() != null) {
                totalVolume = totalVolume.add(trade.getCost());
            }
        }

        Optional<Instant> initTime = getInitTimestamp();
        List<BalanceSnapshot> sinceInit = initTime
                .map(store::findSnapshotsSince)
                .orElse(List.of());
        Optional<BalanceSnapshot> latest = store.findLatestSnapshot();

        BigDecimal totalPnl = BigDecimal.ZERO;
        BigDecimal pnlPercentage = BigDecimal.ZERO;
        if (latest.isPresent() && !sinceInit.isEmpty()) {
            BigDecimal initial = sinceInit.get(0).getTotalBalance();
            totalPnl = latest.get().getTotalBalance().subtract(initial);
            if (Decimal.isPositive(initial)) {
                pnlPercentage = Decimal.percentOf(totalPnl, initial);
            }
        }

        BigDecimal avgTradeSize = totalTrades > 0
                ? Decimal.divide(totalVolume, BigDecimal.valueOf(totalTrades))
                : BigDecimal.ZERO;

        return new HistoryStatistics(days, cutoff, totalTrades, totalVolume, totalPnl, pnlPercentage,
                avgTradeSize, maxDrawdown(sinceInit), countActivePositions());
    }

    /**
     * 按快照总权益计算最大回撤（负值百分比）
     */
    static BigDecimal maxDrawdown(List<BalanceSnapshot> snapshots) {
        BigDecimal peak = null;
        BigDecimal worst = BigDecimal.ZERO;
        for (BalanceSnapshot snapshot : snapshots) {
            BigDecimal equity = snapshot.getTotalBalance();
            if (equity == null) {
                continue;
            }
            if (peak == null || equity.compareTo(peak) > 0) {
                peak = equity;
                continue;
            }
            BigDecimal drawdown = Decimal.percentOf(equity.subtract(peak), peak);
            if (drawdown.compareTo(worst) < 0) {
                worst = drawdown;
            }
        }
        return worst;
    }

    private int countActivePositions() {
        try {
            return trader.getPositions().size();
        } catch (ExchangeException | RuntimeException e) {
            logger.warn("获取持仓失败，活跃持仓按 0 计算: {}", e.getMessage());
            return 0;
        }
    }
}
