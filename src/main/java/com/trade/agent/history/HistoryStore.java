package com.trade.agent.history;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 历史数据持久化接口
 * 每个方法是一个独立的工作单元：要么全部写入，要么不写入
 */
public interface HistoryStore {

    Optional<SystemConfigEntry> getConfig(String key);

    /**
     * 写入或更新配置项
     */
    SystemConfigEntry putConfig(String key, String value, String description);

    void appendSnapshot(BalanceSnapshot snapshot);

    /**
     * 指定时间（含）之后的快照，按时间升序
     */
    List<BalanceSnapshot> findSnapshotsSince(Instant since);

    Optional<BalanceSnapshot> findLatestSnapshot();

    /**
     * 按 orderId 插入或原地更新
     * @return 新插入的条数
     */
    int upsertOrders(List<OrderRecord> records);

    /**
     * 按 tradeId 插入，已存在的跳过
     * @return 新插入的条数
     */
    int insertTradesIfAbsent(List<TradeRecord> records);

    Optional<OrderRecord> findOrder(String orderId);

    /**
     * 订单按创建时间倒序
     * @param symbol 为 null 时不过滤
     */
    List<OrderRecord> findOrders(String symbol, int limit);

    /**
     * 指定时间（含）之后的成交，按时间升序
     */
    List<TradeRecord> findTradesSince(Instant since);

    int countOrders();

    int countTrades();

    int countSnapshots();

    /**
     * 清空快照、订单、成交（保留配置）
     */
    void clearHistory();
}
