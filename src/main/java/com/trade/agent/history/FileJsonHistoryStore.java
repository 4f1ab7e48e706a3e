package com.trade.agent.history;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.trade.agent.core.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 文件持久化实现
 * 每张表一个 JSON 文件，常驻内存，每次修改先写临时文件再原子替换
 */
public class FileJsonHistoryStore implements HistoryStore {

    private static final Logger logger = LoggerFactory.getLogger(FileJsonHistoryStore.class);

    static final String CONFIG_FILE = "system_config.json";
    static final String SNAPSHOT_FILE = "balance_snapshots.json";
    static final String ORDER_FILE = "order_records.json";
    static final String TRADE_FILE = "trade_records.json";

    private final Path dataDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private Map<String, SystemConfigEntry> configs;
    private List<BalanceSnapshot> snapshots;
    private Map<String, OrderRecord> orders;
    private Map<String, TradeRecord> trades;

    public FileJsonHistoryStore(Path dataDir) {
        this(dataDir, Clock.systemUTC());
    }

    public FileJsonHistoryStore(Path dataDir, Clock clock) {
        this.dataDir = dataDir;
        this.clock = clock;
        this.objectMapper = JsonSupport.newObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        // 确保目录存在
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new HistoryStoreException("无法创建数据目录: " + dataDir, e);
        }
        this.configs = loadConfigs();
        this.snapshots = loadSnapshots();
        this.orders = loadOrders();
        this.trades = loadTrades();
        logger.info("历史数据已加载: {} 快照, {} 订单, {} 成交（{}）",
                snapshots.size(), orders.size(), trades.size(), dataDir);
    }

    // ==================== 配置 ====================

    @Override
    public synchronized Optional<SystemConfigEntry> getConfig(String key) {
        return Optional.ofNullable(configs.get(key));
    }

    @Override
    public synchronized SystemConfigEntry putConfig(String key, String value, String description) {
        Instant now = clock.instant();
        SystemConfigEntry existing = configs.get(key);
        SystemConfigEntry entry = existing != null
                ? existing.withValue(value, now)
                : new SystemConfigEntry(key, value, description, now, now);
        Map<String, SystemConfigEntry> next = new LinkedHashMap<>(configs);
        next.put(key, entry);
        writeAtomically(CONFIG_FILE, next);
        configs = next;
        return entry;
    }

    // ==================== 余额快照 ====================

    @Override
    public synchronized void appendSnapshot(BalanceSnapshot snapshot) {
        List<BalanceSnapshot> next = new ArrayList<>(snapshots);
        next.add(snapshot);
        next.sort(Comparator.comparing(BalanceSnapshot::getTimestamp));
        writeAtomically(SNAPSHOT_FILE, next);
        snapshots = next;
    }

    @Override
    public synchronized List<BalanceSnapshot> findSnapshotsSince(Instant since) {
        return snapshots.stream()
                .filter(s -> !s.getTimestamp().isBefore(since))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<BalanceSnapshot> findLatestSnapshot() {
        return snapshots.isEmpty() ? Optional.empty() : Optional.of(snapshots.get(snapshots.size() - 1));
    }

    // ==================== 订单 ====================

    @Override
    public synchronized int upsertOrders(List<OrderRecord> records) {
        if (records.isEmpty()) {
            return 0;
        }
        int inserted = 0;
        try {
            for (OrderRecord record : records) {
                OrderRecord existing = orders.get(record.getOrderId());
                if (existing != null) {
                    existing.mergeFrom(record);
                } else {
                    orders.put(record.getOrderId(), record.copy());
                    inserted++;
                }
            }
            writeAtomically(ORDER_FILE, orders);
        } catch (HistoryStoreException e) {
            // 写入失败时回到磁盘上的状态
            orders = loadOrders();
            throw e;
        }
        return inserted;
    }

    @Override
    public synchronized Optional<OrderRecord> findOrder(String orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(OrderRecord::copy);
    }

    @Override
    public synchronized List<OrderRecord> findOrders(String symbol, int limit) {
        return orders.values().stream()
                .filter(o -> symbol == null || symbol.equals(o.getSymbol()))
                .sorted(Comparator.comparing(OrderRecord::getCreatedTime).reversed())
                .limit(Math.max(0, limit))
                .map(OrderRecord::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int countOrders() {
        return orders.size();
    }

    // ==================== 成交 ====================

    @Override
    public synchronized int insertTradesIfAbsent(List<TradeRecord> records) {
        Map<String, TradeRecord> next = new LinkedHashMap<>(trades);
        int inserted = 0;
        for (TradeRecord record : records) {
            if (next.putIfAbsent(record.getTradeId(), record) == null) {
                inserted++;
            }
        }
        if (inserted > 0) {
            writeAtomically(TRADE_FILE, next);
            trades = next;
        }
        return inserted;
    }

    @Override
    public synchronized List<TradeRecord> findTradesSince(Instant since) {
        return trades.values().stream()
                .filter(t -> !t.getTradeTime().isBefore(since))
                .sorted(Comparator.comparing(TradeRecord::getTradeTime))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int countTrades() {
        return trades.size();
    }

    @Override
    public synchronized int countSnapshots() {
        return snapshots.size();
    }

    @Override
    public synchronized void clearHistory() {
        writeAtomically(SNAPSHOT_FILE, List.of());
        writeAtomically(ORDER_FILE, Map.of());
        writeAtomically(TRADE_FILE, Map.of());
        snapshots = new ArrayList<>();
        orders = new LinkedHashMap<>();
        trades = new LinkedHashMap<>();
        logger.info("历史数据已清空: {}", dataDir);
    }

    // ==================== 文件读写 ====================

    private Map<String, SystemConfigEntry> loadConfigs() {
        return read(CONFIG_FILE, new TypeReference<LinkedHashMap<String, SystemConfigEntry>>() {}, new LinkedHashMap<>());
    }

    private List<BalanceSnapshot> loadSnapshots() {
        return read(SNAPSHOT_FILE, new TypeReference<ArrayList<BalanceSnapshot>>() {}, new ArrayList<>());
    }

    private Map<String, OrderRecord> loadOrders() {
        return read(ORDER_FILE, new TypeReference<LinkedHashMap<String, OrderRecord>>() {}, new LinkedHashMap<>());
    }

    private Map<String, TradeRecord> loadTrades() {
        return read(TRADE_FILE, new TypeReference<LinkedHashMap<String, TradeRecord>>() {}, new LinkedHashMap<>());
    }

    private <T> T read(String fileName, TypeReference<T> type, T empty) {
        Path path = dataDir.resolve(fileName);
        if (!Files.exists(path)) {
            return empty;
        }
        try {
            T value = objectMapper.readValue(path.toFile(), type);
            return value == null ? empty : value;
        } catch (IOException e) {
            throw new HistoryStoreException("读取历史数据失败: " + path, e);
        }
    }

    private void writeAtomically(String fileName, Object value) {
        Path target = dataDir.resolve(fileName);
        Path temp = dataDir.resolve(fileName + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new HistoryStoreException("写入历史数据失败: " + target, e);
        }
    }
}
