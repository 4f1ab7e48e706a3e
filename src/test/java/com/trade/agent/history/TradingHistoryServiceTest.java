package com.trade.agent.history;

import com.trade.agent.core.Balance;
import com.trade.agent.core.ExchangeTrade;
import com.trade.agent.core.OrderStatus;
import com.trade.agent.core.PositionSide;
import com.trade.agent.core.Side;
import com.trade.agent.core.TradingConfig;
import com.trade.agent.exchange.ExchangeException;
import com.trade.agent.exchange.FakeExchangeTrader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import static com.trade.agent.history.FileJsonHistoryStoreTest.order;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TradingHistoryServiceTest {

    private static final Instant START = Instant.parse("2024-06-01T00:00:00Z");

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private FakeExchangeTrader trader;
    private FileJsonHistoryStore store;
    private TradingHistoryService service;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.setProperty("agent.symbols", "BTCUSDT,ETHUSDT");
        props.setProperty("exchange.name", "binance_futures");
        props.setProperty("history.sync.full.delay.ms", "0");
        props.setProperty("history.sync.recent.delay.ms", "0");
        TradingConfig config = TradingConfig.fromProperties(props);

        clock = new MutableClock(START);
        trader = new FakeExchangeTrader();
        trader.balance = balanceAt(START, "1000");
        store = new FileJsonHistoryStore(tempDir, clock);
        service = new TradingHistoryService(store, trader, config, clock);
    }

    @Test
    void firstStartupSetsHorizonSyncsAndSnapshots() throws ExchangeException {
        trader.orders.put("BTCUSDT", List.of(order("1", "BTCUSDT", START.plusSeconds(1), OrderStatus.FILLED, "1")));

        assertTrue(service.initializeIfNeeded());

        assertEquals(START, service.getInitTimestamp().orElseThrow());
        assertEquals(TradingHistoryService.INIT_TIME_KEY, store.getConfig("system_init_time").orElseThrow().getKey());
        assertEquals("系统初始化时间，只记录此时间后的数据",
                store.getConfig("system_init_time").orElseThrow().getDescription());
        assertEquals(1, store.countSnapshots());
        assertTrue(trader.calls.contains("fetchOrders BTCUSDT"));
        assertTrue(trader.calls.contains("fetchTrades ETHUSDT"));

        clock.advance(Duration.ofMinutes(5));
        assertFalse(service.initializeIfNeeded(), "已有初始化时间时不应重复初始化");
        assertEquals(START, service.getInitTimestamp().orElseThrow());
    }

    @Test
    void syncWithoutHorizonDoesNothing() {
        assertEquals(0, service.syncHistoricalOrders(true));
        assertEquals(0, service.syncHistoricalTrades(false));
        assertTrue(trader.calls.isEmpty());
    }

    @Test
    void repeatedFullSyncKeepsOneRecordPerIdWithLatestState() {
        service.setInitTimestamp(START);
        Instant created = START.plusSeconds(60);
        trader.orders.put("BTCUSDT", List.of(order("1", "BTCUSDT", created, OrderStatus.PARTIALLY_FILLED, "0.5")));
        trader.trades.put("BTCUSDT", List.of(trade("t-1", created)));

        service.syncHistoricalOrders(true);
        service.syncHistoricalTrades(true);

        trader.orders.put("BTCUSDT", List.of(order("1", "BTCUSDT", created, OrderStatus.FILLED, "1")));
        trader.trades.put("BTCUSDT", List.of(trade("t-1", created), trade("t-2", created.plusSeconds(5))));
        service.syncHistoricalOrders(true);
        service.syncHistoricalTrades(true);

        assertEquals(1, store.countOrders());
        assertEquals(2, store.countTrades());
        OrderRecord stored = store.findOrder("1").orElseThrow();
        assertEquals(OrderStatus.FILLED, stored.getStatus());
        assertEquals(0, BigDecimal.ONE.compareTo(stored.getFilled()));
    }

    @Test
    void failingSymbolDoesNotStopOthers() {
        service.setInitTimestamp(START);
        trader.failingSymbols.add("BTCUSDT");
        trader.orders.put("ETHUSDT", List.of(order("2", "ETHUSDT", START.plusSeconds(5), OrderStatus.FILLED, "1")));

        assertEquals(1, service.syncHistoricalOrders(true));
        assertTrue(store.findOrder("2").isPresent());
    }

    @Test
    void recentSyncNeverReachesBeforeHorizon() {
        Instant horizon = START.plus(Duration.ofHours(10));
        service.setInitTimestamp(horizon);
        clock.advance(Duration.ofHours(30));
        trader.orders.put("BTCUSDT", List.of(
                order("old", "BTCUSDT", START.plus(Duration.ofHours(9)), OrderStatus.FILLED, "1"),
                order("new", "BTCUSDT", START.plus(Duration.ofHours(12)), OrderStatus.FILLED, "1")));

        assertEquals(1, service.syncHistoricalOrders(false));
        assertTrue(store.findOrder("new").isPresent());
        assertFalse(store.findOrder("old").isPresent());
    }

    @Test
    void resetWipesHistoryAndMovesHorizon() throws ExchangeException {
        service.setInitTimestamp(START);
        trader.orders.put("BTCUSDT", List.of(
                order("early", "BTCUSDT", START.plusSeconds(10), OrderStatus.FILLED, "1"),
                order("late", "BTCUSDT", START.plus(Duration.ofHours(2)), OrderStatus.FILLED, "1")));
        trader.trades.put("BTCUSDT", List.of(trade("t-early", START.plusSeconds(10))));
        service.syncHistoricalOrders(true);
        service.syncHistoricalTrades(true);
        service.recordBalanceSnapshot();
        assertEquals(2, store.countOrders());

        clock.advance(Duration.ofHours(3));
        Instant resetTime = START.plus(Duration.ofHours(1));
        ResetSummary summary = service.resetSystem(resetTime);

        assertTrue(summary.isSuccess());
        assertEquals("系统重置完成", summary.getMessage());
        assertEquals(resetTime, summary.getInitTime());
        assertEquals(1, summary.getSyncedOrders());
        assertEquals(0, summary.getSyncedTrades());
        assertEquals(resetTime, service.getInitTimestamp().orElseThrow());
        assertFalse(store.findOrder("early").isPresent());
        assertTrue(store.findOrder("late").isPresent());
        assertEquals(0, store.countTrades());
        assertEquals(1, store.countSnapshots(), "重置后只保留新的余额快照");
    }

    @Test
    void snapshotFailurePropagates() {
        trader.failAccount = true;
        assertThrows(ExchangeException.class, () -> service.recordBalanceSnapshot());
        assertEquals(0, store.countSnapshots());
    }

    @Test
    void statisticsUseSnapshotsSinceHorizon() throws ExchangeException {
        service.setInitTimestamp(START);
        List<Instant> times = new ArrayList<>();
        String[] totals = {"1000", "1200", "900", "1100"};
        for (int i = 0; i < totals.length; i++) {
            Instant t = START.plus(Duration.ofHours(i + 1));
            times.add(t);
            trader.balance = balanceAt(t, totals[i]);
            service.recordBalanceSnapshot();
        }
        store.insertTradesIfAbsent(List.of(
                FileJsonHistoryStoreTest.trade("a", "50000", START.plusSeconds(10)),
                FileJsonHistoryStoreTest.trade("b", "30000", START.plusSeconds(20))));
        trader.positions.add(FakeExchangeTrader.position("BTCUSDT", PositionSide.LONG, "0.1", "50000"));
        clock.advance(Duration.ofDays(1));

        HistoryStatistics stats = service.getTradeStatistics(30);

        assertEquals(2, stats.getTotalTrades());
        assertEquals(0, new BigDecimal("8000").compareTo(stats.getTotalVolume()));
        assertEquals(0, new BigDecimal("4000").compareTo(stats.getAvgTradeSize()));
        assertEquals(0, new BigDecimal("100").compareTo(stats.getTotalPnl()));
        assertEquals(0, new BigDecimal("10").compareTo(stats.getPnlPercentage()));
        assertEquals(0, new BigDecimal("-25").compareTo(stats.getMaxDrawdownPercentage()));
        assertEquals(1, stats.getActivePositions());
        assertEquals(4, service.getBalanceHistory(30).size());
        assertEquals(times.get(0), service.getBalanceHistory(30).get(0).getTimestamp());
    }

    @Test
    void statisticsWithoutDataAreZero() {
        trader.failAccount = true;

        HistoryStatistics stats = service.getTradeStatistics(7);

        assertEquals(0, stats.getTotalTrades());
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getTotalPnl()));
        assertEquals(0, BigDecimal.ZERO.compareTo(stats.getAvgTradeSize()));
        assertEquals(0, stats.getActivePositions(), "获取持仓失败时按 0 计算");
    }

    @Test
    void orderHistoryIsNewestFirst() {
        service.setInitTimestamp(START);
        trader.orders.put("BTCUSDT", List.of(
                order("1", "BTCUSDT", START.plusSeconds(10), OrderStatus.FILLED, "1"),
                order("2", "BTCUSDT", START.plusSeconds(20), OrderStatus.FILLED, "1")));
        service.syncHistoricalOrders(true);

        List<OrderRecord> history = service.getOrderHistory("BTCUSDT", 100);

        assertEquals("2", history.get(0).getOrderId());
        assertEquals(2, history.size());
        assertTrue(service.getOrderHistory("ETHUSDT", 100).isEmpty());
    }

    private static Balance balanceAt(Instant time, String total) {
        return new Balance(new BigDecimal(total), new BigDecimal(total), new BigDecimal(total),
                BigDecimal.ZERO, "USDT", time);
    }

    private static ExchangeTrade trade(String id, Instant time) {
        return new ExchangeTrade(id, "1", "BTCUSDT", Side.BUY, new BigDecimal("0.1"), new BigDecimal("50000"),
                new BigDecimal("5000"), new BigDecimal("2"), "USDT", time, null);
    }
}
