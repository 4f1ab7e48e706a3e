package com.trade.agent.scheduler;

import com.trade.agent.exchange.ExchangeException;
import com.trade.agent.exchange.ExchangeTrader;
import com.trade.agent.exchange.TraderRegistry;
import com.trade.agent.execution.DecisionBatch;
import com.trade.agent.execution.DecisionExecutor;
import com.trade.agent.execution.DecisionProvider;
import com.trade.agent.execution.DecisionRecorder;
import com.trade.agent.execution.ExecutionReport;
import com.trade.agent.history.TradingHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 一个交易周期：
 * 1. 记录余额快照
 * 2. 同步最近的订单与成交
 * 3. 获取决策并执行
 * 4. 记录执行结果
 */
public class TradingCycle implements AgentCycle {

    private static final Logger logger = LoggerFactory.getLogger(TradingCycle.class);

    private final TradingHistoryService historyService;
    private final DecisionProvider decisionProvider;
    private final DecisionExecutor decisionExecutor;
    private final DecisionRecorder decisionRecorder;
    private final TraderRegistry registry;
    private final List<String> symbols;

    public TradingCycle(TradingHistoryService historyService, DecisionProvider decisionProvider,
                        DecisionExecutor decisionExecutor, DecisionRecorder decisionRecorder,
                        TraderRegistry registry, List<String> symbols) {
        this.historyService = historyService;
        this.decisionProvider = decisionProvider;
        this.decisionExecutor = decisionExecutor;
        this.decisionRecorder = decisionRecorder;
        this.registry = registry;
        this.symbols = List.copyOf(symbols);
    }

    @Override
    public void run() {
        recordSnapshot();
        syncRecentHistory();

        DecisionBatch batch = decisionProvider.nextBatch(symbols);
        if (batch.isEmpty()) {
            logger.info("本周期没有新的交易决策");
            return;
        }

        ExchangeTrader trader = registry.getTrader();
        ExecutionReport report = decisionExecutor.execute(batch, trader);
        decisionRecorder.record(batch);
        logger.info("批次 {} 执行完成: {}", batch.getBatchId(), report);
    }

    private void recordSnapshot() {
        try {
            historyService.recordBalanceSnapshot();
        } catch (ExchangeException e) {
            logger.error("记录余额快照失败: [{}] {}", e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("记录余额快照失败", e);
        }
    }

    private void syncRecentHistory() {
        try {
            historyService.syncHistoricalOrders(false);
            historyService.syncHistoricalTrades(false);
        } catch (RuntimeException e) {
            logger.error("同步最近交易历史失败", e);
        }
    }
}
