package com.trade.agent;

import com.trade.agent.core.TradingConfig;
import com.trade.agent.exchange.ExchangeException;
import com.trade.agent.exchange.ExchangeTrader;
import com.trade.agent.exchange.TraderRegistry;
import com.trade.agent.execution.DecisionExecutor;
import com.trade.agent.execution.FileDecisionProvider;
import com.trade.agent.execution.JsonLinesDecisionRecorder;
import com.trade.agent.history.FileJsonHistoryStore;
import com.trade.agent.history.HistoryStore;
import com.trade.agent.history.ResetSummary;
import com.trade.agent.history.TradingHistoryService;
import com.trade.agent.scheduler.AgentScheduler;
import com.trade.agent.scheduler.TradingCycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;

/**
 * 合约交易代理主类
 */
public class TradingAgentMain {

    private static final Logger logger = LoggerFactory.getLogger(TradingAgentMain.class);

    public static void main(String[] args) {
        System.out.println("""
            ================================================
               合约交易代理 v1.0
               决策执行 · 历史对账 · 稳定运行
            ================================================
            """);

        String mode = args.length > 0 ? args[0] : "run";
        Path configPath = args.length > 1 ? Path.of(args[1]) : Path.of(TradingConfig.DEFAULT_CONFIG_FILE);

        switch (mode) {
            case "run" -> runAgent(configPath);
            case "reset" -> runReset(configPath, args.length > 2 ? Instant.parse(args[2]) : null);
            case "stats" -> printStatistics(configPath);
            default -> printUsage();
        }
    }

    /**
     * 运行调度器，直到进程退出
     */
    private static void runAgent(Path configPath) {
        TradingConfig config = TradingConfig.load(configPath);
        TraderRegistry registry = new TraderRegistry(config);
        ExchangeTrader trader = registry.getTrader();
        logger.info("使用交易所: {}, 标的: {}", trader.getExchangeName(), config.getSymbols());

        TradingHistoryService historyService = newHistoryService(config, trader);
        try {
            historyService.initializeIfNeeded();
        } catch (ExchangeException e) {
            logger.error("历史数据初始化失败，继续启动调度器: [{}] {}", e.getErrorCode(), e.getMessage());
        }

        TradingCycle cycle = new TradingCycle(
                historyService,
                new FileDecisionProvider(config.getDecisionInboxFile()),
                new DecisionExecutor(config),
                new JsonLinesDecisionRecorder(config.getDecisionJournalFile()),
                registry,
                config.getSymbols()
        );
        AgentScheduler scheduler = new AgentScheduler(cycle, config);

        CountDownLatch exit = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("收到退出信号，正在停止...");
            scheduler.stop();
            registry.close();
            exit.countDown();
        }, "agent-shutdown"));

        scheduler.start();
        System.out.println("交易代理已启动，按 Ctrl+C 退出...");
        try {
            exit.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * 清空历史数据并重新初始化
     */
    private static void runReset(Path configPath, Instant initTime) {
        TradingConfig config = TradingConfig.load(configPath);
        try (TraderRegistry registry = new TraderRegistry(config)) {
            TradingHistoryService historyService = newHistoryService(config, registry.getTrader());
            ResetSummary summary = historyService.resetSystem(initTime);
            System.out.println(summary.getMessage() + ": " + summary);
        } catch (ExchangeException e) {
            logger.error("系统重置失败: [{}] {}", e.getErrorCode(), e.getMessage(), e);
            System.exit(1);
        }
    }

    private static void printStatistics(Path configPath) {
        TradingConfig config = TradingConfig.load(configPath);
        try (TraderRegistry registry = new TraderRegistry(config)) {
            TradingHistoryService historyService = newHistoryService(config, registry.getTrader());
            System.out.println(historyService.getTradeStatistics(30));
        }
    }

    private static TradingHistoryService newHistoryService(TradingConfig config, ExchangeTrader trader) {
        HistoryStore store = new FileJsonHistoryStore(config.getHistoryDataDir());
        return new TradingHistoryService(store, trader, config);
    }

    /**
     * 打印使用说明
     */
    private static void printUsage() {
        System.out.println("使用方法:");
        System.out.println("  java -jar futures-agent.jar run   [config.properties]              启动交易代理");
        System.out.println("  java -jar futures-agent.jar reset [config.properties] [ISO时间]    重置历史数据");
        System.out.println("  java -jar futures-agent.jar stats [config.properties]              打印最近30天统计");
    }
}
