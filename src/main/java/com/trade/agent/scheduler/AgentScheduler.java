package com.trade.agent.scheduler;

import com.trade.agent.core.TradingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 交易调度器
 *
 * 单个后台线程按固定间隔顺序执行周期任务，周期之间不重叠。
 * 只有周期之间的等待可以被 stop() 打断，正在执行的周期会跑完。
 */
public class AgentScheduler {

    private static final Logger logger = LoggerFactory.getLogger(AgentScheduler.class);

    private final AgentCycle cycle;
    private final Duration interval;
    private final Duration errorBackoff;
    private final List<String> symbols;
    private final Clock clock;

    private ExecutorService executor;
    private Future<?> loop;
    private CountDownLatch stopSignal;
    private volatile boolean running;

    private volatile Instant lastRunStart;
    private volatile Duration lastRunDuration;
    private volatile Instant nextRunTime;
    private volatile long completedCycles;
    private volatile long failedCycles;

    public AgentScheduler(AgentCycle cycle, TradingConfig config) {
        this(cycle, config.getDecisionInterval(), config.getErrorBackoff(), config.getSymbols(), Clock.systemUTC());
    }

    public AgentScheduler(AgentCycle cycle, Duration interval, Duration errorBackoff, List<String> symbols, Clock clock) {
        this.cycle = cycle;
        this.interval = interval;
        this.errorBackoff = errorBackoff;
        this.symbols = List.copyOf(symbols);
        this.clock = clock;
    }

    /**
     * 启动调度器
     */
    public synchronized void start() {
        if (running) {
            logger.warn("调度器已在运行");
            return;
        }
        running = true;
        stopSignal = new CountDownLatch(1);
        executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "agent-scheduler");
            t.setDaemon(true);
            return t;
        });
        CountDownLatch signal = stopSignal;
        loop = executor.submit(() -> runLoop(signal));
        logger.info("调度器已启动: 间隔 {}s, 标的 {}", interval.getSeconds(), symbols);
    }

    /**
     * 停止调度器，阻塞直到当前周期结束
     */
    public synchronized void stop() {
        if (!running) {
            logger.warn("调度器未运行");
            return;
        }
        stopSignal.countDown();
        try {
            loop.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("等待调度线程退出时被中断");
        } catch (ExecutionException e) {
            logger.error("调度线程异常退出", e.getCause());
        } finally {
            executor.shutdown();
            running = false;
            nextRunTime = null;
        }
        logger.info("调度器已停止");
    }

    public boolean isRunning() {
        return running;
    }

    public SchedulerStatus getStatus() {
        return new SchedulerStatus(running, interval, symbols, lastRunStart, lastRunDuration,
                running ? nextRunTime : null, completedCycles, failedCycles);
    }

    /**
     * 距离下一次运行还需等待的时间，最少为 0
     */
    static Duration computeWait(Duration interval, Duration elapsed) {
        Duration wait = interval.minus(elapsed);
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    private void runLoop(CountDownLatch signal) {
        while (signal.getCount() > 0) {
            Instant start = clock.instant();
            lastRunStart = start;
            Duration wait;
            try {
                logger.info("开始执行交易周期: {}", start);
                cycle.run();
                Duration elapsed = Duration.between(start, clock.instant());
                lastRunDuration = elapsed;
                completedCycles++;
                wait = computeWait(interval, elapsed);
                logger.info("交易周期完成，耗时 {}ms，{}s 后执行下一次", elapsed.toMillis(), wait.getSeconds());
            } catch (Exception e) {
                lastRunDuration = Duration.between(start, clock.instant());
                failedCycles++;
                wait = errorBackoff;
                logger.error("交易周期执行失败，{}s 后重试", errorBackoff.getSeconds(), e);
            }
            nextRunTime = clock.instant().plus(wait);
            if (awaitStop(signal, wait)) {
                break;
            }
        }
        logger.info("调度循环已退出");
    }

    /**
     * @return true 表示收到停止信号
     */
    private boolean awaitStop(CountDownLatch signal, Duration wait) {
        try {
            return signal.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }
}
