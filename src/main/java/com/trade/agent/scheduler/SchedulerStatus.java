package com.trade.agent.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 调度器状态快照
 */
public final class SchedulerStatus {

    private final boolean running;
    private final Duration interval;
    private final List<String> symbols;
    private final Instant lastRunStart;
    private final Duration lastRunDuration;
    private final Instant nextRunTime;
    private final long completedCycles;
    private final long failedCycles;

    public SchedulerStatus(boolean running, Duration interval, List<String> symbols, Instant lastRunStart,
                           Duration lastRunDuration, Instant nextRunTime, long completedCycles, long failedCycles) {
        this.running = running;
        this.interval = interval;
        this.symbols = List.copyOf(symbols);
        this.lastRunStart = lastRunStart;
        this.lastRunDuration = lastRunDuration;
        this.nextRunTime = nextRunTime;
        this.completedCycles = completedCycles;
        this.failedCycles = failedCycles;
    }

    public boolean isRunning() { return running; }
    public Duration getInterval() { return interval; }
    public List<String> getSymbols() { return symbols; }
    /** 尚未运行过时为 null */
    public Instant getLastRunStart() { return lastRunStart; }
    public Duration getLastRunDuration() { return lastRunDuration; }
    /** 未运行时为 null */
    public Instant getNextRunTime() { return nextRunTime; }
    public long getCompletedCycles() { return completedCycles; }
    public long getFailedCycles() { return failedCycles; }

    @Override
    public String toString() {
        return String.format("SchedulerStatus{running=%s, interval=%ss, symbols=%s, lastRun=%s, next=%s, ok=%d, failed=%d}",
                running, interval.getSeconds(), symbols, lastRunStart, nextRunTime, completedCycles, failedCycles);
    }
}
