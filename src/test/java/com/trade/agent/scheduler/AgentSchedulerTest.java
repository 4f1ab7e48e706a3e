package com.trade.agent.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentSchedulerTest {

    private AgentScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null && scheduler.isRunning()) {
            scheduler.stop();
        }
    }

    @Test
    void overrunningCycleStartsNextImmediately() {
        assertEquals(Duration.ZERO, AgentScheduler.computeWait(Duration.ofSeconds(60), Duration.ofSeconds(65)));
        assertEquals(Duration.ofSeconds(40), AgentScheduler.computeWait(Duration.ofSeconds(60), Duration.ofSeconds(20)));
    }

    @Test
    void stopInterruptsTheWaitBetweenCycles() throws InterruptedException {
        CountDownLatch firstRun = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        scheduler = newScheduler(() -> {
            runs.incrementAndGet();
            firstRun.countDown();
        }, Duration.ofHours(1), Duration.ofHours(1));

        scheduler.start();
        assertTrue(firstRun.await(5, TimeUnit.SECONDS), "启动后应立即执行第一个周期");

        long begin = System.nanoTime();
        scheduler.stop();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - begin);

        assertTrue(elapsedMs < 5000, "stop 不应等待完整的周期间隔");
        assertFalse(scheduler.isRunning());
        assertEquals(1, runs.get());
        assertEquals(1, scheduler.getStatus().getCompletedCycles());
        assertNull(scheduler.getStatus().getNextRunTime());
    }

    @Test
    void failedCycleBacksOffAndContinues() throws InterruptedException {
        CountDownLatch attempts = new CountDownLatch(3);
        scheduler = newScheduler(() -> {
            attempts.countDown();
            throw new IllegalStateException("decision source unavailable");
        }, Duration.ofHours(1), Duration.ofMillis(20));

        scheduler.start();

        assertTrue(attempts.await(5, TimeUnit.SECONDS), "失败后应在退避时间后重试");
        scheduler.stop();
        assertTrue(scheduler.getStatus().getFailedCycles() >= 3);
        assertEquals(0, scheduler.getStatus().getCompletedCycles());
    }

    @Test
    void inFlightCycleCompletesBeforeStopReturns() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        AtomicInteger finished = new AtomicInteger();
        scheduler = newScheduler(() -> {
            entered.countDown();
            Thread.sleep(200);
            finished.incrementAndGet();
        }, Duration.ofHours(1), Duration.ofHours(1));

        scheduler.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        scheduler.stop();

        assertEquals(1, finished.get(), "正在执行的周期不应被打断");
    }

    @Test
    void startAndStopAreIdempotent() throws InterruptedException {
        CountDownLatch firstRun = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        scheduler = newScheduler(() -> {
            runs.incrementAndGet();
            firstRun.countDown();
        }, Duration.ofHours(1), Duration.ofHours(1));

        scheduler.stop();
        assertFalse(scheduler.isRunning());

        scheduler.start();
        scheduler.start();
        assertTrue(firstRun.await(5, TimeUnit.SECONDS));
        SchedulerStatus status = scheduler.getStatus();
        assertTrue(status.isRunning());
        assertEquals(List.of("BTCUSDT"), status.getSymbols());
        assertNotNull(status.getLastRunStart());

        scheduler.stop();
        scheduler.stop();
        assertEquals(1, runs.get(), "重复 start 不应启动第二个循环");
    }

    private AgentScheduler newScheduler(AgentCycle cycle, Duration interval, Duration backoff) {
        return new AgentScheduler(cycle, interval, backoff, List.of("BTCUSDT"), Clock.systemUTC());
    }
}
