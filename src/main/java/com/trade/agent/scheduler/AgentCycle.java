package com.trade.agent.scheduler;

/**
 * 一次调度周期要做的工作
 */
@FunctionalInterface
public interface AgentCycle {

    void run() throws Exception;
}
