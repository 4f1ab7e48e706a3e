package com.trade.agent.execution;

import java.util.List;

/**
 * 决策来源（分析模块的出口）
 */
public interface DecisionProvider {

    /**
     * 生成本周期的决策；没有新决策时返回空批次
     */
    DecisionBatch nextBatch(List<String> symbols);
}
