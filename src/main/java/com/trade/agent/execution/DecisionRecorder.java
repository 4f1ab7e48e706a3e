package com.trade.agent.execution;

import java.util.List;

/**
 * 决策记录接口
 * 保存执行后的决策批次，用于复盘和分析
 */
public interface DecisionRecorder {

    /**
     * 记录一个已执行的批次
     */
    void record(DecisionBatch batch);

    /**
     * 最近的批次，按时间先后排列
     */
    List<DecisionBatch> readRecent(int limit);
}
