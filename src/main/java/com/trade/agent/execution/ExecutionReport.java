package com.trade.agent.execution;

/**
 * 一批决策的执行汇总
 */
public class ExecutionReport {

    private final int total;
    private final int completed;
    private final int failed;
    private final int holds;
    private final boolean accountStateAvailable;

    public ExecutionReport(int total, int completed, int failed, int holds, boolean accountStateAvailable) {
        this.total = total;
        this.completed = completed;
        this.failed = failed;
        this.holds = holds;
        this.accountStateAvailable = accountStateAvailable;
    }

    static ExecutionReport of(DecisionBatch batch, boolean accountStateAvailable) {
        int completed = 0;
        int failed = 0;
        int holds = 0;
        for (Decision decision : batch.getDecisions().values()) {
            if (decision.getExecutionStatus() == ExecutionStatus.COMPLETED) {
                completed++;
            } else if (decision.getExecutionStatus() == ExecutionStatus.FAILED) {
                failed++;
            }
            if (decision.getAction() == DecisionAction.HOLD) {
                holds++;
            }
        }
        return new ExecutionReport(batch.size(), completed, failed, holds, accountStateAvailable);
    }

    public int getTotal() { return total; }
    public int getCompleted() { return completed; }
    public int getFailed() { return failed; }
    /** HOLD 决策数（已计入 completed） */
    public int getHolds() { return holds; }
    public boolean isAccountStateAvailable() { return accountStateAvailable; }

    @Override
    public String toString() {
        return String.format("ExecutionReport{total=%d, completed=%d, failed=%d, hold=%d}",
                total, completed, failed, holds);
    }
}
