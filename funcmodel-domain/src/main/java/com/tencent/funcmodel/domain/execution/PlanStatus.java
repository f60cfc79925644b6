package com.tencent.funcmodel.domain.execution;

/**
 * PlanStatus - 执行计划状态
 */
public enum PlanStatus {

    PLANNED("planned", false),
    RUNNING("running", false),
    COMPLETED("completed", true),
    /**
     * 全部动作终结，但有动作失败
     */
    PARTIALLY_FAILED("partially_failed", true),
    /**
     * 必需动作失败导致计划中止
     */
    FAILED("failed", true),
    CANCELLED("cancelled", true);

    private final String value;
    private final boolean terminal;

    PlanStatus(String value, boolean terminal) {
        this.value = value;
        this.terminal = terminal;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
