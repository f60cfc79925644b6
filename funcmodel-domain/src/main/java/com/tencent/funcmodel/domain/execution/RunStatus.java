package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.node.ActionStatus;

/**
 * RunStatus - 动作在一次执行计划中的运行状态
 * <p>
 * 与模型上的 {@link ActionStatus} 分开保存：执行计划不会修改模型本身。
 * skipped 与 cancelled 没有对应的动作状态，映射为 inactive。
 * </p>
 */
public enum RunStatus {

    PENDING("pending", ActionStatus.ACTIVE, false),
    READY("ready", ActionStatus.ACTIVE, false),
    EXECUTING("executing", ActionStatus.EXECUTING, false),
    RETRYING("retrying", ActionStatus.RETRYING, false),
    COMPLETED("completed", ActionStatus.COMPLETED, true),
    FAILED("failed", ActionStatus.FAILED, true),
    ERROR("error", ActionStatus.ERROR, true),
    SKIPPED("skipped", ActionStatus.INACTIVE, true),
    CANCELLED("cancelled", ActionStatus.INACTIVE, true);

    private final String value;
    private final ActionStatus actionStatus;
    private final boolean terminal;

    RunStatus(String value, ActionStatus actionStatus, boolean terminal) {
        this.value = value;
        this.actionStatus = actionStatus;
        this.terminal = terminal;
    }

    public String getValue() {
        return value;
    }

    public ActionStatus toActionStatus() {
        return actionStatus;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }

    /**
     * 可以接受执行结果（隐式开始）的状态
     */
    public boolean isActive() {
        return this == READY || this == EXECUTING || this == RETRYING;
    }
}
