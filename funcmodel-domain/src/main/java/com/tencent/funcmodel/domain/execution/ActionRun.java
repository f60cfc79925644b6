package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.node.ActionNode;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * ActionRun - 单个动作在执行计划中的运行记录
 * <p>
 * 状态只由执行引擎修改。
 * </p>
 */
@Getter
@ToString(exclude = "action")
public class ActionRun {

    /**
     * 被调度的动作（已发布模型中的节点，不会被执行计划修改）
     */
    private final ActionNode action;

    private final NodeId nodeId;

    private final String name;

    private final NodeId containerId;

    private final RetryPolicy retryPolicy;

    private final boolean required;

    /**
     * 是否需要在变为可执行时先求值守卫表达式
     */
    private final boolean guarded;

    private final String condition;

    private final long estimatedDurationMs;

    private volatile RunStatus status = RunStatus.PENDING;

    private volatile int retryCount;

    /**
     * 下一次重试前建议等待的毫秒数
     */
    private volatile long nextRetryDelayMs;

    private volatile String message;

    private volatile Instant lastTransitionAt;

    public ActionRun(ActionNode action, boolean guarded, long estimatedDurationMs) {
        this.action = action;
        this.nodeId = action.getNodeId();
        this.name = action.getName().getValue();
        this.containerId = action.getParentNodeId();
        this.retryPolicy = action.getRetryPolicy();
        this.required = action.isRequired();
        this.guarded = guarded;
        this.condition = action.getCondition();
        this.estimatedDurationMs = estimatedDurationMs;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void moveTo(RunStatus target, Instant now, String reason) {
        this.status = target;
        this.lastTransitionAt = now;
        this.message = reason;
    }

    /**
     * 记录一次重试并返回其序号（从 1 开始）
     */
    public int recordRetry() {
        this.retryCount++;
        this.nextRetryDelayMs = retryPolicy.calculateDelay(retryCount);
        return retryCount;
    }
}
