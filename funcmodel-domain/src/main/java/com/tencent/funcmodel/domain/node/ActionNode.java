package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;
import com.tencent.funcmodel.domain.valueobject.NodeId;
import com.tencent.funcmodel.domain.valueobject.RaciAssignment;
import com.tencent.funcmodel.domain.valueobject.RetryPolicy;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ActionNode - 动作节点
 * <p>
 * 可执行的工作单元，始终隶属于一个容器节点（parentNodeId）。
 * 粗粒度的 {@link NodeStatus} 不单独存储，而是由 {@link ActionStatus} 推导。
 * </p>
 *
 * @author funcmodel
 */
@Getter
public abstract class ActionNode extends Node {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 10;

    private final NodeId parentNodeId;

    private final int executionOrder;

    private final int priority;

    private final Long estimatedDurationMs;

    private final RetryPolicy retryPolicy;

    private final RaciAssignment raci;

    private final Map<String, Object> actionSpecificData = new LinkedHashMap<>();

    private final String condition;

    private final boolean required;

    private ActionStatus actionStatus;

    protected ActionNode(NodeAttributes attributes, ActionAttributes action) {
        super(attributes);
        this.parentNodeId = Objects.requireNonNull(action.getParentNodeId(), "parentNodeId");
        this.executionOrder = action.getExecutionOrder();
        this.priority = action.getPriority();
        this.estimatedDurationMs = action.getEstimatedDurationMs();
        this.retryPolicy = action.getRetryPolicy() == null ? RetryPolicy.none() : action.getRetryPolicy();
        this.raci = action.getRaci() == null ? RaciAssignment.empty() : action.getRaci();
        if (action.getActionSpecificData() != null) {
            this.actionSpecificData.putAll(action.getActionSpecificData());
        }
        this.condition = action.getCondition();
        this.required = action.isRequired();
        this.actionStatus = action.getActionStatus() == null ? ActionStatus.DRAFT : action.getActionStatus();
    }

    protected ActionNode(ActionNode source) {
        super(source);
        this.parentNodeId = source.parentNodeId;
        this.executionOrder = source.executionOrder;
        this.priority = source.priority;
        this.estimatedDurationMs = source.estimatedDurationMs;
        this.retryPolicy = source.retryPolicy;
        this.raci = source.raci;
        this.actionSpecificData.putAll(source.actionSpecificData);
        this.condition = source.condition;
        this.required = source.required;
        this.actionStatus = source.actionStatus;
    }

    @Override
    public abstract ActionNode copy();

    /**
     * 动作节点的执行方式即节点的 executionType
     */
    public ExecutionMode getExecutionMode() {
        return getExecutionType();
    }

    @Override
    public NodeStatus getStatus() {
        return actionStatus.toNodeStatus();
    }

    public Map<String, Object> getActionSpecificData() {
        return Collections.unmodifiableMap(actionSpecificData);
    }

    public boolean hasCondition() {
        return condition != null && !condition.isBlank();
    }

    /**
     * 按状态机迁移动作状态，非法迁移返回 CONFLICT
     */
    public Result<Void> transitionTo(ActionStatus target, Instant now) {
        if (!actionStatus.canTransitionTo(target)) {
            return Result.conflict("Invalid action status transition for " + getNodeId() + ": "
                    + actionStatus.getValue() + " -> " + target.getValue());
        }
        this.actionStatus = target;
        touch(now);
        return Result.ok();
    }

    protected static Result<String> requireText(Map<String, Object> data, String key, String message) {
        Object value = data == null ? null : data.get(key);
        if (!(value instanceof String) || ((String) value).isBlank()) {
            return Result.fail(message);
        }
        return Result.ok(((String) value).trim());
    }

    protected static Result<List<String>> optionalStringList(Map<String, Object> data, String key) {
        Object value = data == null ? null : data.get(key);
        if (value == null) {
            return Result.ok(Collections.emptyList());
        }
        if (!(value instanceof List)) {
            return Result.fail("Field " + key + " must be a list");
        }
        for (Object item : (List<?>) value) {
            if (!(item instanceof String)) {
                return Result.fail("Field " + key + " must contain only strings");
            }
        }
        @SuppressWarnings("unchecked")
        List<String> strings = (List<String>) value;
        return Result.ok(strings);
    }
}
