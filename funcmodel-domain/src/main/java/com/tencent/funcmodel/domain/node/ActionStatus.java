package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * ActionStatus - 动作节点细粒度状态
 * <p>
 * 状态机:
 * <pre>
 * draft -> configured -> active
 * draft -> active
 * active <-> inactive
 * active -> executing -> completed | failed | error
 * failed -> retrying -> executing | failed | error
 * completed | error | failed | inactive -> archived (终态)
 * </pre>
 * </p>
 *
 * @author funcmodel
 */
public enum ActionStatus {

    DRAFT("draft", NodeStatus.DRAFT),
    CONFIGURED("configured", NodeStatus.CONFIGURED),
    ACTIVE("active", NodeStatus.ACTIVE),
    INACTIVE("inactive", NodeStatus.INACTIVE),
    EXECUTING("executing", NodeStatus.ACTIVE),
    COMPLETED("completed", NodeStatus.ACTIVE),
    FAILED("failed", NodeStatus.ERROR),
    RETRYING("retrying", NodeStatus.ACTIVE),
    ARCHIVED("archived", NodeStatus.ARCHIVED),
    ERROR("error", NodeStatus.ERROR);

    private static final Map<ActionStatus, Set<ActionStatus>> TRANSITIONS = new EnumMap<>(ActionStatus.class);

    static {
        TRANSITIONS.put(DRAFT, EnumSet.of(CONFIGURED, ACTIVE));
        TRANSITIONS.put(CONFIGURED, EnumSet.of(ACTIVE));
        TRANSITIONS.put(ACTIVE, EnumSet.of(INACTIVE, EXECUTING));
        TRANSITIONS.put(INACTIVE, EnumSet.of(ACTIVE, ARCHIVED));
        TRANSITIONS.put(EXECUTING, EnumSet.of(COMPLETED, FAILED, ERROR));
        TRANSITIONS.put(COMPLETED, EnumSet.of(ARCHIVED));
        TRANSITIONS.put(FAILED, EnumSet.of(RETRYING, ARCHIVED));
        TRANSITIONS.put(RETRYING, EnumSet.of(EXECUTING, FAILED, ERROR));
        TRANSITIONS.put(ERROR, EnumSet.of(ARCHIVED));
        TRANSITIONS.put(ARCHIVED, EnumSet.noneOf(ActionStatus.class));
    }

    private final String value;
    private final NodeStatus nodeStatus;

    ActionStatus(String value, NodeStatus nodeStatus) {
        this.value = value;
        this.nodeStatus = nodeStatus;
    }

    public String getValue() {
        return value;
    }

    /**
     * 固定映射到粗粒度的节点状态
     */
    public NodeStatus toNodeStatus() {
        return nodeStatus;
    }

    public boolean canTransitionTo(ActionStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<ActionStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return this == ARCHIVED;
    }

    public static Result<ActionStatus> fromValue(String value) {
        for (ActionStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Result.ok(status);
            }
        }
        return Result.fail("Unknown action status: " + value);
    }
}
