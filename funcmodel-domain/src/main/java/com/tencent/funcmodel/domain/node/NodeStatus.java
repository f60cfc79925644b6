package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * NodeStatus - 节点粗粒度状态
 * <p>
 * 所有节点共享；动作节点的 NodeStatus 由其 {@link ActionStatus} 推导，不单独存储。
 * </p>
 */
public enum NodeStatus {

    ACTIVE("active"),
    INACTIVE("inactive"),
    DRAFT("draft"),
    CONFIGURED("configured"),
    ARCHIVED("archived"),
    ERROR("error");

    private final String value;

    NodeStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<NodeStatus> fromValue(String value) {
        for (NodeStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Result.ok(status);
            }
        }
        return Result.fail("Unknown node status: " + value);
    }
}
