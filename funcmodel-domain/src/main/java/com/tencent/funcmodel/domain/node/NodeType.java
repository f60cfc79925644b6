package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * NodeType - 节点类型（封闭集合）
 * <p>
 * 容器节点: IO、Stage；动作节点: Tether、KB 引用、嵌套功能模型容器。
 * </p>
 *
 * @author funcmodel
 */
public enum NodeType {

    IO("ioNode", true),
    STAGE("stageNode", true),
    TETHER("tetherNode", false),
    KB("kbNode", false),
    FUNCTION_MODEL_CONTAINER("functionModelContainer", false);

    private final String value;
    private final boolean container;

    NodeType(String value, boolean container) {
        this.value = value;
        this.container = container;
    }

    public String getValue() {
        return value;
    }

    public boolean isContainer() {
        return container;
    }

    public boolean isAction() {
        return !container;
    }

    public static Result<NodeType> fromValue(String value) {
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Result.ok(type);
            }
        }
        return Result.fail("Unknown node type: " + value);
    }
}
