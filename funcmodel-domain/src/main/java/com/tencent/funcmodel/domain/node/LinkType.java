package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * LinkType - 连线类型
 * <p>
 * {@link #isOrdering()} 为 true 的类型在容器之间表达执行先后依赖，参与环检测与拓扑排序。
 * </p>
 */
public enum LinkType {

    DOCUMENTS("documents", false),
    IMPLEMENTS("implements", false),
    REFERENCES("references", false),
    SUPPORTS("supports", false),
    NESTED("nested", false),
    TRIGGERS("triggers", true),
    CONSUMES("consumes", false),
    PRODUCES("produces", false),
    DEPENDENCY("dependency", true),
    REFERENCE("reference", false),
    DATA_FLOW("data_flow", true),
    CONTROL_FLOW("control_flow", true),
    AGGREGATION("aggregation", false),
    COMPOSITION("composition", false);

    private final String value;
    private final boolean ordering;

    LinkType(String value, boolean ordering) {
        this.value = value;
        this.ordering = ordering;
    }

    public String getValue() {
        return value;
    }

    public boolean isOrdering() {
        return ordering;
    }

    public static Result<LinkType> fromValue(String value) {
        for (LinkType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Result.ok(type);
            }
        }
        return Result.fail("Unknown link type: " + value);
    }
}
