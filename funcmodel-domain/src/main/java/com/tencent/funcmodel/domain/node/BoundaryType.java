package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * BoundaryType - IO 节点的边界方向
 */
public enum BoundaryType {

    INPUT("input"),
    OUTPUT("output"),
    INPUT_OUTPUT("input-output");

    private final String value;

    BoundaryType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean acceptsInput() {
        return this == INPUT || this == INPUT_OUTPUT;
    }

    public boolean producesOutput() {
        return this == OUTPUT || this == INPUT_OUTPUT;
    }

    public static Result<BoundaryType> fromValue(String value) {
        for (BoundaryType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return Result.ok(type);
            }
        }
        return Result.fail("Unknown boundary type: " + value);
    }
}
