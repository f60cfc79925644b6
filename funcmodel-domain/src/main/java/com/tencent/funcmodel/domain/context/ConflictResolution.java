package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ConflictResolution - 合并多个上下文时同名属性的取值策略
 */
public enum ConflictResolution {

    /**
     * 先出现的值保留
     */
    FIRST_WINS("first-wins"),

    /**
     * 后出现的值覆盖
     */
    LAST_WINS("last-wins");

    private final String value;

    ConflictResolution(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<ConflictResolution> fromValue(String value) {
        for (ConflictResolution resolution : values()) {
            if (resolution.value.equalsIgnoreCase(value) || resolution.name().equalsIgnoreCase(value)) {
                return Result.ok(resolution);
            }
        }
        return Result.fail("Unknown conflict resolution: " + value);
    }
}
