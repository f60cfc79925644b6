package com.tencent.funcmodel.domain.model;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ModelStatus - 模型生命周期状态
 * <p>
 * draft -> published -> archived，draft -> archived；archived 为终态。
 * </p>
 */
public enum ModelStatus {

    DRAFT("draft"),
    PUBLISHED("published"),
    ARCHIVED("archived");

    private final String value;

    ModelStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(ModelStatus target) {
        switch (this) {
            case DRAFT:
                return target == PUBLISHED || target == ARCHIVED;
            case PUBLISHED:
                return target == ARCHIVED;
            default:
                return false;
        }
    }

    public static Result<ModelStatus> fromValue(String value) {
        for (ModelStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return Result.ok(status);
            }
        }
        return Result.fail("Unknown model status: " + value);
    }
}
