package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * FailureEscalation - 重试耗尽后的终态
 * <p>
 * FAILED 表示业务失败，ERROR 表示需要人工介入的错误。
 * </p>
 */
public enum FailureEscalation {

    FAILED("failed"),
    ERROR("error");

    private final String value;

    FailureEscalation(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<FailureEscalation> fromValue(String value) {
        for (FailureEscalation escalation : values()) {
            if (escalation.value.equalsIgnoreCase(value)) {
                return Result.ok(escalation);
            }
        }
        return Result.fail("Unknown failure escalation: " + value);
    }
}
