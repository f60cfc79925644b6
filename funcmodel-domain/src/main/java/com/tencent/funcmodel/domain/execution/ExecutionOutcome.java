package com.tencent.funcmodel.domain.execution;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ExecutionOutcome - 外部执行方上报的动作结果
 * <p>
 * failed 与 timeout 可重试；error 为终态，不重试。
 * </p>
 */
public enum ExecutionOutcome {

    STARTED("started"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMEOUT("timeout"),
    ERROR("error"),
    SKIPPED("skipped");

    private final String value;

    ExecutionOutcome(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isRetryable() {
        return this == FAILED || this == TIMEOUT;
    }

    public static Result<ExecutionOutcome> fromValue(String value) {
        for (ExecutionOutcome outcome : values()) {
            if (outcome.value.equalsIgnoreCase(value)) {
                return Result.ok(outcome);
            }
        }
        return Result.fail("Unknown execution outcome: " + value);
    }
}
