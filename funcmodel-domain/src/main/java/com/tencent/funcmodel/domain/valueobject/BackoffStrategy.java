package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * BackoffStrategy - 重试退避策略
 */
public enum BackoffStrategy {

    CONSTANT("constant"),
    LINEAR("linear"),
    EXPONENTIAL("exponential");

    private final String value;

    BackoffStrategy(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<BackoffStrategy> fromValue(String value) {
        for (BackoffStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value)) {
                return Result.ok(strategy);
            }
        }
        return Result.fail("Unknown backoff strategy: " + value);
    }
}
