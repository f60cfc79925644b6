package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ContextAccessLevel - 上下文访问级别
 */
public enum ContextAccessLevel {

    READ("read"),
    WRITE("write"),
    READ_WRITE("read-write"),
    EXECUTE("execute");

    private final String value;

    ContextAccessLevel(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean requiresWrite() {
        return this != READ;
    }

    /**
     * 当前授予的级别是否满足请求的级别
     */
    public boolean covers(ContextAccessLevel requested) {
        switch (this) {
            case EXECUTE:
                return true;
            case READ_WRITE:
                return requested != EXECUTE;
            case WRITE:
                return requested == WRITE;
            case READ:
            default:
                return requested == READ;
        }
    }

    public static Result<ContextAccessLevel> fromValue(String value) {
        for (ContextAccessLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return Result.ok(level);
            }
        }
        return Result.fail("Unknown context access level: " + value);
    }
}
