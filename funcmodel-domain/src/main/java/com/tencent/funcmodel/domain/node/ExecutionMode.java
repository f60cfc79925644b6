package com.tencent.funcmodel.domain.node;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ExecutionMode - 兄弟动作的调度方式
 * <ul>
 *     <li>sequential: 一次只运行一个动作</li>
 *     <li>parallel: 同一父节点下的动作可并发</li>
 *     <li>conditional: 仅调度守卫表达式为真的动作，其余直接跳过</li>
 * </ul>
 */
public enum ExecutionMode {

    SEQUENTIAL("sequential"),
    PARALLEL("parallel"),
    CONDITIONAL("conditional");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<ExecutionMode> fromValue(String value) {
        for (ExecutionMode mode : values()) {
            if (mode.value.equalsIgnoreCase(value)) {
                return Result.ok(mode);
            }
        }
        return Result.fail("Unknown execution mode: " + value);
    }
}
