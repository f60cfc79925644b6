package com.tencent.funcmodel.domain.context;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * ContextScope - 上下文的可见范围
 * <ul>
 *     <li>execution / session: 按节点层级可见</li>
 *     <li>global: 对所有节点完全可见</li>
 *     <li>isolated: 不被后代继承，也不对后代可见</li>
 *     <li>shared: 层级相关的节点可读写</li>
 * </ul>
 */
public enum ContextScope {

    EXECUTION("execution"),
    SESSION("session"),
    GLOBAL("global"),
    ISOLATED("isolated"),
    SHARED("shared");

    private final String value;

    ContextScope(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<ContextScope> fromValue(String value) {
        for (ContextScope scope : values()) {
            if (scope.value.equalsIgnoreCase(value)) {
                return Result.ok(scope);
            }
        }
        return Result.fail("Unknown context scope: " + value);
    }
}
