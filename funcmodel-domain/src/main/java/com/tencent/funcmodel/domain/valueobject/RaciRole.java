package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;

/**
 * RaciRole - RACI 责任角色
 */
public enum RaciRole {

    RESPONSIBLE("responsible"),
    ACCOUNTABLE("accountable"),
    CONSULTED("consulted"),
    INFORMED("informed");

    private final String value;

    RaciRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Result<RaciRole> fromValue(String value) {
        for (RaciRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return Result.ok(role);
            }
        }
        return Result.fail("Unknown RACI role: " + value);
    }
}
