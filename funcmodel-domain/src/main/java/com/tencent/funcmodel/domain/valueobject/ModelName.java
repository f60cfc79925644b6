package com.tencent.funcmodel.domain.valueobject;

import com.tencent.funcmodel.domain.shared.Result;
import lombok.EqualsAndHashCode;

/**
 * ModelName - 模型/节点名称
 * <p>
 * 去除首尾空白后不能为空，最长 200 个字符，不允许控制字符。
 * </p>
 *
 * @author funcmodel
 */
@EqualsAndHashCode
public final class ModelName {

    public static final int MAX_LENGTH = 200;

    private final String value;

    private ModelName(String value) {
        this.value = value;
    }

    public static Result<ModelName> create(String value) {
        if (value == null) {
            return Result.fail("Name cannot be empty");
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Result.fail("Name cannot be empty");
        }
        if (trimmed.length() > MAX_LENGTH) {
            return Result.fail("Name cannot exceed " + MAX_LENGTH + " characters");
        }
        for (int i = 0; i < trimmed.length(); i++) {
            if (Character.isISOControl(trimmed.charAt(i))) {
                return Result.fail("Name cannot contain control characters");
            }
        }
        return Result.ok(new ModelName(trimmed));
    }

    public String getValue() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
