package com.tencent.funcmodel.domain.shared;

/**
 * ErrorType - 领域失败分类
 * <p>
 * 每个失败的 {@link Result} 都携带一个分类，便于上层映射为稳定的错误码。
 * </p>
 *
 * @author funcmodel
 */
public enum ErrorType {

    /**
     * 输入非法或违反结构性不变量
     */
    VALIDATION("VALIDATION_ERROR"),

    /**
     * 引用的对象不存在
     */
    NOT_FOUND("NOT_FOUND"),

    /**
     * 当前状态不允许该操作
     */
    CONFLICT("CONFLICT"),

    /**
     * 上下文访问被拒绝
     */
    ACCESS_DENIED("ACCESS_DENIED"),

    /**
     * 未预期的内部失败
     */
    INTERNAL("INTERNAL_ERROR");

    private final String code;

    ErrorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
