package com.tencent.funcmodel.domain.shared;

import java.util.UUID;

/**
 * IdGenerator - 标识生成器
 * <p>
 * 由调用方显式注入，测试中可替换为确定性的实现。
 * </p>
 */
public interface IdGenerator {

    /**
     * 生成一个新的 UUID v4 字符串
     */
    String nextId();

    /**
     * 默认实现，基于 {@link UUID#randomUUID()}
     */
    static IdGenerator uuid() {
        return () -> UUID.randomUUID().toString();
    }
}
