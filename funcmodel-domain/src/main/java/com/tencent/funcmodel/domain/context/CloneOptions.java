package com.tencent.funcmodel.domain.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * CloneOptions - 复制上下文时排除或转换的属性
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CloneOptions {

    @Builder.Default
    private Set<String> excludeProperties = new HashSet<>();

    /**
     * 属性名 -> 转换函数，作用于复制后的值
     */
    @Builder.Default
    private Map<String, UnaryOperator<Object>> transformProperties = new LinkedHashMap<>();

    public static CloneOptions none() {
        return CloneOptions.builder().build();
    }
}
