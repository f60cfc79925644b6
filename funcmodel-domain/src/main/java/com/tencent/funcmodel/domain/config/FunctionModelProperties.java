package com.tencent.funcmodel.domain.config;

import com.tencent.funcmodel.domain.context.ConflictResolution;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * FunctionModelProperties - 领域服务的可调参数
 * <p>
 * 应用层从 funcmodel.properties 读取并覆盖默认值。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunctionModelProperties {

    /**
     * 上下文层级遍历的最大深度
     */
    @Builder.Default
    private int maxHierarchyDepth = 10;

    /**
     * 合并上下文时的默认冲突策略
     */
    @Builder.Default
    private ConflictResolution defaultConflictResolution = ConflictResolution.FIRST_WINS;

    /**
     * 动作未指定优先级时使用的默认值
     */
    @Builder.Default
    private int defaultActionPriority = 5;

    /**
     * 动作未指定重试策略时的最大重试次数
     */
    @Builder.Default
    private int defaultMaxRetries = 0;

    /**
     * 试运行中动作的模拟耗时（毫秒），动作未声明预计耗时时使用
     */
    @Builder.Default
    private long simulatedActionDurationMs = 1000L;

    public static FunctionModelProperties defaults() {
        return FunctionModelProperties.builder().build();
    }
}
