package com.tencent.funcmodel.domain.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * MergeOptions - 合并上下文的选项
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeOptions {

    public static final String SOURCE_CONTEXTS_KEY = "_sourceContexts";

    public static final String MERGED_AT_KEY = "_mergedAt";

    /**
     * 为空时使用 FunctionModelProperties 中的默认策略
     */
    private ConflictResolution conflictResolution;

    /**
     * 是否在结果中记录来源上下文 ID 与合并时间
     */
    private boolean preserveSourceMetadata;

    public static MergeOptions defaults() {
        return MergeOptions.builder().build();
    }
}
