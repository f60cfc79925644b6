package com.tencent.funcmodel.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * ExecutionSummary - 执行结果汇总
 * <p>
 * 单个动作失败不会让整个计划调用失败，而是体现为部分失败的统计。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionSummary {

    private String planId;

    private String modelId;

    private PlanStatus planStatus;

    private boolean dryRun;

    private int totalActions;

    private int completed;

    private int failed;

    private int errored;

    private int skipped;

    private int cancelled;

    /**
     * 尚未终结的动作数
     */
    private int pending;

    /**
     * 关键路径上的预计耗时
     */
    private long estimatedDurationMs;

    /**
     * 计划中的动作顺序（节点 ID）
     */
    private List<String> executionOrder;

    /**
     * 动作 ID -> 运行状态
     */
    private Map<String, String> actionStatuses;

    public boolean isPartialFailure() {
        return (failed + errored) > 0 && completed > 0;
    }
}
