package com.tencent.funcmodel.client.dto.data;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * ExecutionSummaryDTO - 执行或试运行的汇总结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionSummaryDTO implements Serializable {
    private static final long serialVersionUID = 1L;

    private String planId;
    private String modelId;
    private String planStatus;
    private boolean dryRun;
    private int totalActions;
    private int completed;
    private int failed;
    private int errored;
    private int skipped;
    private int cancelled;
    private int pending;
    private long estimatedDurationMs;

    /**
     * 动作节点 ID，按计划执行顺序
     */
    @Builder.Default
    private List<String> executionOrder = new ArrayList<>();

    /**
     * 动作节点 ID -> 运行状态
     */
    @Builder.Default
    private Map<String, String> actionStatuses = new LinkedHashMap<>();
}
