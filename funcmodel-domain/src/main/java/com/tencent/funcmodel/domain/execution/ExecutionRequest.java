package com.tencent.funcmodel.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * ExecutionRequest - 执行请求参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionRequest {

    /**
     * 守卫表达式中的 #variables
     */
    @Builder.Default
    private Map<String, Object> variables = new HashMap<>();

    /**
     * 试运行时各动作的模拟结果（key 为节点 ID），未指定的动作视为 completed
     */
    @Builder.Default
    private Map<String, ExecutionOutcome> simulatedOutcomes = new HashMap<>();

    private String requestedBy;

    public static ExecutionRequest empty() {
        return ExecutionRequest.builder().build();
    }
}
